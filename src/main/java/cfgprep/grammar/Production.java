package cfgprep.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Right hand side of a grammar production: an immutable sequence of symbols.
 *
 * The left hand side is the key under which the grammar stores the production. The empty sequence is the
 * epsilon production.
 */
public class Production {

	public static final Production EPSILON = new Production(Collections.emptyList());

	/**
	 * Symbols of the right hand side
	 */
	public final List<Symbol> right;

	public Production(List<? extends Symbol> right) {
		this.right = Collections.unmodifiableList(new ArrayList<>(right));
	}

	public static Production of(Symbol... symbols){
		return new Production(Arrays.asList(symbols));
	}

	/**
	 * Production that consists of the terminals of the passed string
	 */
	public static Production ofTerminals(String terminals){
		List<Symbol> symbols = new ArrayList<>();
		for (char c : terminals.toCharArray()){
			symbols.add(new Terminal(c));
		}
		return new Production(symbols);
	}

	public boolean isEpsilonProduction(){
		return right.isEmpty();
	}

	/**
	 * Is this a chain production, a production consisting of exactly one non terminal?
	 */
	public boolean isUnitProduction(){
		return right.size() == 1 && right.get(0).isNonTerminal();
	}

	public int size(){
		return right.size();
	}

	public Symbol get(int index){
		return right.get(index);
	}

	/**
	 * @return first symbol or null for the epsilon production
	 */
	public Symbol first(){
		return right.isEmpty() ? null : right.get(0);
	}

	public boolean startsWith(Symbol symbol){
		return !right.isEmpty() && right.get(0).equals(symbol);
	}

	/**
	 * Production without the first {@code count} symbols
	 */
	public Production drop(int count){
		return new Production(right.subList(Math.min(count, right.size()), right.size()));
	}

	public Production concat(Production other){
		List<Symbol> symbols = new ArrayList<>(right);
		symbols.addAll(other.right);
		return new Production(symbols);
	}

	public Production append(Symbol symbol){
		List<Symbol> symbols = new ArrayList<>(right);
		symbols.add(symbol);
		return new Production(symbols);
	}

	public boolean contains(Symbol symbol){
		return right.contains(symbol);
	}

	/**
	 * Non terminals used in the right hand side, in order of appearance (with duplicates)
	 */
	public List<NonTerminal> nonTerminals(){
		List<NonTerminal> nonTerminals = new ArrayList<>();
		for (Symbol symbol : right){
			if (symbol instanceof NonTerminal){
				nonTerminals.add((NonTerminal) symbol);
			}
		}
		return nonTerminals;
	}

	/**
	 * Formats the right hand side, "[n]" for the epsilon production.
	 */
	public String formatRightSide(){
		if (right.isEmpty()){
			return "[n]";
		}
		StringBuilder builder = new StringBuilder();
		for (Symbol symbol : right){
			builder.append(symbol);
		}
		return builder.toString();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Production && ((Production) obj).right.equals(right);
	}

	@Override
	public int hashCode() {
		return right.hashCode();
	}

	@Override
	public String toString() {
		return formatRightSide();
	}
}
