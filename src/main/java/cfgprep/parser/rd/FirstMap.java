package cfgprep.parser.rd;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import cfgprep.grammar.NonTerminal;
import cfgprep.grammar.Production;
import cfgprep.grammar.Symbol;
import cfgprep.grammar.Terminal;
import cfgprep.util.Utils;

/**
 * Prediction table of a grammar, built by the {@link FirstSetBuilder}.
 *
 * Maps a non terminal and a terminal to the productions of the non terminal whose derivations can start
 * with the terminal. Also knows which productions can derive the empty word.
 */
public class FirstMap {

	/**
	 * non terminal → terminal → productions whose first set contains the terminal, in declaration order
	 */
	private final Map<Integer, Map<Character, List<Production>>> first;

	/**
	 * non terminal → terminal → the productions from {@link #first} and the nullable productions, merged in
	 * declaration order
	 */
	private final Map<Integer, Map<Character, List<Production>>> predictions;

	private final Map<Integer, List<Production>> nullableProductions;

	private final Set<Integer> directlyNullable;

	private final Map<Integer, Integer> minimalYields;

	FirstMap(Map<Integer, Map<Character, List<Production>>> first,
	         Map<Integer, Map<Character, List<Production>>> predictions,
	         Map<Integer, List<Production>> nullableProductions, Set<Integer> directlyNullable,
	         Map<Integer, Integer> minimalYields) {
		this.first = freezeTable(first);
		this.predictions = freezeTable(predictions);
		this.nullableProductions = freezeRow(nullableProductions);
		this.directlyNullable = Collections.unmodifiableSet(directlyNullable);
		this.minimalYields = Collections.unmodifiableMap(minimalYields);
	}

	private static <K> Map<K, List<Production>> freezeRow(Map<K, List<Production>> row){
		Map<K, List<Production>> frozen = new LinkedHashMap<>();
		for (Map.Entry<K, List<Production>> entry : row.entrySet()){
			frozen.put(entry.getKey(), Collections.unmodifiableList(entry.getValue()));
		}
		return Collections.unmodifiableMap(frozen);
	}

	private static Map<Integer, Map<Character, List<Production>>> freezeTable(
			Map<Integer, Map<Character, List<Production>>> table){
		Map<Integer, Map<Character, List<Production>>> frozen = new LinkedHashMap<>();
		for (Map.Entry<Integer, Map<Character, List<Production>>> entry : table.entrySet()){
			frozen.put(entry.getKey(), freezeRow(entry.getValue()));
		}
		return Collections.unmodifiableMap(frozen);
	}

	/**
	 * Productions of the non terminal whose derivations can start with the passed terminal
	 */
	public List<Production> first(int nonTerminal, char terminal){
		return first.getOrDefault(nonTerminal, Collections.emptyMap()).getOrDefault(terminal, Collections.emptyList());
	}

	/**
	 * Terminals that can start a derivation of the non terminal
	 */
	public Set<Character> firstSet(int nonTerminal){
		return first.getOrDefault(nonTerminal, Collections.emptyMap()).keySet();
	}

	/**
	 * Productions that might match an input that continues with the passed terminal at the current
	 * position: those that start with it and those that derive the empty word.
	 */
	public List<Production> predict(int nonTerminal, char terminal){
		List<Production> productions = predictions.getOrDefault(nonTerminal, Collections.emptyMap()).get(terminal);
		return productions != null ? productions : nullableProductions(nonTerminal);
	}

	/**
	 * Productions that can derive the empty word, the only candidates at the end of the input
	 */
	public List<Production> nullableProductions(int nonTerminal){
		return nullableProductions.getOrDefault(nonTerminal, Collections.emptyList());
	}

	public boolean isNullable(int nonTerminal){
		return !nullableProductions(nonTerminal).isEmpty();
	}

	/**
	 * Has the non terminal an ε production?
	 */
	public boolean isDirectlyNullable(int nonTerminal){
		return directlyNullable.contains(nonTerminal);
	}

	/**
	 * Length of the shortest word the non terminal derives, {@link Integer#MAX_VALUE} if there's none.
	 */
	public int minimalYield(int nonTerminal){
		return minimalYields.getOrDefault(nonTerminal, Integer.MAX_VALUE);
	}

	public int minimalYield(Symbol symbol){
		if (symbol instanceof Terminal){
			return 1;
		}
		return minimalYield(((NonTerminal) symbol).id);
	}

	public int minimalYield(Production production){
		int yield = 0;
		for (Symbol symbol : production.right){
			yield = Utils.saturatedAdd(yield, minimalYield(symbol));
		}
		return yield;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (Map.Entry<Integer, Map<Character, List<Production>>> entry : first.entrySet()){
			builder.append(NonTerminal.of(entry.getKey())).append(" = {");
			for (Map.Entry<Character, List<Production>> row : entry.getValue().entrySet()){
				builder.append(" ").append(row.getKey()).append(" = ").append(row.getValue());
			}
			if (isDirectlyNullable(entry.getKey())){
				builder.append(" [n]");
			}
			builder.append(" }\n");
		}
		return builder.toString();
	}
}
