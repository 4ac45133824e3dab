package cfgprep.grammar;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.BiConsumer;

import cfgprep.MalformedGrammarException;

import static cfgprep.util.Utils.join;

/**
 * Immutable grammar: a start non terminal plus a mapping from non terminal ids to their productions.
 *
 * Every non terminal referenced in a production has to be a key of the mapping, a key may have no
 * productions. The productions of a non terminal keep their insertion order (it's the order in which the
 * recognizer tries them) and contain no duplicates.
 *
 * Use the {@link GrammarBuilder} to build a grammar from names.
 */
public class Grammar implements Iterable<Map.Entry<Integer, Production>> {

	private final int start;

	private final Map<Integer, List<Production>> rules;

	/**
	 * Create a new Grammar object
	 *
	 * Removes duplicate productions.
	 *
	 * @param start id of the start non terminal
	 * @param rules productions per non terminal id
	 * @throws MalformedGrammarException if the start or a referenced non terminal isn't a key of the rules
	 */
	public Grammar(int start, Map<Integer, ? extends Collection<Production>> rules) {
		this.start = start;
		Map<Integer, List<Production>> copy = new LinkedHashMap<>();
		for (Map.Entry<Integer, ? extends Collection<Production>> entry : rules.entrySet()){
			copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(entry.getValue()))));
		}
		this.rules = Collections.unmodifiableMap(copy);
		checkClosure();
	}

	private void checkClosure(){
		if (rules.isEmpty()){
			throw new MalformedGrammarException("Grammar has no non terminals");
		}
		if (!rules.containsKey(start)){
			throw new MalformedGrammarException(String.format("Start non terminal %s has no rules", NonTerminal.of(start)));
		}
		forEachProduction((left, production) -> {
			for (NonTerminal nonTerminal : production.nonTerminals()){
				if (!rules.containsKey(nonTerminal.id)){
					throw new MalformedGrammarException(String.format("Production %s → %s references undeclared non terminal %s",
							NonTerminal.of(left), production, nonTerminal));
				}
			}
		});
	}

	public int getStart(){
		return start;
	}

	public NonTerminal getStartSymbol(){
		return NonTerminal.of(start);
	}

	/**
	 * Ids of all non terminals, in insertion order
	 */
	public Set<Integer> getNonTerminals(){
		return rules.keySet();
	}

	public boolean hasNonTerminal(int id){
		return rules.containsKey(id);
	}

	public List<Production> getProductions(int nonTerminal){
		List<Production> productions = rules.get(nonTerminal);
		if (productions == null){
			throw new MalformedGrammarException("No such non terminal " + NonTerminal.of(nonTerminal));
		}
		return productions;
	}

	public List<Production> getProductions(NonTerminal nonTerminal){
		return getProductions(nonTerminal.id);
	}

	/**
	 * Unmodifiable view of the rules
	 */
	public Map<Integer, List<Production>> getRules(){
		return rules;
	}

	/**
	 * Rules as a fresh mutable map that transformations can work on.
	 */
	public Map<Integer, Set<Production>> copyRules(){
		Map<Integer, Set<Production>> copy = new LinkedHashMap<>();
		for (Map.Entry<Integer, List<Production>> entry : rules.entrySet()){
			copy.put(entry.getKey(), new LinkedHashSet<>(entry.getValue()));
		}
		return copy;
	}

	public int productionCount(){
		int count = 0;
		for (List<Production> productions : rules.values()){
			count += productions.size();
		}
		return count;
	}

	public void forEachProduction(BiConsumer<Integer, Production> consumer){
		for (Map.Entry<Integer, List<Production>> entry : rules.entrySet()){
			for (Production production : entry.getValue()){
				consumer.accept(entry.getKey(), production);
			}
		}
	}

	/**
	 * Iterates over all (left hand side, production) pairs.
	 */
	@Override
	public Iterator<Map.Entry<Integer, Production>> iterator() {
		List<Map.Entry<Integer, Production>> entries = new ArrayList<>();
		forEachProduction((left, production) -> entries.add(new HashMap.SimpleImmutableEntry<>(left, production)));
		return entries.iterator();
	}

	/**
	 * Maximal non terminal id, including the start.
	 */
	public int maxNonTerminalId(){
		int max = start;
		for (int id : rules.keySet()){
			max = Math.max(max, id);
		}
		return max;
	}

	public boolean hasEpsilonProduction(int nonTerminal){
		return getProductions(nonTerminal).contains(Production.EPSILON);
	}

	/**
	 * Returns a new grammar with the same rules but another start non terminal.
	 */
	public Grammar withStart(int newStart){
		return new Grammar(newStart, rules);
	}

	/**
	 * Relabels the non terminals in breadth first order of appearance, starting with the start non terminal
	 * as 0. Keys that aren't reachable from the start get the following ids in ascending order of their old
	 * ids.
	 *
	 * Two grammars that only differ in the naming of their non terminals are equal after renumbering
	 * (as long as their production orders agree).
	 */
	public Grammar renumber(){
		Map<Integer, Integer> newIds = new LinkedHashMap<>();
		Queue<Integer> queue = new ArrayDeque<>();
		newIds.put(start, 0);
		queue.add(start);
		while (!queue.isEmpty()){
			int current = queue.poll();
			for (Production production : rules.get(current)){
				for (NonTerminal nonTerminal : production.nonTerminals()){
					if (!newIds.containsKey(nonTerminal.id)){
						newIds.put(nonTerminal.id, newIds.size());
						queue.add(nonTerminal.id);
					}
				}
			}
		}
		for (int id : new TreeSet<>(rules.keySet())){
			if (!newIds.containsKey(id)){
				newIds.put(id, newIds.size());
			}
		}
		Map<Integer, List<Production>> renamed = new LinkedHashMap<>();
		for (Map.Entry<Integer, Integer> entry : newIds.entrySet()){
			List<Production> productions = new ArrayList<>();
			for (Production production : rules.get(entry.getKey())){
				List<Symbol> symbols = new ArrayList<>();
				for (Symbol symbol : production.right){
					if (symbol instanceof NonTerminal){
						symbols.add(NonTerminal.of(newIds.get(((NonTerminal) symbol).id)));
					} else {
						symbols.add(symbol);
					}
				}
				productions.add(new Production(symbols));
			}
			renamed.put(entry.getValue(), productions);
		}
		return new Grammar(0, renamed);
	}

	/**
	 * Formats the grammar in the textual format read by the {@link cfgprep.loader.GrammarParser}, the start
	 * non terminal first. Non terminals without productions are omitted.
	 */
	public String format(){
		List<String> lines = new ArrayList<>();
		List<Integer> order = new ArrayList<>();
		order.add(start);
		for (int id : rules.keySet()){
			if (id != start){
				order.add(id);
			}
		}
		for (int id : order){
			List<Production> productions = rules.get(id);
			if (productions.isEmpty()){
				continue;
			}
			List<String> alternatives = new ArrayList<>();
			for (Production production : productions){
				StringBuilder builder = new StringBuilder();
				for (Symbol symbol : production.right){
					if (symbol instanceof Terminal){
						char c = ((Terminal) symbol).character;
						if (c == '<' || c == '>' || c == '|' || c == '\\'){
							builder.append('\\');
						}
						builder.append(c);
					} else {
						builder.append(symbol);
					}
				}
				alternatives.add(builder.toString());
			}
			lines.add(NonTerminal.of(id) + " ::= " + join(alternatives, "|"));
		}
		return join(lines, "\n");
	}

	/**
	 * Two grammars are equal if they have the same start and the same set of productions per non terminal.
	 * The order of the productions is ignored.
	 */
	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Grammar)){
			return false;
		}
		Grammar other = (Grammar) obj;
		if (start != other.start || !rules.keySet().equals(other.rules.keySet())){
			return false;
		}
		for (Map.Entry<Integer, List<Production>> entry : rules.entrySet()){
			if (!new HashSet<>(entry.getValue()).equals(new HashSet<>(other.rules.get(entry.getKey())))){
				return false;
			}
		}
		return true;
	}

	@Override
	public int hashCode() {
		int hash = start;
		for (Map.Entry<Integer, List<Production>> entry : rules.entrySet()){
			hash += Objects.hash(entry.getKey(), new HashSet<>(entry.getValue()));
		}
		return hash;
	}

	/**
	 * Table like representation:
	 * <pre>
	 * Grammar
	 * Initial non-terminal: 0
	 * 0 -> a<1> | b
	 * </pre>
	 * The empty production is printed as "[n]", a row is wrapped after every ten productions.
	 */
	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder("Grammar\nInitial non-terminal: ").append(start).append("\n");
		int maxIdLength = 0;
		int maxProductionLength = 0;
		for (Map.Entry<Integer, Production> entry : this){
			maxIdLength = Math.max(maxIdLength, String.valueOf(entry.getKey()).length());
			maxProductionLength = Math.max(maxProductionLength, entry.getValue().formatRightSide().length());
		}
		String productionFormat = "%-" + (maxProductionLength + 1) + "s";
		String idFormat = "%" + Math.max(maxIdLength, 1) + "d -> ";
		for (Map.Entry<Integer, List<Production>> entry : rules.entrySet()){
			builder.append(String.format(idFormat, entry.getKey()));
			List<Production> productions = entry.getValue();
			for (int i = 0; i < productions.size(); i++){
				builder.append(String.format(productionFormat, productions.get(i).formatRightSide()));
				if (i % 10 == 9 && i != productions.size() - 1){
					builder.append("\n");
					for (int j = 0; j < maxIdLength + 4; j++){
						builder.append(' ');
					}
				} else if (i != productions.size() - 1){
					builder.append("| ");
				}
			}
			builder.append("\n");
		}
		return builder.toString();
	}
}
