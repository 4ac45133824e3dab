package cfgprep.parser.rd;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import cfgprep.grammar.Grammar;
import cfgprep.grammar.NonTerminal;
import cfgprep.grammar.Production;
import cfgprep.grammar.Symbol;
import cfgprep.grammar.Terminal;
import cfgprep.transform.VanishingSymbolEliminator;
import cfgprep.util.Utils;

/**
 * Builds the {@link FirstMap} of a grammar.
 *
 * Similar to the algorithm presented in the Dragon Book:
 *
 *   1. For each non terminal, compute whether it is nullable.
 *
 *   2. Do the following until no FIRST set is changed: for each production A → X₁…Xₙ add FIRST(X₁) to
 *   FIRST(A), and FIRST(X₂) too if X₁ is nullable, and so on. FIRST(t) = {t} for a terminal t.
 *
 * Productions starting with non terminals are handled, so this works for grammars that still have some.
 */
public class FirstSetBuilder {

	private final Grammar grammar;
	private final Set<Integer> nullable;
	private final Map<Integer, Set<Character>> firstSets = new HashMap<>();

	private FirstSetBuilder(Grammar grammar){
		this.grammar = grammar;
		this.nullable = VanishingSymbolEliminator.nullable(grammar);
	}

	public static FirstMap build(Grammar grammar){
		return new FirstSetBuilder(grammar).build();
	}

	private FirstMap build(){
		calculateFirstSets();
		Map<Integer, Map<Character, List<Production>>> first = new LinkedHashMap<>();
		Map<Integer, Map<Character, List<Production>>> predictions = new LinkedHashMap<>();
		Map<Integer, List<Production>> nullableProductions = new LinkedHashMap<>();
		Set<Integer> directlyNullable = new HashSet<>();
		for (Map.Entry<Integer, List<Production>> entry : grammar.getRules().entrySet()){
			int nonTerminal = entry.getKey();
			Map<Character, List<Production>> row = new LinkedHashMap<>();
			List<Production> nullableProds = new ArrayList<>();
			Map<Production, Set<Character>> productionFirsts = new HashMap<>();
			for (Production production : entry.getValue()){
				if (production.isEpsilonProduction()){
					directlyNullable.add(nonTerminal);
				}
				if (VanishingSymbolEliminator.isNullable(production, nullable)){
					nullableProds.add(production);
				}
				Set<Character> productionFirst = firstOf(production);
				productionFirsts.put(production, productionFirst);
				for (char terminal : productionFirst){
					row.computeIfAbsent(terminal, t -> new ArrayList<>()).add(production);
				}
			}
			Map<Character, List<Production>> predictionRow = new LinkedHashMap<>();
			for (char terminal : row.keySet()){
				List<Production> candidates = new ArrayList<>();
				for (Production production : entry.getValue()){
					if (productionFirsts.get(production).contains(terminal) || nullableProds.contains(production)){
						candidates.add(production);
					}
				}
				predictionRow.put(terminal, candidates);
			}
			first.put(nonTerminal, row);
			predictions.put(nonTerminal, predictionRow);
			nullableProductions.put(nonTerminal, nullableProds);
		}
		return new FirstMap(first, predictions, nullableProductions, directlyNullable, calculateMinimalYields());
	}

	private void calculateFirstSets(){
		for (int nonTerminal : grammar.getNonTerminals()){
			firstSets.put(nonTerminal, new LinkedHashSet<>());
		}
		boolean firstChanged;
		do {
			firstChanged = false;
			for (Map.Entry<Integer, List<Production>> entry : grammar.getRules().entrySet()){
				Set<Character> set = firstSets.get(entry.getKey());
				for (Production production : entry.getValue()){
					if (set.addAll(firstOf(production))){
						firstChanged = true;
					}
				}
			}
		} while (firstChanged);
	}

	/**
	 * First set of the production, based on the current first sets of the non terminals
	 */
	private Set<Character> firstOf(Production production){
		Set<Character> set = new LinkedHashSet<>();
		for (Symbol symbol : production.right){
			if (symbol instanceof Terminal){
				set.add(((Terminal) symbol).character);
				break;
			}
			int id = ((NonTerminal) symbol).id;
			set.addAll(firstSets.get(id));
			if (!nullable.contains(id)){
				break;
			}
		}
		return set;
	}

	/**
	 * Shortest derivable word length per non terminal, by fix point iteration starting from infinity.
	 */
	private Map<Integer, Integer> calculateMinimalYields(){
		Map<Integer, Integer> yields = new HashMap<>();
		for (int nonTerminal : grammar.getNonTerminals()){
			yields.put(nonTerminal, Integer.MAX_VALUE);
		}
		boolean somethingChanged;
		do {
			somethingChanged = false;
			for (Map.Entry<Integer, List<Production>> entry : grammar.getRules().entrySet()){
				for (Production production : entry.getValue()){
					int yield = 0;
					for (Symbol symbol : production.right){
						yield = Utils.saturatedAdd(yield, symbol instanceof Terminal ? 1 : yields.get(((NonTerminal) symbol).id));
					}
					if (yield < yields.get(entry.getKey())){
						yields.put(entry.getKey(), yield);
						somethingChanged = true;
					}
				}
			}
		} while (somethingChanged);
		return yields;
	}
}
