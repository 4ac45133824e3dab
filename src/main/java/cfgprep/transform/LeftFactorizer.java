package cfgprep.transform;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import cfgprep.grammar.Grammar;
import cfgprep.grammar.NonTerminal;
import cfgprep.grammar.Production;
import cfgprep.grammar.Symbol;

/**
 * Left factorization: afterwards the productions of every non terminal start with pairwise different
 * symbols.
 *
 * The productions that share a first symbol are replaced by their longest common prefix p followed by a new
 * non terminal, whose productions are the rest after p:
 * <pre>
 * S → aAB | aAC | b    ⇒    S  → aAS' | b
 *                           S' → B | C
 * </pre>
 * The new non terminals are factorized in turn. This is the grammar that a prefix tree of the productions
 * describes, with every fork becoming a non terminal.
 */
public class LeftFactorizer implements Transformation {

	private static final Logger LOG = Logger.getLogger(LeftFactorizer.class.getName());

	@Override
	public Grammar apply(Grammar grammar) {
		return factorize(grammar);
	}

	public static Grammar factorize(Grammar grammar){
		Map<Integer, Set<Production>> rules = grammar.copyRules();
		Deque<Integer> worklist = new ArrayDeque<>(rules.keySet());
		int nextNonTerminal = grammar.maxNonTerminalId() + 1;
		int created = 0;
		while (!worklist.isEmpty()){
			int current = worklist.poll();
			Map<Symbol, List<Production>> groups = new LinkedHashMap<>();
			List<Production> order = new ArrayList<>();
			for (Production production : rules.get(current)){
				if (production.isEpsilonProduction()){
					order.add(production);
					continue;
				}
				if (!groups.containsKey(production.first())){
					groups.put(production.first(), new ArrayList<>());
					order.add(production);
				}
				groups.get(production.first()).add(production);
			}
			Set<Production> productions = new LinkedHashSet<>();
			for (Production production : order){
				List<Production> group = production.isEpsilonProduction() ? null : groups.get(production.first());
				if (group == null || group.size() == 1){
					productions.add(production);
					continue;
				}
				int prefixLength = commonPrefixLength(group);
				NonTerminal rest = NonTerminal.of(nextNonTerminal++);
				Set<Production> remainders = new LinkedHashSet<>();
				for (Production member : group){
					remainders.add(member.drop(prefixLength));
				}
				rules.put(rest.id, remainders);
				worklist.add(rest.id);
				productions.add(new Production(production.right.subList(0, prefixLength)).append(rest));
				created++;
			}
			rules.put(current, productions);
		}
		int newNonTerminals = created;
		LOG.fine(() -> String.format("Factorization added %d non terminals", newNonTerminals));
		return new Grammar(grammar.getStart(), rules);
	}

	/**
	 * Length of the longest common prefix of the passed (distinct) productions
	 */
	static int commonPrefixLength(List<Production> productions){
		int length = 0;
		while (true){
			Symbol symbol = null;
			for (Production production : productions){
				if (production.size() <= length){
					return length;
				}
				if (symbol == null){
					symbol = production.get(length);
				} else if (!symbol.equals(production.get(length))){
					return length;
				}
			}
			length++;
		}
	}

	/**
	 * Do two productions of a non terminal start with the same symbol?
	 */
	public static boolean hasCommonPrefixes(Grammar grammar){
		for (List<Production> productions : grammar.getRules().values()){
			Set<Symbol> firstSymbols = new LinkedHashSet<>();
			for (Production production : productions){
				if (!production.isEpsilonProduction() && !firstSymbols.add(production.first())){
					return true;
				}
			}
		}
		return false;
	}
}
