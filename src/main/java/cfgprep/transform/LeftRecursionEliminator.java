package cfgprep.transform;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import cfgprep.grammar.Grammar;
import cfgprep.grammar.NonTerminal;
import cfgprep.grammar.Production;

/**
 * Removes left recursion with Paull's algorithm.
 *
 * Expects a grammar without ε and chain productions, otherwise hidden left recursion can survive.
 *
 * Substituting the productions of earlier non terminals (A before B in the order) turns indirect left
 * recursion into direct left recursion:
 * <pre>
 * A → Bab | b | c              A → Bab | b | c
 * B → Aa | d | e          ⇒    B → Baba | ba | ca | d | e
 * </pre>
 * Direct left recursion:
 * <pre>
 * A → Aas | Ab | a | b    ⇒    A  → a | b | aA' | bA'
 *                              A' → as | b | asA' | bA'
 * </pre>
 */
public class LeftRecursionEliminator implements Transformation {

	private static final Logger LOG = Logger.getLogger(LeftRecursionEliminator.class.getName());

	@Override
	public Grammar apply(Grammar grammar) {
		return eliminate(grammar);
	}

	public static Grammar eliminate(Grammar grammar){
		List<Integer> order = LeftRecursionAnalyzer.order(grammar);
		Map<Integer, Set<Production>> rules = grammar.copyRules();
		int nextNonTerminal = grammar.maxNonTerminalId() + 1;
		for (int i = 0; i < order.size(); i++){
			int current = order.get(i);
			Set<Production> productions = rules.get(current);
			for (int j = 0; j < i; j++){
				productions = substituteLeading(productions, order.get(j), rules.get(order.get(j)));
			}
			List<Production> alphas = new ArrayList<>();
			List<Production> betas = new ArrayList<>();
			NonTerminal self = NonTerminal.of(current);
			for (Production production : productions){
				if (production.startsWith(self)){
					// A → A is a no-op
					if (production.size() > 1){
						alphas.add(production.drop(1));
					}
				} else {
					betas.add(production);
				}
			}
			if (alphas.isEmpty()){
				rules.put(current, new LinkedHashSet<>(betas));
				continue;
			}
			NonTerminal dash = NonTerminal.of(nextNonTerminal++);
			rules.put(current, withSuffix(betas, dash));
			rules.put(dash.id, withSuffix(alphas, dash));
			LOG.fine(() -> String.format("Split direct left recursion of %s, new non terminal %s", self, dash));
		}
		return new Grammar(grammar.getStart(), rules);
	}

	/**
	 * Replaces every production that starts with the passed non terminal by its productions.
	 */
	private static Set<Production> substituteLeading(Set<Production> productions, int nonTerminal,
	                                                 Set<Production> replacements){
		NonTerminal leading = NonTerminal.of(nonTerminal);
		Set<Production> result = new LinkedHashSet<>();
		for (Production production : productions){
			if (production.startsWith(leading)){
				for (Production replacement : replacements){
					result.add(replacement.concat(production.drop(1)));
				}
			} else {
				result.add(production);
			}
		}
		return result;
	}

	/**
	 * {γ₁, …, γₙ} ∪ {γ₁X, …, γₙX}
	 */
	private static Set<Production> withSuffix(List<Production> productions, NonTerminal suffix){
		Set<Production> result = new LinkedHashSet<>(productions);
		for (Production production : productions){
			result.add(production.append(suffix));
		}
		return result;
	}
}
