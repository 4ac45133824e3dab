package cfgprep.transform;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultEdge;

import cfgprep.grammar.Grammar;
import cfgprep.grammar.NonTerminal;
import cfgprep.grammar.Production;

/**
 * Removes chain productions (A → B).
 *
 * A chain production A → B is replaced by the non chain productions of every non terminal reachable from B
 * via chain productions. Reachability is computed on the chain graph, so cycles like A → B, B → A are fine.
 *
 * Example:
 * <pre>
 * S → A | aB        S → a | b | aB
 * A → a | b    ⇒    A → a | b
 * B → e             B → e
 * </pre>
 * A may become unreachable by this.
 */
public class ChainProductionEliminator implements Transformation {

	private static final Logger LOG = Logger.getLogger(ChainProductionEliminator.class.getName());

	@Override
	public Grammar apply(Grammar grammar) {
		return eliminate(grammar);
	}

	public static Grammar eliminate(Grammar grammar){
		Graph<Integer, DefaultEdge> chains = SymbolGraphs.unitChains(grammar);
		Map<Integer, Set<Production>> rules = new LinkedHashMap<>();
		for (Map.Entry<Integer, List<Production>> entry : grammar.getRules().entrySet()){
			Set<Production> productions = new LinkedHashSet<>();
			for (Production production : entry.getValue()){
				if (!production.isUnitProduction()){
					productions.add(production);
					continue;
				}
				for (int target : SymbolGraphs.reachable(chains, ((NonTerminal) production.first()).id)){
					for (Production targetProduction : grammar.getProductions(target)){
						if (!targetProduction.isUnitProduction()){
							productions.add(targetProduction);
						}
					}
				}
			}
			rules.put(entry.getKey(), productions);
		}
		Grammar result = new Grammar(grammar.getStart(), rules);
		LOG.fine(() -> String.format("Replaced %d chain productions", chains.edgeSet().size()));
		return result;
	}

	public static boolean hasUnitProductions(Grammar grammar){
		for (Map.Entry<Integer, Production> entry : grammar){
			if (entry.getValue().isUnitProduction()){
				return true;
			}
		}
		return false;
	}
}
