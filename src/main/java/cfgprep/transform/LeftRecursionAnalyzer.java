package cfgprep.transform;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.jgrapht.Graph;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultEdge;

import cfgprep.MalformedGrammarException;
import cfgprep.grammar.Grammar;

/**
 * Detects left recursion and orders non terminals for its removal.
 *
 * A grammar is left recursive if a non terminal A derives A α in one or more steps. Leading nullable non
 * terminals are skipped, so A → B A with a nullable B counts as left recursive too.
 */
public class LeftRecursionAnalyzer {

	private LeftRecursionAnalyzer(){
	}

	public static boolean hasLeftRecursion(Grammar grammar){
		return hasLeftRecursion(grammar, VanishingSymbolEliminator.nullable(grammar));
	}

	/**
	 * @param nullable ids of the non terminals that derive the empty word
	 */
	public static boolean hasLeftRecursion(Grammar grammar, Set<Integer> nullable){
		Graph<Integer, DefaultEdge> graph = SymbolGraphs.canStartWith(grammar, nullable);
		for (DefaultEdge edge : graph.edgeSet()){
			if (graph.getEdgeSource(edge).equals(graph.getEdgeTarget(edge))){
				return true;
			}
		}
		return new CycleDetector<>(graph).detectCycles();
	}

	/**
	 * Non terminals that are part of a left recursive cycle, in ascending order.
	 */
	public static Set<Integer> leftRecursiveNonTerminals(Grammar grammar){
		Graph<Integer, DefaultEdge> graph = SymbolGraphs.canStartWith(grammar, VanishingSymbolEliminator.nullable(grammar));
		Set<Integer> result = new TreeSet<>(new CycleDetector<>(graph).findCycles());
		for (DefaultEdge edge : graph.edgeSet()){
			if (graph.getEdgeSource(edge).equals(graph.getEdgeTarget(edge))){
				result.add(graph.getEdgeSource(edge));
			}
		}
		return result;
	}

	/**
	 * Orders the non terminals by their distance from the start non terminal in the reference graph, ties
	 * are broken by id. Non terminals that can't be reached come last.
	 *
	 * @throws MalformedGrammarException if the grammar has no non terminals
	 */
	public static List<Integer> order(Grammar grammar){
		if (grammar.getNonTerminals().isEmpty()){
			throw new MalformedGrammarException("Grammar has no non terminals to order");
		}
		return SymbolGraphs.sortByDistance(grammar.getNonTerminals(),
				SymbolGraphs.distances(SymbolGraphs.references(grammar), grammar.getStart()));
	}
}
