package cfgprep.transform;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.traverse.BreadthFirstIterator;

import cfgprep.grammar.Grammar;
import cfgprep.grammar.NonTerminal;
import cfgprep.grammar.Symbol;

/**
 * Directed graphs over the non terminal ids of a grammar.
 */
public class SymbolGraphs {

	private SymbolGraphs(){
	}

	private static Graph<Integer, DefaultEdge> emptyGraph(Grammar grammar){
		Graph<Integer, DefaultEdge> graph = new DefaultDirectedGraph<>(DefaultEdge.class);
		for (int nonTerminal : grammar.getNonTerminals()){
			graph.addVertex(nonTerminal);
		}
		return graph;
	}

	/**
	 * Edge A → B for every occurrence of B in a production of A.
	 */
	public static Graph<Integer, DefaultEdge> references(Grammar grammar){
		Graph<Integer, DefaultEdge> graph = emptyGraph(grammar);
		grammar.forEachProduction((left, production) -> {
			for (NonTerminal nonTerminal : production.nonTerminals()){
				graph.addEdge(left, nonTerminal.id);
			}
		});
		return graph;
	}

	/**
	 * Edge A → B for every chain production A → B.
	 */
	public static Graph<Integer, DefaultEdge> unitChains(Grammar grammar){
		Graph<Integer, DefaultEdge> graph = emptyGraph(grammar);
		grammar.forEachProduction((left, production) -> {
			if (production.isUnitProduction()){
				graph.addEdge(left, ((NonTerminal) production.first()).id);
			}
		});
		return graph;
	}

	/**
	 * The "can start with" relation: edge A → B if a production of A is A → α B β with α consisting only of
	 * nullable non terminals.
	 *
	 * @param nullable ids of the non terminals that derive the empty word
	 */
	public static Graph<Integer, DefaultEdge> canStartWith(Grammar grammar, Set<Integer> nullable){
		Graph<Integer, DefaultEdge> graph = emptyGraph(grammar);
		grammar.forEachProduction((left, production) -> {
			for (Symbol symbol : production.right){
				if (symbol.isTerminal()){
					break;
				}
				int id = ((NonTerminal) symbol).id;
				graph.addEdge(left, id);
				if (!nullable.contains(id)){
					break;
				}
			}
		});
		return graph;
	}

	/**
	 * Vertices reachable from the passed one (including itself), in breadth first order.
	 */
	public static Set<Integer> reachable(Graph<Integer, DefaultEdge> graph, int from){
		Set<Integer> reached = new LinkedHashSet<>();
		new BreadthFirstIterator<>(graph, from).forEachRemaining(reached::add);
		return reached;
	}

	/**
	 * Length of the shortest path from the passed vertex to every vertex reachable from it.
	 */
	public static Map<Integer, Integer> distances(Graph<Integer, DefaultEdge> graph, int from){
		BreadthFirstIterator<Integer, DefaultEdge> iterator = new BreadthFirstIterator<>(graph, from);
		Map<Integer, Integer> distances = new LinkedHashMap<>();
		while (iterator.hasNext()){
			int vertex = iterator.next();
			distances.put(vertex, iterator.getDepth(vertex));
		}
		return distances;
	}

	/**
	 * Sorts the passed ids by the passed distances (missing ones last), ties are broken by the id.
	 */
	public static List<Integer> sortByDistance(Collection<Integer> ids, Map<Integer, Integer> distances){
		List<Integer> sorted = new ArrayList<>(ids);
		sorted.sort(Comparator.<Integer>comparingInt(id -> distances.getOrDefault(id, Integer.MAX_VALUE))
				.thenComparingInt(id -> id));
		return sorted;
	}
}
