package cfgprep.transform;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import cfgprep.MalformedGrammarException;
import cfgprep.grammar.Grammar;
import cfgprep.grammar.NonTerminal;
import cfgprep.grammar.Production;
import cfgprep.grammar.Symbol;

/**
 * Removes dead (non productive) and unreachable non terminals.
 *
 * Dead non terminals are removed first: dropping them can make other non terminals unreachable, but
 * dropping unreachable ones never makes a non terminal dead.
 */
public class UselessSymbolEliminator implements Transformation {

	private static final Logger LOG = Logger.getLogger(UselessSymbolEliminator.class.getName());

	@Override
	public Grammar apply(Grammar grammar) {
		return removeUseless(grammar);
	}

	public static Grammar removeUseless(Grammar grammar){
		Grammar result = removeUnreachable(removeDead(grammar));
		LOG.fine(() -> String.format("Removed %d useless non terminals",
				grammar.getNonTerminals().size() - result.getNonTerminals().size()));
		return result;
	}

	/**
	 * Calculate the productive non terminals, the ones that derive at least one string of terminals.
	 */
	public static Set<Integer> productive(Grammar grammar){
		Set<Integer> productive = new HashSet<>();
		boolean somethingChanged;
		do {
			somethingChanged = false;
			for (Map.Entry<Integer, List<Production>> entry : grammar.getRules().entrySet()){
				if (productive.contains(entry.getKey())){
					continue;
				}
				for (Production production : entry.getValue()){
					if (consistsOf(production, productive)){
						productive.add(entry.getKey());
						somethingChanged = true;
						break;
					}
				}
			}
		} while (somethingChanged);
		return productive;
	}

	/**
	 * Does the production only consist of terminals and of non terminals contained in the passed set?
	 */
	static boolean consistsOf(Production production, Set<Integer> nonTerminals){
		for (Symbol symbol : production.right){
			if (symbol instanceof NonTerminal && !nonTerminals.contains(((NonTerminal) symbol).id)){
				return false;
			}
		}
		return true;
	}

	/**
	 * Removes the non productive non terminals and all productions that use them.
	 *
	 * @throws MalformedGrammarException if the start non terminal isn't productive
	 */
	public static Grammar removeDead(Grammar grammar){
		Set<Integer> productive = productive(grammar);
		if (!productive.contains(grammar.getStart())){
			throw new MalformedGrammarException(String.format("Start non terminal %s derives no terminal string",
					grammar.getStartSymbol()));
		}
		Map<Integer, Set<Production>> rules = new LinkedHashMap<>();
		for (Map.Entry<Integer, List<Production>> entry : grammar.getRules().entrySet()){
			if (!productive.contains(entry.getKey())){
				continue;
			}
			Set<Production> productions = new LinkedHashSet<>();
			for (Production production : entry.getValue()){
				if (consistsOf(production, productive)){
					productions.add(production);
				}
			}
			rules.put(entry.getKey(), productions);
		}
		return new Grammar(grammar.getStart(), rules);
	}

	/**
	 * Calculate the non terminals that are reachable from the start non terminal.
	 */
	public static Set<Integer> reachable(Grammar grammar){
		Set<Integer> reached = new LinkedHashSet<>();
		Deque<Integer> depthFirstStack = new ArrayDeque<>();
		depthFirstStack.push(grammar.getStart());
		reached.add(grammar.getStart());
		while (!depthFirstStack.isEmpty()){
			int current = depthFirstStack.pop();
			for (Production production : grammar.getProductions(current)){
				for (NonTerminal nonTerminal : production.nonTerminals()){
					if (reached.add(nonTerminal.id)){
						depthFirstStack.push(nonTerminal.id);
					}
				}
			}
		}
		return reached;
	}

	public static Grammar removeUnreachable(Grammar grammar){
		Set<Integer> reached = reachable(grammar);
		Map<Integer, List<Production>> rules = new LinkedHashMap<>();
		for (Map.Entry<Integer, List<Production>> entry : grammar.getRules().entrySet()){
			if (reached.contains(entry.getKey())){
				rules.put(entry.getKey(), entry.getValue());
			}
		}
		return new Grammar(grammar.getStart(), rules);
	}

	/**
	 * Is every non terminal productive and reachable?
	 */
	public static boolean isFreeOfUselessSymbols(Grammar grammar){
		Set<Integer> all = grammar.getNonTerminals();
		return productive(grammar).containsAll(all) && reachable(grammar).containsAll(all);
	}
}
