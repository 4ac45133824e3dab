package cfgprep.grammar.random;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import cfgprep.Config;
import cfgprep.GrammarException;
import cfgprep.grammar.Grammar;
import cfgprep.grammar.NonTerminal;
import cfgprep.grammar.Production;
import cfgprep.grammar.Symbol;
import cfgprep.grammar.Terminal;

/**
 * A generator of random sentences that are valid for a given grammar.
 *
 * Productions are chosen uniformly among the productive ones. Below the maximum depth only productions of
 * minimal height are used, so that every expansion ends.
 */
public class SentenceGenerator {

	private static final int INFINITE = Integer.MAX_VALUE;

	private final Grammar grammar;
	private final Random rand;
	private final int maxDepth;
	/**
	 * Height of the lowest derivation tree per non terminal
	 */
	private final Map<Integer, Integer> heights = new HashMap<>();

	public SentenceGenerator(Grammar grammar, long seed) {
		this(grammar, new Random(seed), Config.generatorDepth());
	}

	public SentenceGenerator(Grammar grammar, Random rand, int maxDepth) {
		this.grammar = grammar;
		this.rand = rand;
		this.maxDepth = maxDepth;
		calculateHeights();
	}

	private void calculateHeights(){
		for (int nonTerminal : grammar.getNonTerminals()){
			heights.put(nonTerminal, INFINITE);
		}
		boolean somethingChanged;
		do {
			somethingChanged = false;
			for (int nonTerminal : grammar.getNonTerminals()){
				for (Production production : grammar.getProductions(nonTerminal)){
					int height = height(production);
					if (height < heights.get(nonTerminal)){
						heights.put(nonTerminal, height);
						somethingChanged = true;
					}
				}
			}
		} while (somethingChanged);
	}

	private int height(Production production){
		int height = 1;
		for (NonTerminal nonTerminal : production.nonTerminals()){
			int sub = heights.get(nonTerminal.id);
			if (sub == INFINITE){
				return INFINITE;
			}
			height = Math.max(height, sub + 1);
		}
		return height;
	}

	/**
	 * @return a random word of the grammar's language
	 * @throws GrammarException if the start non terminal derives no word
	 */
	public String generateRandomSentence(){
		if (heights.get(grammar.getStart()) == INFINITE){
			throw new GrammarException(String.format("%s derives no word", grammar.getStartSymbol()));
		}
		StringBuilder builder = new StringBuilder();
		generate(grammar.getStart(), 0, builder);
		return builder.toString();
	}

	private void generate(int nonTerminal, int depth, StringBuilder builder){
		Production production = choose(grammar.getProductions(nonTerminal), depth >= maxDepth, heights.get(nonTerminal));
		for (Symbol symbol : production.right){
			if (symbol instanceof Terminal){
				builder.append(((Terminal) symbol).character);
			} else {
				generate(((NonTerminal) symbol).id, depth + 1, builder);
			}
		}
	}

	/**
	 * Chooses a random production, only among the lowest ones if {@code lowest} is set.
	 */
	private Production choose(List<Production> productions, boolean lowest, int minHeight){
		int count = 0;
		Production chosen = null;
		for (Production production : productions){
			int height = height(production);
			if (height == INFINITE || (lowest && height != minHeight)){
				continue;
			}
			// reservoir sampling
			count++;
			if (rand.nextInt(count) == 0){
				chosen = production;
			}
		}
		return chosen;
	}
}
