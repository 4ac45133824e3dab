package cfgprep.transform;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import cfgprep.grammar.Grammar;
import cfgprep.grammar.NonTerminal;
import cfgprep.grammar.Production;

import static cfgprep.util.Utils.makeArrayList;

/**
 * Prepares a grammar for recursive descent recognition.
 *
 * Left recursive grammars get their ε productions, chain productions, useless symbols and then their left
 * recursion removed. All other grammars are left factorized. Both finish with a useless symbol removal.
 */
public class Normalizer {

	private static final Logger LOG = Logger.getLogger(Normalizer.class.getName());

	private static final Transformation leftRecursionPreparation = new VanishingSymbolEliminator()
			.andThen(new ChainProductionEliminator());

	private Normalizer(){
	}

	/**
	 * @return the normalized grammar
	 * @throws cfgprep.MalformedGrammarException if the grammar derives no string
	 */
	public static Grammar normalize(Grammar grammar){
		return run(grammar).grammar;
	}

	public static NormalizationResult run(Grammar grammar){
		Set<Integer> nullable = VanishingSymbolEliminator.nullable(grammar);
		Grammar result;
		NormalizationResult.Branch branch;
		boolean reinstated = false;
		if (LeftRecursionAnalyzer.hasLeftRecursion(grammar, nullable)){
			LOG.info("Has left recursion");
			branch = NormalizationResult.Branch.LEFT_RECURSION_REMOVED;
			Grammar prepared = leftRecursionPreparation.apply(grammar);
			logStage("ε and chain production removal", prepared);
			boolean startNullable = nullable.contains(grammar.getStart());
			if (startNullable && !UselessSymbolEliminator.productive(prepared).contains(prepared.getStart())){
				// the empty word is the only word
				result = emptyWordGrammar(grammar.maxNonTerminalId() + 1);
				reinstated = true;
			} else {
				result = LeftRecursionEliminator.eliminate(UselessSymbolEliminator.removeUseless(prepared));
				logStage("left recursion removal", result);
				if (startNullable){
					result = reinstateEmptyWord(result);
					reinstated = true;
				}
			}
		} else {
			LOG.info("Performing factorization");
			branch = NormalizationResult.Branch.FACTORIZED;
			result = LeftFactorizer.factorize(grammar);
			logStage("factorization", result);
		}
		result = UselessSymbolEliminator.removeUseless(result);
		logStage("useless symbol removal", result);
		return new NormalizationResult(result, branch, reinstated);
	}

	/**
	 * Adds a new start S' → S | ε.
	 */
	static Grammar reinstateEmptyWord(Grammar grammar){
		Map<Integer, Set<Production>> rules = grammar.copyRules();
		int newStart = grammar.maxNonTerminalId() + 1;
		rules.put(newStart, new LinkedHashSet<>(makeArrayList(Production.of(grammar.getStartSymbol()),
				Production.EPSILON)));
		return new Grammar(newStart, rules);
	}

	private static Grammar emptyWordGrammar(int start){
		return new Grammar(start, Collections.singletonMap(start, makeArrayList(Production.EPSILON)));
	}

	private static void logStage(String stage, Grammar grammar){
		LOG.fine(() -> String.format("After %s: start %s, %d non terminals, %d productions", stage,
				NonTerminal.of(grammar.getStart()), grammar.getNonTerminals().size(), grammar.productionCount()));
	}
}
