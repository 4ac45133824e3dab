package cfgprep.transform;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import com.pholser.junit.quickcheck.From;
import com.pholser.junit.quickcheck.Property;
import com.pholser.junit.quickcheck.generator.GenerationStatus;
import com.pholser.junit.quickcheck.generator.Generator;
import com.pholser.junit.quickcheck.generator.GeneratorConfiguration;
import com.pholser.junit.quickcheck.random.SourceOfRandomness;
import com.pholser.junit.quickcheck.runner.JUnitQuickcheck;

import org.junit.runner.RunWith;

import cfgprep.grammar.Grammar;
import cfgprep.grammar.NonTerminal;
import cfgprep.grammar.Production;
import cfgprep.grammar.Symbol;
import cfgprep.grammar.Terminal;
import cfgprep.grammar.random.SentenceGenerator;
import cfgprep.parser.rd.FirstSetBuilder;
import cfgprep.parser.rd.RecursiveDescentRecognizer;

import static java.lang.annotation.ElementType.ANNOTATION_TYPE;
import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.ElementType.TYPE_USE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;
import static org.junit.Assume.assumeTrue;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@RunWith(JUnitQuickcheck.class)
public class NormalizerPropertyTest {

	@Target({PARAMETER, FIELD, ANNOTATION_TYPE, TYPE_USE})
	@Retention(RUNTIME)
	@GeneratorConfiguration
	public @interface GrammarConfig {

		int maxNonTerminals() default 4;

		int maxProductions() default 3;

		int maxLength() default 3;
	}

	/**
	 * Random grammars over the terminals a and b, with the start 0 and dense ids
	 */
	public static class Grammars extends Generator<Grammar> {

		private int maxNonTerminals = 4;
		private int maxProductions = 3;
		private int maxLength = 3;

		public Grammars() {
			super(Grammar.class);
		}

		public void configure(GrammarConfig config) {
			maxNonTerminals = config.maxNonTerminals();
			maxProductions = config.maxProductions();
			maxLength = config.maxLength();
		}

		@Override
		public Grammar generate(SourceOfRandomness random, GenerationStatus status) {
			int nonTerminals = random.nextInt(1, maxNonTerminals);
			Map<Integer, List<Production>> rules = new LinkedHashMap<>();
			for (int id = 0; id < nonTerminals; id++){
				List<Production> productions = new ArrayList<>();
				int count = random.nextInt(1, maxProductions);
				for (int i = 0; i < count; i++){
					List<Symbol> symbols = new ArrayList<>();
					int length = random.nextInt(0, maxLength);
					for (int j = 0; j < length; j++){
						if (random.nextBoolean()){
							symbols.add(Terminal.of(random.nextBoolean() ? 'a' : 'b'));
						} else {
							symbols.add(NonTerminal.of(random.nextInt(0, nonTerminals - 1)));
						}
					}
					productions.add(new Production(symbols));
				}
				rules.put(id, productions);
			}
			return new Grammar(0, rules);
		}
	}

	private static boolean derivesSomething(Grammar grammar){
		return UselessSymbolEliminator.productive(grammar).contains(grammar.getStart());
	}

	@Property(trials = 300)
	public void removingUselessSymbolsIsIdempotent(@From(Grammars.class) Grammar grammar){
		assumeTrue(derivesSomething(grammar));
		Grammar once = UselessSymbolEliminator.removeUseless(grammar);
		assertTrue(UselessSymbolEliminator.isFreeOfUselessSymbols(once));
		assertEquals(once, UselessSymbolEliminator.removeUseless(once));
	}

	@Property(trials = 300)
	public void vanishingEliminationRemovesEpsilonProductions(@From(Grammars.class) Grammar grammar){
		Grammar result = VanishingSymbolEliminator.eliminate(grammar);
		for (int nonTerminal : result.getNonTerminals()){
			assertFalse(result.hasEpsilonProduction(nonTerminal));
		}
	}

	@Property(trials = 300)
	public void chainEliminationRemovesUnitProductions(@From(Grammars.class) Grammar grammar){
		assertFalse(ChainProductionEliminator.hasUnitProductions(ChainProductionEliminator.eliminate(grammar)));
	}

	@Property(trials = 300)
	public void normalizedGrammarsAreParseReady(@From(Grammars.class) Grammar grammar){
		assumeTrue(derivesSomething(grammar));
		NormalizationResult result = Normalizer.run(grammar);
		assertFalse(LeftRecursionAnalyzer.hasLeftRecursion(result.grammar));
		assertTrue(UselessSymbolEliminator.isFreeOfUselessSymbols(result.grammar));
		if (result.isFactorized()){
			assertFalse(LeftFactorizer.hasCommonPrefixes(result.grammar));
		}
	}

	@Property(trials = 200)
	public void normalizationKeepsGeneratedWords(@From(Grammars.class) @GrammarConfig(maxLength = 2) Grammar grammar,
	                                             long seed){
		assumeTrue(derivesSomething(grammar));
		Grammar normalized = Normalizer.normalize(grammar);
		RecursiveDescentRecognizer recognizer = new RecursiveDescentRecognizer(normalized,
				FirstSetBuilder.build(normalized), 0);
		SentenceGenerator generator = new SentenceGenerator(grammar, new Random(seed), 2);
		for (int i = 0; i < 5; i++){
			String word = generator.generateRandomSentence();
			if (word.length() <= 12){
				assertTrue(recognizer.matches(word), word);
			}
		}
	}

	private static List<String> wordsUpTo(int length){
		List<String> words = new ArrayList<>();
		words.add("");
		for (int i = 0; i < words.size(); i++){
			if (words.get(i).length() < length){
				words.add(words.get(i) + "a");
				words.add(words.get(i) + "b");
			}
		}
		return words;
	}

	@Property(trials = 200)
	public void normalizationKeepsTheLanguage(@From(Grammars.class) Grammar grammar){
		assumeTrue(derivesSomething(grammar));
		assumeTrue(!LeftRecursionAnalyzer.hasLeftRecursion(grammar));
		Grammar normalized = Normalizer.normalize(grammar);
		RecursiveDescentRecognizer raw = new RecursiveDescentRecognizer(grammar, FirstSetBuilder.build(grammar), 0);
		RecursiveDescentRecognizer recognizer = new RecursiveDescentRecognizer(normalized,
				FirstSetBuilder.build(normalized), 0);
		for (String word : wordsUpTo(5)){
			assertEquals(raw.matches(word), recognizer.matches(word), word);
		}
	}
}
