package cfgprep.transform;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import cfgprep.grammar.Grammar;
import cfgprep.grammar.GrammarBuilder;
import cfgprep.grammar.NonTerminal;
import cfgprep.grammar.Production;
import cfgprep.grammar.Terminal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LeftFactorizerTest {

	@Test
	public void testCommonPrefix(){
		Grammar grammar = new GrammarBuilder()
				.rule("S", "aAB|aAC")
				.rule("A", "a")
				.rule("B", "b")
				.rule("C", "c")
				.toGrammar("S");
		assertTrue(LeftFactorizer.hasCommonPrefixes(grammar));
		Grammar expected = new GrammarBuilder()
				.declare("S").declare("A").declare("B").declare("C")
				.rule("S", "aAT")
				.rule("A", "a")
				.rule("B", "b")
				.rule("C", "c")
				.rule("T", "B|C")
				.toGrammar("S");
		Grammar result = LeftFactorizer.factorize(grammar);
		assertEquals(expected, result);
		assertFalse(LeftFactorizer.hasCommonPrefixes(result));
	}

	@Test
	public void testPrefixIsWholeProduction(){
		Grammar grammar = new GrammarBuilder().rule("S", "ab|a").toGrammar("S");
		Grammar expected = new GrammarBuilder().rule("S", "aT").rule("T", "b|").toGrammar("S");
		assertEquals(expected, LeftFactorizer.factorize(grammar));
	}

	@Test
	public void testNestedPrefixes(){
		Grammar grammar = new GrammarBuilder().rule("S", "abc|abd|ae|f").toGrammar("S");
		Grammar expected = new GrammarBuilder()
				.rule("S", "aT|f")
				.rule("T", "bU|e")
				.rule("U", "c|d")
				.toGrammar("S");
		Grammar result = LeftFactorizer.factorize(grammar);
		assertEquals(expected, result);
		assertFalse(LeftFactorizer.hasCommonPrefixes(result));
	}

	@Test
	public void testKeepsOrderOfFirstOccurrence(){
		Grammar grammar = new GrammarBuilder().rule("S", "b|ab|c|ac|").toGrammar("S");
		Grammar result = LeftFactorizer.factorize(grammar);
		assertEquals(Arrays.asList(Production.ofTerminals("b"), Production.of(Terminal.of('a'), NonTerminal.of(1)),
				Production.ofTerminals("c"), Production.EPSILON), result.getProductions(0));
	}

	@Test
	public void testCommonPrefixLength(){
		assertEquals(2, LeftFactorizer.commonPrefixLength(Arrays.asList(Production.ofTerminals("abc"),
				Production.ofTerminals("abd"), Production.ofTerminals("ab"))));
		assertEquals(0, LeftFactorizer.commonPrefixLength(Arrays.asList(Production.ofTerminals("a"),
				Production.EPSILON)));
	}
}
