package cfgprep.loader;

import java.nio.file.Path;
import java.nio.file.Paths;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import cfgprep.GrammarSyntaxException;
import cfgprep.MalformedGrammarException;
import cfgprep.grammar.Grammar;
import cfgprep.grammar.GrammarBuilder;
import cfgprep.grammar.NonTerminal;
import cfgprep.grammar.Production;
import cfgprep.grammar.Terminal;
import cfgprep.parser.rd.RecursiveDescentRecognizer;
import cfgprep.transform.Normalizer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GrammarParserTest {

	@Test
	public void testSimpleGrammar(){
		Grammar grammar = GrammarParser.parse("<0> ::= a<1>|b|\n<1> ::= c");
		Grammar expected = new GrammarBuilder().rule("S", "aA|b|").rule("A", "c").toGrammar("S");
		assertEquals(expected, grammar);
	}

	@Test
	public void testEscapes(){
		Grammar grammar = GrammarParser.parse("<0> ::= \\<<0>\\>|\\||\\\\");
		assertEquals(Production.of(Terminal.of('<'), NonTerminal.of(0), Terminal.of('>')), grammar.getProductions(0).get(0));
		assertEquals(Production.ofTerminals("|"), grammar.getProductions(0).get(1));
		assertEquals(Production.ofTerminals("\\"), grammar.getProductions(0).get(2));
	}

	@Test
	public void testStartIsZero(){
		Grammar grammar = GrammarParser.parse("\n<1> ::= a\n\n<0> ::= <1>b\n");
		assertEquals(0, grammar.getStart());
		Grammar normalized = Normalizer.normalize(grammar);
		assertTrue(RecursiveDescentRecognizer.matches(normalized, "ab"));
		assertFalse(RecursiveDescentRecognizer.matches(normalized, "a"));
	}

	@Test
	public void testMissingStartHasNoProductions(){
		Grammar grammar = GrammarParser.parse("<3> ::= <1>a\n<1> ::= b");
		assertEquals(0, grammar.getStart());
		assertTrue(grammar.getProductions(0).isEmpty());
		assertEquals(3, grammar.getNonTerminals().size());
		assertThrows(MalformedGrammarException.class, () -> Normalizer.normalize(grammar));
	}

	@Test
	public void testSpaces(){
		Grammar grammar = GrammarParser.parse("  < 0 >   ::=  a b  ");
		assertEquals(Production.ofTerminals("a b"), grammar.getProductions(0).get(0));
	}

	@Test
	public void testRulesAreMerged(){
		Grammar grammar = GrammarParser.parse("<0> ::= a\n<0> ::= b|a");
		assertEquals(2, grammar.getProductions(0).size());
		assertEquals(Production.ofTerminals("a"), grammar.getProductions(0).get(0));
	}

	@Test
	public void testUndefinedNonTerminal(){
		Grammar grammar = GrammarParser.parse("<0> ::= a<7>");
		assertTrue(grammar.getProductions(7).isEmpty());
	}

	@Test
	public void testFormatCanBeParsed(){
		Grammar grammar = new GrammarBuilder().rule("S", "<A>|a\\|").rule("A", "|||b").toGrammar("S");
		assertEquals(grammar, GrammarParser.parse(grammar.format()));
	}

	@Test
	public void testFile() throws Exception {
		Path file = Paths.get(GrammarParserTest.class.getResource("/grammars/arithmetic.grammar").toURI());
		Grammar grammar = GrammarParser.parse(file);
		assertEquals(3, grammar.getNonTerminals().size());
		assertEquals(6, grammar.productionCount());
	}

	@ParameterizedTest
	@CsvSource(delimiter = ';', value = {
			"<0> a; 1; 6",
			"<0> ::= a ::= b; 1; 11",
			"0 ::= a; 1; 1",
			"<a> ::= a; 1; 2",
			"<0> ::= \\a; 1; 9",
			"<0> ::= <1; 1; 9",
			"<0> ::= <1<2>>; 1; 11",
			"<0> ::= a>; 1; 10",
			"<0> ::= a\n<1> ::= <x>; 2; 10"
	})
	public void testSyntaxErrors(String grammar, int line, int column){
		GrammarSyntaxException exception = assertThrows(GrammarSyntaxException.class,
				() -> GrammarParser.parse(grammar.replace("\\n", "\n")));
		assertEquals(new Location(line, column), exception.errorLocation);
	}

	@Test
	public void testEmptyInput(){
		assertThrows(GrammarSyntaxException.class, () -> GrammarParser.parse("\n  \n"));
	}
}
