package cfgprep.loader;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import cfgprep.GrammarSyntaxException;
import cfgprep.util.Pair;

import static cfgprep.util.Pair.p;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class WordListParserTest {

	@Test
	public void testSections(){
		List<Pair<String, Boolean>> words = WordListParser.parse("[true]\nab\n\n[false]\nba\n[true]\nc\n");
		assertEquals(Arrays.asList(p("ab", true), p("", true), p("ba", false), p("c", true)), words);
	}

	@Test
	public void testBlankLinesBeforeFirstHeader(){
		assertEquals(Arrays.asList(p("a", false)), WordListParser.parse("\n\n[false]\na"));
		assertTrue(WordListParser.parse("").isEmpty());
	}

	@Test
	public void testWordsAreKeptVerbatim(){
		assertEquals(Arrays.asList(p(" a ", true), p("[x]", true)), WordListParser.parse("[true]\n a \n[x]"));
	}

	@Test
	public void testWordBeforeHeader(){
		GrammarSyntaxException exception = assertThrows(GrammarSyntaxException.class,
				() -> WordListParser.parse("\nab\n[true]\n"));
		assertEquals(new Location(2, 1), exception.errorLocation);
	}

	@Test
	public void testFile() throws Exception {
		Path file = Paths.get(WordListParserTest.class.getResource("/grammars/arithmetic.words").toURI());
		List<Pair<String, Boolean>> words = WordListParser.parse(file);
		assertEquals(11, words.size());
		assertEquals(p("", false), words.get(5));
	}
}
