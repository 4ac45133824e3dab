package cfgprep.grammar;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import cfgprep.GrammarException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GrammarBuilderTest {

	@Test
	public void testIdsInOrderOfAppearance(){
		GrammarBuilder builder = new GrammarBuilder().add("S", 'a', "B", "C").add("C", "S", 'c');
		assertEquals(Integer.valueOf(0), builder.getIds().get("S"));
		assertEquals(Integer.valueOf(1), builder.getIds().get("B"));
		assertEquals(Integer.valueOf(2), builder.getIds().get("C"));
	}

	@Test
	public void testAdd(){
		Grammar grammar = new GrammarBuilder()
				.add("S", 'a', new Object[]{"A", 'b'})
				.add("S", "")
				.add("A", 'c')
				.toGrammar("S");
		assertEquals(Arrays.asList(Production.of(Terminal.of('a'), NonTerminal.of(1), Terminal.of('b')),
				Production.EPSILON), grammar.getProductions(0));
		assertEquals(Arrays.asList(Production.ofTerminals("c")), grammar.getProductions(1));
	}

	@Test
	public void testCompactRules(){
		Grammar compact = new GrammarBuilder().rule("S", "aS'|").rule("S'", "bS").toGrammar("S");
		Grammar explicit = new GrammarBuilder().add("S", 'a', "S'").add("S", "").add("S'", 'b', "S").toGrammar("S");
		assertEquals(explicit, compact);
	}

	@Test
	public void testDeclaredNonTerminalHasNoProductions(){
		Grammar grammar = new GrammarBuilder().rule("S", "a").declare("B").toGrammar("S");
		assertTrue(grammar.getProductions(1).isEmpty());
	}

	@Test
	public void testInvalidInput(){
		assertThrows(GrammarException.class, () -> new GrammarBuilder().id(""));
		assertThrows(GrammarException.class, () -> new GrammarBuilder().add("S", 1));
	}
}
