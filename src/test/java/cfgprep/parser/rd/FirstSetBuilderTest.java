package cfgprep.parser.rd;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;

import org.junit.jupiter.api.Test;

import cfgprep.grammar.Grammar;
import cfgprep.grammar.GrammarBuilder;
import cfgprep.grammar.NonTerminal;
import cfgprep.grammar.Production;
import cfgprep.grammar.Terminal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FirstSetBuilderTest {

	/**
	 * S → Ab | c, A → a | ε
	 */
	private static final Grammar GRAMMAR = new GrammarBuilder().rule("S", "Ab|c").rule("A", "a|").toGrammar("S");

	private static final Production AB = Production.of(NonTerminal.of(1), Terminal.of('b'));

	@Test
	public void testFirstSets(){
		FirstMap map = FirstSetBuilder.build(GRAMMAR);
		assertEquals(new HashSet<>(Arrays.asList('a', 'b', 'c')), map.firstSet(0));
		assertEquals(Collections.singleton('a'), map.firstSet(1));
		assertEquals(Collections.singletonList(AB), map.first(0, 'b'));
		assertTrue(map.first(0, 'x').isEmpty());
	}

	@Test
	public void testPrediction(){
		FirstMap map = FirstSetBuilder.build(GRAMMAR);
		assertEquals(Collections.singletonList(AB), map.predict(0, 'a'));
		assertEquals(Collections.singletonList(Production.ofTerminals("c")), map.predict(0, 'c'));
		assertTrue(map.predict(0, 'x').isEmpty());
		// nullable productions are merged in declaration order
		assertEquals(Arrays.asList(Production.ofTerminals("a"), Production.EPSILON), map.predict(1, 'a'));
		assertEquals(Collections.singletonList(Production.EPSILON), map.predict(1, 'b'));
	}

	@Test
	public void testNullability(){
		Grammar grammar = new GrammarBuilder().rule("S", "AB|c").rule("A", "a|").rule("B", "A").toGrammar("S");
		FirstMap map = FirstSetBuilder.build(grammar);
		assertTrue(map.isNullable(0));
		assertFalse(map.isDirectlyNullable(0));
		assertTrue(map.isDirectlyNullable(1));
		assertTrue(map.isNullable(2));
		assertFalse(map.isDirectlyNullable(2));
		assertEquals(Collections.singletonList(Production.of(NonTerminal.of(1), NonTerminal.of(2))),
				map.nullableProductions(0));
	}

	@Test
	public void testFirstThroughNullablePrefix(){
		Grammar grammar = new GrammarBuilder().rule("S", "ABc").rule("A", "a|").rule("B", "b|").toGrammar("S");
		assertEquals(new HashSet<>(Arrays.asList('a', 'b', 'c')), FirstSetBuilder.build(grammar).firstSet(0));
	}

	@Test
	public void testMinimalYields(){
		Grammar grammar = new GrammarBuilder()
				.rule("S", "aSb|A")
				.rule("A", "aab|B")
				.rule("B", "Bb")
				.toGrammar("S");
		FirstMap map = FirstSetBuilder.build(grammar);
		assertEquals(3, map.minimalYield(0));
		assertEquals(3, map.minimalYield(1));
		assertEquals(Integer.MAX_VALUE, map.minimalYield(2));
		assertEquals(5, map.minimalYield(Production.of(Terminal.of('a'), NonTerminal.of(0), Terminal.of('b'))));
		assertEquals(Integer.MAX_VALUE, map.minimalYield(Production.of(Terminal.of('a'), NonTerminal.of(2))));
		assertEquals(0, map.minimalYield(Production.EPSILON));
	}

	@Test
	public void testTableCannotBeModified(){
		FirstMap map = FirstSetBuilder.build(GRAMMAR);
		assertThrows(UnsupportedOperationException.class, () -> map.first(0, 'b').clear());
		assertThrows(UnsupportedOperationException.class, () -> map.predict(1, 'a').add(AB));
		assertThrows(UnsupportedOperationException.class, () -> map.nullableProductions(1).remove(0));
		assertThrows(UnsupportedOperationException.class, () -> map.firstSet(0).add('x'));
		assertEquals(Arrays.asList(Production.ofTerminals("a"), Production.EPSILON), map.predict(1, 'a'));
	}
}
