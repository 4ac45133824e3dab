package cfgprep.loader;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import cfgprep.GrammarSyntaxException;
import cfgprep.grammar.Grammar;
import cfgprep.grammar.NonTerminal;
import cfgprep.grammar.Production;
import cfgprep.grammar.Symbol;
import cfgprep.grammar.Terminal;

/**
 * Parses grammars in the format
 * <pre>
 * &lt;0&gt; ::= a&lt;1&gt;|b|
 * &lt;1&gt; ::= \&lt;&lt;0&gt;\&gt;
 * </pre>
 * One rule per line, {@code <0>} is the start non terminal. Non terminals are integer
 * ids in angle brackets, every other character is a terminal, an empty alternative is ε. The characters
 * {@code < > | \} have to be escaped with a backslash to be used as terminals. Whitespace around the right
 * side is ignored, inside of it spaces are terminals. Blank lines are ignored.
 *
 * Non terminals that are used but never defined have no productions, this includes {@code <0>}.
 */
public class GrammarParser {

	private static final String DEFINES = "::=";

	public static final int START = 0;

	private final Map<Integer, Set<Production>> rules = new LinkedHashMap<>();
	private int lineNumber = 0;

	private GrammarParser(){
	}

	public static Grammar parse(String grammar){
		try {
			return parse(new StringReader(grammar));
		} catch (IOException e) {
			throw new IllegalStateException(e);
		}
	}

	public static Grammar parse(Path file) throws IOException {
		try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			return parse(reader);
		}
	}

	/**
	 * @throws GrammarSyntaxException if the input isn't a valid grammar
	 */
	public static Grammar parse(Reader reader) throws IOException {
		GrammarParser parser = new GrammarParser();
		BufferedReader bufferedReader = new BufferedReader(reader);
		String line;
		while ((line = bufferedReader.readLine()) != null){
			parser.parseLine(line);
		}
		if (parser.rules.isEmpty()){
			throw new GrammarSyntaxException(new Location(1, 1), "Grammar has no rules");
		}
		parser.declare(START);
		return new Grammar(START, parser.rules);
	}

	private void parseLine(String line){
		lineNumber++;
		if (line.trim().isEmpty()){
			return;
		}
		int definesIndex = line.indexOf(DEFINES);
		if (definesIndex == -1){
			throw error(line.length() + 1, "Expected '" + DEFINES + "'");
		}
		if (line.indexOf(DEFINES, definesIndex + DEFINES.length()) != -1){
			throw error(line.indexOf(DEFINES, definesIndex + DEFINES.length()) + 1, "More than one '" + DEFINES + "'");
		}
		int left = parseLeftSide(line.substring(0, definesIndex));
		Set<Production> productions = declare(left);
		int from = definesIndex + DEFINES.length();
		int to = line.length();
		while (from < to && Character.isWhitespace(line.charAt(from))){
			from++;
		}
		while (to > from && Character.isWhitespace(line.charAt(to - 1))){
			to--;
		}
		for (Production production : parseAlternatives(line, from, to)){
			productions.add(production);
		}
	}

	private Set<Production> declare(int nonTerminal){
		return rules.computeIfAbsent(nonTerminal, id -> new LinkedHashSet<>());
	}

	private int parseLeftSide(String leftSide){
		String trimmed = leftSide.trim();
		int column = leftSide.indexOf(trimmed) + 1;
		if (trimmed.length() < 3 || trimmed.charAt(0) != '<' || trimmed.charAt(trimmed.length() - 1) != '>'){
			throw error(column, "Expected a non terminal like <0> on the left side");
		}
		return parseId(trimmed.substring(1, trimmed.length() - 1), column + 1);
	}

	private int parseId(String id, int column){
		try {
			return Integer.parseInt(id.trim());
		} catch (NumberFormatException e) {
			throw error(column, "Invalid non terminal id '" + id + "'");
		}
	}

	private List<Production> parseAlternatives(String line, int from, int to){
		List<Production> productions = new ArrayList<>();
		List<Symbol> current = new ArrayList<>();
		int i = from;
		while (i < to){
			char c = line.charAt(i);
			switch (c){
				case '|':
					productions.add(new Production(current));
					current = new ArrayList<>();
					i++;
					break;
				case '\\':
					if (i + 1 >= to || "<>|\\".indexOf(line.charAt(i + 1)) == -1){
						throw error(i + 1, "Only <, >, | and \\ can be escaped");
					}
					current.add(Terminal.of(line.charAt(i + 1)));
					i += 2;
					break;
				case '<':
					int end = line.indexOf('>', i);
					if (end == -1 || end >= to){
						throw error(i + 1, "Unterminated non terminal");
					}
					int nested = line.indexOf('<', i + 1);
					if (nested != -1 && nested < end){
						throw error(nested + 1, "'<' inside of a non terminal");
					}
					int id = parseId(line.substring(i + 1, end), i + 2);
					declare(id);
					current.add(NonTerminal.of(id));
					i = end + 1;
					break;
				case '>':
					throw error(i + 1, "Unexpected '>'");
				default:
					current.add(Terminal.of(c));
					i++;
			}
		}
		productions.add(new Production(current));
		return productions;
	}

	private GrammarSyntaxException error(int column, String message){
		return new GrammarSyntaxException(new Location(lineNumber, column), message);
	}
}
