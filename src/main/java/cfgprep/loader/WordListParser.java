package cfgprep.loader;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import cfgprep.GrammarSyntaxException;
import cfgprep.util.Pair;

import static cfgprep.util.Pair.p;

/**
 * Parses word lists of the form
 * <pre>
 * [true]
 * ab
 *
 * [false]
 * ba
 * </pre>
 * The headers set whether the following words should be accepted. Each other line is a word, an empty
 * line is the empty word. Blank lines before the first header are ignored.
 */
public class WordListParser {

	public static final String ACCEPTED_HEADER = "[true]";
	public static final String REJECTED_HEADER = "[false]";

	private WordListParser(){
	}

	public static List<Pair<String, Boolean>> parse(String words){
		try {
			return parse(new StringReader(words));
		} catch (IOException e) {
			throw new IllegalStateException(e);
		}
	}

	public static List<Pair<String, Boolean>> parse(Path file) throws IOException {
		try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			return parse(reader);
		}
	}

	/**
	 * @return words paired with the expectation whether they are part of the language
	 * @throws GrammarSyntaxException if a word appears before the first header
	 */
	public static List<Pair<String, Boolean>> parse(Reader reader) throws IOException {
		List<Pair<String, Boolean>> words = new ArrayList<>();
		BufferedReader bufferedReader = new BufferedReader(reader);
		Boolean expected = null;
		int lineNumber = 0;
		String line;
		while ((line = bufferedReader.readLine()) != null){
			lineNumber++;
			if (line.equals(ACCEPTED_HEADER)){
				expected = true;
			} else if (line.equals(REJECTED_HEADER)){
				expected = false;
			} else if (expected == null){
				if (!line.trim().isEmpty()){
					throw new GrammarSyntaxException(new Location(lineNumber, 1),
							"Expected " + ACCEPTED_HEADER + " or " + REJECTED_HEADER + " before the first word");
				}
			} else {
				words.add(p(line, expected));
			}
		}
		return words;
	}
}
