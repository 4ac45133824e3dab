package cfgprep;

import java.io.IOException;
import java.io.PrintStream;
import java.util.Iterator;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import com.martiansoftware.jsap.stringparsers.FileStringParser;
import com.martiansoftware.jsap.stringparsers.IntegerStringParser;
import com.martiansoftware.jsap.stringparsers.LongStringParser;

import cfgprep.grammar.Grammar;
import cfgprep.grammar.random.SentenceGenerator;
import cfgprep.loader.GrammarParser;
import cfgprep.loader.WordListParser;
import cfgprep.parser.rd.RecursiveDescentRecognizer;
import cfgprep.transform.LeftRecursionAnalyzer;
import cfgprep.transform.NormalizationResult;
import cfgprep.transform.Normalizer;
import cfgprep.util.Pair;
import cfgprep.util.Utils;

/**
 * Command line interface: normalizes a grammar file and checks the words of a word list against it.
 *
 * Exit codes: 0 if every word was classified as expected, 1 if some weren't and 2 for usage, syntax and
 * grammar errors.
 */
public class Main {

	private static final Logger LOG = Logger.getLogger(Main.class.getName());

	/**
	 * Parent of all loggers of this project, referenced here so that its configuration isn't garbage collected
	 */
	private static final Logger PROJECT_LOG = Logger.getLogger("cfgprep");

	public static final int EXIT_OK = 0;
	public static final int EXIT_FAILURES = 1;
	public static final int EXIT_ERROR = 2;

	public static void main(String[] args) {
		System.exit(run(args, System.out, System.err));
	}

	private static JSAP createParser() throws JSAPException {
		JSAP jsap = new JSAP();
		jsap.registerParameter(new Switch("help", 'h', "help", "print this help message"));
		jsap.registerParameter(new Switch("verbose", 'v', "verbose", "log every normalization stage"));
		jsap.registerParameter(new Switch("nonormalize", JSAP.NO_SHORTFLAG, "no-normalize",
				"recognize with the grammar as it is, only possible for grammars without left recursion"));
		jsap.registerParameter(new FlaggedOption("steps", LongStringParser.getParser(), null, false,
				JSAP.NO_SHORTFLAG, "steps", "maximum number of recognizer steps per word, 0 = no limit"));
		jsap.registerParameter(new FlaggedOption("generate", IntegerStringParser.getParser(), null, false,
				'g', "generate", "print <generate> random words of the normalized grammar"));
		jsap.registerParameter(new FlaggedOption("seed", LongStringParser.getParser(), "0", false,
				's', "seed", "seed of the random word generator"));
		jsap.registerParameter(new UnflaggedOption("grammar", FileStringParser.getParser().setMustExist(true),
				null, true, false, "grammar file, one rule like <0> ::= a<1>|b per line"));
		jsap.registerParameter(new UnflaggedOption("words", FileStringParser.getParser().setMustExist(true),
				null, false, false, "word list with [true] and [false] sections"));
		return jsap;
	}

	/**
	 * Runs the command line interface without exiting.
	 *
	 * @return exit code
	 */
	public static int run(String[] args, PrintStream out, PrintStream err){
		JSAP jsap;
		JSAPResult config;
		try {
			jsap = createParser();
			config = jsap.parse(args);
		} catch (JSAPException e) {
			throw new IllegalStateException(e);
		}
		if (config.getBoolean("help")){
			printUsage(jsap, out);
			return EXIT_OK;
		}
		if (!config.success()){
			for (Iterator<?> errors = config.getErrorMessageIterator(); errors.hasNext(); ){
				err.println("Error: " + errors.next());
			}
			printUsage(jsap, err);
			return EXIT_ERROR;
		}
		setupLogging(config.getBoolean("verbose") ? Level.FINE : Config.logLevel());
		if (config.contains("steps")){
			Config.set("maxRecognitionSteps", String.valueOf(config.getLong("steps")));
		}
		try {
			return process(config, out);
		} catch (GrammarException e) {
			err.println(e.getMessage());
			return EXIT_ERROR;
		} catch (IOException e) {
			err.println("Can't read input: " + e.getMessage());
			return EXIT_ERROR;
		}
	}

	private static int process(JSAPResult config, PrintStream out) throws IOException {
		Grammar grammar = GrammarParser.parse(config.getFile("grammar").toPath());
		out.println("Initial grammar");
		out.println(grammar);
		Grammar used;
		if (config.getBoolean("nonormalize")){
			if (LeftRecursionAnalyzer.hasLeftRecursion(grammar)){
				throw new MalformedGrammarException("Grammar is left recursive, it has to be normalized");
			}
			used = grammar;
		} else {
			NormalizationResult result = Normalizer.run(grammar);
			out.println("Normalized grammar, " + result.branch
					+ (result.emptyWordReinstated ? ", empty word reinstated" : ""));
			out.println(result.grammar);
			used = result.grammar;
		}
		if (config.contains("generate")){
			SentenceGenerator generator = new SentenceGenerator(used, config.getLong("seed"));
			for (int i = 0; i < config.getInt("generate"); i++){
				out.println(Utils.toPrintableRepresentation(generator.generateRandomSentence()));
			}
		}
		if (!config.contains("words")){
			return EXIT_OK;
		}
		return checkWords(new RecursiveDescentRecognizer(used), WordListParser.parse(config.getFile("words").toPath()), out);
	}

	/**
	 * Prints every word that isn't classified as expected.
	 *
	 * @return exit code
	 */
	static int checkWords(RecursiveDescentRecognizer recognizer, List<Pair<String, Boolean>> words, PrintStream out){
		int failures = 0;
		for (Pair<String, Boolean> word : words){
			boolean actual = recognizer.matches(word.first);
			if (actual != word.second){
				out.println(actual + " " + word.first);
				failures++;
			}
		}
		if (failures == 0){
			out.println("all cases passed");
			return EXIT_OK;
		}
		out.println(failures + " of " + words.size() + " cases failed");
		LOG.fine(failures + " failures");
		return EXIT_FAILURES;
	}

	private static void setupLogging(Level level){
		for (Handler handler : PROJECT_LOG.getHandlers()){
			PROJECT_LOG.removeHandler(handler);
		}
		ConsoleHandler handler = new ConsoleHandler();
		handler.setLevel(level);
		PROJECT_LOG.addHandler(handler);
		PROJECT_LOG.setLevel(level);
		PROJECT_LOG.setUseParentHandlers(false);
	}

	private static void printUsage(JSAP jsap, PrintStream stream){
		stream.println("Usage: cfgprep " + jsap.getUsage());
		stream.println(jsap.getHelp());
	}
}
