package cfgprep.parser.rd;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import cfgprep.Config;
import cfgprep.RecognitionBudgetException;
import cfgprep.grammar.Grammar;
import cfgprep.grammar.NonTerminal;
import cfgprep.grammar.Production;
import cfgprep.grammar.Symbol;
import cfgprep.grammar.Terminal;
import cfgprep.util.Utils;

/**
 * Recursive descent recognizer with prediction and ordered backtracking.
 *
 * The recursion is kept on an explicit stack of (cursor, predicted symbols) frames: a frame whose prediction
 * starts with a terminal consumes it, one that starts with a non terminal is replaced by one frame per
 * candidate production. Candidates are pushed in reverse so that they're tried in declaration order.
 * A word is accepted if some frame consumed it completely with nothing left to predict.
 *
 * Works for every grammar without (hidden) left recursion. Exponential in the worst case, use
 * {@link Config#maxRecognitionSteps()} to bound the work per word.
 *
 * Instances are immutable and can be shared between threads.
 */
public class RecursiveDescentRecognizer {

	private static final Logger LOG = Logger.getLogger(RecursiveDescentRecognizer.class.getName());

	public final Grammar grammar;

	public final FirstMap firstMap;

	private final long maxSteps;

	public RecursiveDescentRecognizer(Grammar grammar){
		this(grammar, FirstSetBuilder.build(grammar));
	}

	public RecursiveDescentRecognizer(Grammar grammar, FirstMap firstMap){
		this(grammar, firstMap, Config.maxRecognitionSteps());
	}

	/**
	 * @param maxSteps maximum number of frames looked at per word, 0 for no limit
	 */
	public RecursiveDescentRecognizer(Grammar grammar, FirstMap firstMap, long maxSteps){
		this.grammar = grammar;
		this.firstMap = firstMap;
		this.maxSteps = maxSteps;
	}

	/**
	 * Does the grammar derive the passed word?
	 */
	public static boolean matches(Grammar grammar, String word){
		return new RecursiveDescentRecognizer(grammar).matches(word);
	}

	/**
	 * Does the grammar derive the passed word?
	 *
	 * @throws RecognitionBudgetException if more than the allowed number of steps are needed
	 */
	public boolean matches(String word){
		Deque<StackFrame> stack = new ArrayDeque<>();
		push(stack, new StackFrame(0, Prediction.prepend(Production.of(grammar.getStartSymbol()), null, firstMap)),
				word.length());
		long steps = 0;
		while (!stack.isEmpty()){
			StackFrame frame = stack.pop();
			steps++;
			if (maxSteps > 0 && steps > maxSteps){
				throw new RecognitionBudgetException(Utils.toPrintableRepresentation(word), steps);
			}
			if (frame.prediction == null){
				if (frame.cursor == word.length()){
					logResult(word, true, steps);
					return true;
				}
				continue;
			}
			Symbol symbol = frame.prediction.symbol;
			if (symbol instanceof Terminal){
				if (frame.cursor < word.length() && ((Terminal) symbol).matches(word.charAt(frame.cursor))){
					push(stack, new StackFrame(frame.cursor + 1, frame.prediction.rest), word.length());
				}
				continue;
			}
			int nonTerminal = ((NonTerminal) symbol).id;
			List<Production> candidates = frame.cursor < word.length()
					? firstMap.predict(nonTerminal, word.charAt(frame.cursor))
					: firstMap.nullableProductions(nonTerminal);
			for (int i = candidates.size() - 1; i >= 0; i--){
				push(stack, new StackFrame(frame.cursor,
						Prediction.prepend(candidates.get(i), frame.prediction.rest, firstMap)), word.length());
			}
		}
		logResult(word, false, steps);
		return false;
	}

	/**
	 * Pushes the frame if its prediction can still fit into the rest of the word.
	 */
	private void push(Deque<StackFrame> stack, StackFrame frame, int wordLength){
		int minimalYield = frame.prediction == null ? 0 : frame.prediction.minimalYield;
		if (minimalYield <= wordLength - frame.cursor){
			stack.push(frame);
		}
	}

	private void logResult(String word, boolean accepted, long steps){
		if (LOG.isLoggable(Level.FINER)){
			LOG.finer(String.format("%s %s after %d steps", accepted ? "Accepted" : "Rejected",
					Utils.toPrintableRepresentation(word), steps));
		}
	}

	static class StackFrame {
		final int cursor;
		final Prediction prediction;

		StackFrame(int cursor, Prediction prediction) {
			this.cursor = cursor;
			this.prediction = prediction;
		}
	}

	/**
	 * Immutable linked list of the symbols that still have to be matched. Frames share their tails.
	 */
	static class Prediction {
		final Symbol symbol;
		final Prediction rest;
		/**
		 * Length of the shortest word this prediction can derive
		 */
		final int minimalYield;

		Prediction(Symbol symbol, Prediction rest, int minimalYield) {
			this.symbol = symbol;
			this.rest = rest;
			this.minimalYield = minimalYield;
		}

		static Prediction prepend(Production production, Prediction rest, FirstMap firstMap){
			Prediction prediction = rest;
			for (int i = production.size() - 1; i >= 0; i--){
				Symbol symbol = production.get(i);
				int yield = Utils.saturatedAdd(firstMap.minimalYield(symbol), prediction == null ? 0 : prediction.minimalYield);
				prediction = new Prediction(symbol, prediction, yield);
			}
			return prediction;
		}
	}
}
