package cfgprep;

/**
 * Thrown by the recognizer if it needs more steps than configured.
 *
 * @see Config#maxRecognitionSteps()
 */
public class RecognitionBudgetException extends GrammarException {

	public final long steps;

	public RecognitionBudgetException(String word, long steps) {
		super(String.format("Gave up recognizing %s after %d steps", word, steps));
		this.steps = steps;
	}
}
