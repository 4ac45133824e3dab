package cfgprep;

/**
 * Base class of all exceptions thrown while loading, normalizing or using a grammar.
 */
public class GrammarException extends RuntimeException {

	public GrammarException(String message) {
		super(message);
	}

	public GrammarException(String message, Throwable cause) {
		super(message, cause);
	}
}
