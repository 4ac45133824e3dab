package cfgprep;

/**
 * Thrown if a grammar violates its structural invariants: a production references an undeclared
 * non terminal, the start symbol is missing or gets eliminated, or there are no non terminals at all.
 */
public class MalformedGrammarException extends GrammarException {

	public MalformedGrammarException(String message) {
		super(message);
	}
}
