package cfgprep;

import cfgprep.loader.Location;

/**
 * A syntax error in a textual grammar or word list.
 */
public class GrammarSyntaxException extends GrammarException {

	public final Location errorLocation;

	public GrammarSyntaxException(Location errorLocation, String message) {
		super(String.format("Error at %s: %s", errorLocation, message));
		this.errorLocation = errorLocation;
	}
}
