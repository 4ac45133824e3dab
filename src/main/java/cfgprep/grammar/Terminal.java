package cfgprep.grammar;

/**
 * A terminal symbol, a single input character
 */
public class Terminal extends Symbol {

	public final char character;

	public Terminal(char character) {
		this.character = character;
	}

	public static Terminal of(char character){
		return new Terminal(character);
	}

	@Override
	public boolean isTerminal() {
		return true;
	}

	public boolean matches(char c){
		return character == c;
	}

	@Override
	public String toString() {
		return String.valueOf(character);
	}
}
