package cfgprep.grammar;

/**
 * A non terminal symbol. Only the id is stored, the productions are held by the {@link Grammar}.
 */
public class NonTerminal extends Symbol {

	public final int id;

	public NonTerminal(int id) {
		this.id = id;
	}

	public static NonTerminal of(int id){
		return new NonTerminal(id);
	}

	@Override
	public boolean isTerminal() {
		return false;
	}

	@Override
	public String toString() {
		return "<" + id + ">";
	}
}
