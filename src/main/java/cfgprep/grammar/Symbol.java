package cfgprep.grammar;

/**
 * Base class for terminal symbols and non terminal symbols.
 *
 * Symbols are plain values: a non terminal is only an id that is looked up in the grammar's rule map.
 */
public abstract class Symbol implements Comparable<Symbol> {

	public abstract boolean isTerminal();

	public boolean isNonTerminal(){
		return !isTerminal();
	}

	/**
	 * Non terminals hash to positive, terminals to negative values.
	 */
	@Override
	public int hashCode() {
		if (this instanceof NonTerminal){
			return ((NonTerminal)this).id + 1;
		}
		return -((Terminal)this).character - 1;
	}

	@Override
	public boolean equals(Object obj) {
		return obj != null && obj.getClass() == this.getClass() && obj.hashCode() == this.hashCode();
	}

	/**
	 * Terminals come before non terminals, each ordered by their character or id.
	 */
	@Override
	public int compareTo(Symbol o) {
		if (isTerminal() != o.isTerminal()){
			return isTerminal() ? -1 : 1;
		}
		if (isTerminal()){
			return Character.compare(((Terminal)this).character, ((Terminal)o).character);
		}
		return Integer.compare(((NonTerminal)this).id, ((NonTerminal)o).id);
	}
}
