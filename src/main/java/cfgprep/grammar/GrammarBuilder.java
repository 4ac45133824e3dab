package cfgprep.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import cfgprep.GrammarException;

/**
 * Allows the simple creation of grammars.
 *
 * In this class strings are treated as non terminal names and characters as terminals. Every name gets an
 * integer id in order of its first appearance (on either side of a production), starting with 0.
 */
public class GrammarBuilder {

	private final Map<String, Integer> ids = new LinkedHashMap<>();
	private final Map<Integer, Set<Production>> rules = new LinkedHashMap<>();

	/**
	 * Returns the id of the passed non terminal, creates one if the name hasn't been used yet.
	 */
	public int id(String nonTerminal){
		if (nonTerminal.isEmpty()){
			throw new GrammarException("Empty non terminal name");
		}
		if (!ids.containsKey(nonTerminal)){
			int id = ids.size();
			ids.put(nonTerminal, id);
			rules.put(id, new LinkedHashSet<>());
		}
		return ids.get(nonTerminal);
	}

	public NonTerminal nonTerminal(String name){
		return NonTerminal.of(id(name));
	}

	/**
	 * Names of all used non terminals mapped to their ids
	 */
	public Map<String, Integer> getIds(){
		return Collections.unmodifiableMap(ids);
	}

	/**
	 * Declares a non terminal, it has no productions if none are added later.
	 */
	public GrammarBuilder declare(String nonTerminal){
		id(nonTerminal);
		return this;
	}

	/**
	 * Adds a new production (and the used non terminals).
	 *
	 * The entries of the right hand side are
	 *  - strings: names of non terminals
	 *  - characters: terminals
	 *  - "": equivalent to ε
	 *  - arrays of the above
	 *
	 * Duplicate productions are ignored.
	 *
	 * @param left name of the defining non terminal on the left hand side of the production
	 * @param right right hand side of the production
	 */
	public GrammarBuilder add(String left, Object... right){
		int leftId = id(left);
		List<Symbol> symbols = new ArrayList<>();
		for (Object obj : flatten(right)){
			if (obj instanceof String){
				if (!((String) obj).isEmpty()){
					symbols.add(nonTerminal((String) obj));
				}
			} else if (obj instanceof Character){
				symbols.add(Terminal.of((Character) obj));
			} else {
				throw new GrammarException("Right part of production object list has unsupported type " + obj.getClass());
			}
		}
		rules.get(leftId).add(new Production(symbols));
		return this;
	}

	/**
	 * Adds the alternatives of a compact rule like {@code "aAb|BC|"}.
	 *
	 * Alternatives are separated by "|", an empty alternative is the ε production. An upper case letter
	 * together with the apostrophes following it is a non terminal name, every other character is a terminal.
	 */
	public GrammarBuilder rule(String left, String alternatives){
		for (String alternative : alternatives.split("\\|", -1)){
			List<Object> right = new ArrayList<>();
			for (int i = 0; i < alternative.length(); i++){
				char c = alternative.charAt(i);
				if (Character.isUpperCase(c)){
					int end = i + 1;
					while (end < alternative.length() && alternative.charAt(end) == '\''){
						end++;
					}
					right.add(alternative.substring(i, end));
					i = end - 1;
				} else {
					right.add(c);
				}
			}
			add(left, right.toArray());
		}
		return this;
	}

	private List<Object> flatten(Object[] arr){
		List<Object> ret = new ArrayList<>();
		for (Object sub : arr){
			if (sub instanceof Object[]){
				ret.addAll(flatten((Object[]) sub));
			} else {
				ret.add(sub);
			}
		}
		return ret;
	}

	public Grammar toGrammar(String startNonTerminal) {
		return new Grammar(id(startNonTerminal), rules);
	}
}
