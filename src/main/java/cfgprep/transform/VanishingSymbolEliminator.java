package cfgprep.transform;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import cfgprep.grammar.Grammar;
import cfgprep.grammar.NonTerminal;
import cfgprep.grammar.Production;
import cfgprep.grammar.Symbol;

/**
 * Removes all ε productions. Every occurrence of a nullable non terminal is made optional instead, so the
 * language only changes in the empty word.
 *
 * Example: with A → ε | aA the production S → AbA becomes S → AbA | bA | Ab | b.
 */
public class VanishingSymbolEliminator implements Transformation {

	private static final Logger LOG = Logger.getLogger(VanishingSymbolEliminator.class.getName());

	@Override
	public Grammar apply(Grammar grammar) {
		return eliminate(grammar);
	}

	/**
	 * Calculate the non terminals that can produce an epsilon.
	 */
	public static Set<Integer> nullable(Grammar grammar){
		Set<Integer> epsSet = new HashSet<>();
		boolean somethingChanged;
		do {
			somethingChanged = false;
			for (Map.Entry<Integer, List<Production>> entry : grammar.getRules().entrySet()){
				if (epsSet.contains(entry.getKey())){
					continue;
				}
				for (Production production : entry.getValue()){
					if (isNullable(production, epsSet)){
						epsSet.add(entry.getKey());
						somethingChanged = true;
						break;
					}
				}
			}
		} while (somethingChanged);
		return epsSet;
	}

	/**
	 * Does the production consist only of the passed nullable non terminals? True for ε.
	 */
	public static boolean isNullable(Production production, Set<Integer> nullable){
		for (Symbol symbol : production.right){
			if (symbol.isTerminal() || !nullable.contains(((NonTerminal) symbol).id)){
				return false;
			}
		}
		return true;
	}

	public static Grammar eliminate(Grammar grammar){
		Set<Integer> nullable = nullable(grammar);
		Map<Integer, Set<Production>> rules = new LinkedHashMap<>();
		for (Map.Entry<Integer, List<Production>> entry : grammar.getRules().entrySet()){
			Set<Production> productions = new LinkedHashSet<>();
			for (Production production : entry.getValue()){
				addVariants(production.right, 0, new ArrayList<>(), nullable, productions);
			}
			productions.remove(Production.EPSILON);
			rules.put(entry.getKey(), productions);
		}
		Grammar result = new Grammar(grammar.getStart(), rules);
		LOG.fine(() -> String.format("%d nullable non terminals, %d -> %d productions", nullable.size(),
				grammar.productionCount(), result.productionCount()));
		return result;
	}

	/**
	 * Adds every variant of the passed symbols that keeps or omits each nullable occurrence from position
	 * {@code pos} on. The variant that keeps all occurrences comes first.
	 */
	private static void addVariants(List<Symbol> symbols, int pos, List<Symbol> prefix, Set<Integer> nullable,
	                                Set<Production> acc){
		if (pos == symbols.size()){
			acc.add(new Production(prefix));
			return;
		}
		Symbol symbol = symbols.get(pos);
		prefix.add(symbol);
		addVariants(symbols, pos + 1, prefix, nullable, acc);
		prefix.remove(prefix.size() - 1);
		if (symbol instanceof NonTerminal && nullable.contains(((NonTerminal) symbol).id)){
			addVariants(symbols, pos + 1, prefix, nullable, acc);
		}
	}
}
