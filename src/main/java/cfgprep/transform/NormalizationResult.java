package cfgprep.transform;

import cfgprep.grammar.Grammar;

/**
 * Outcome of the {@link Normalizer}: the parse ready grammar and the way it was produced.
 */
public class NormalizationResult {

	public enum Branch {
		/**
		 * The input was left recursive: ε, chain and useless symbol removal, then Paull's algorithm.
		 * The result may still have common prefixes.
		 */
		LEFT_RECURSION_REMOVED,
		/**
		 * The input had no left recursion and was only left factorized.
		 */
		FACTORIZED
	}

	public final Grammar grammar;

	public final Branch branch;

	/**
	 * Was a new start non terminal with an ε production added, because the original start was nullable?
	 */
	public final boolean emptyWordReinstated;

	public NormalizationResult(Grammar grammar, Branch branch, boolean emptyWordReinstated) {
		this.grammar = grammar;
		this.branch = branch;
		this.emptyWordReinstated = emptyWordReinstated;
	}

	public boolean isFactorized(){
		return branch == Branch.FACTORIZED;
	}

	@Override
	public String toString() {
		return String.format("%s%s\n%s", branch, emptyWordReinstated ? " (empty word reinstated)" : "", grammar);
	}
}
