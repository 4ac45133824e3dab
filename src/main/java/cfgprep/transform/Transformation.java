package cfgprep.transform;

import cfgprep.grammar.Grammar;

/**
 * A normalization step. Takes a grammar and returns a new one, the passed grammar stays untouched.
 */
@FunctionalInterface
public interface Transformation {

	Grammar apply(Grammar grammar);

	default Transformation andThen(Transformation next){
		return grammar -> next.apply(apply(grammar));
	}
}
