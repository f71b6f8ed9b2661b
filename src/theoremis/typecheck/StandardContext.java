package theoremis.typecheck;

import theoremis.kernel.TypingContext;
import theoremis.model.term.AxiomBundle;
import theoremis.model.term.Term;

import static theoremis.model.term.StandardTypes.*;
import static theoremis.model.term.TermBuilder.arrow;

/**
 * The vocabulary every module is checked against: number systems, algebraic
 * structures, collection type formers and a few predicates on ℕ.
 */
public class StandardContext {

	private StandardContext() {}

	public static TypingContext create(AxiomBundle bundle) {
		Term typeFormer = arrow(TYPE0, TYPE0);
		Term natPredicate = arrow(NAT, PROP);
		Term natFamily = arrow(NAT, TYPE0);
		return TypingContext.empty(bundle)
				.extend(NAT_NAME, TYPE0)
				.extend(INT_NAME, TYPE0)
				.extend(REAL_NAME, TYPE0)
				.extend(COMPLEX_NAME, TYPE0)
				.extend(BOOL.getName(), TYPE0)
				.extend(STRING.getName(), TYPE0)
				.extend("Set", typeFormer)
				.extend("List", typeFormer)
				.extend(GROUP.getName(), TYPE0)
				.extend(RING.getName(), TYPE0)
				.extend(FIELD.getName(), TYPE0)
				.extend(TOPOLOGICAL_SPACE.getName(), TYPE0)
				.extend(GRAPH.getName(), TYPE0)
				.extend("Prime", natPredicate)
				.extend("Even", natPredicate)
				.extend("Odd", natPredicate)
				.extend("Coprime", arrow(NAT, natPredicate))
				.extend("Divisors", natFamily)
				.extend("ZMod", natFamily)
				.extend("Finset", typeFormer)
				.extend("Multiset", typeFormer)
				.extend("Nat", TYPE0)
				.extend("Int", TYPE0)
				.extend("Real", TYPE0)
				.extend("Complex", TYPE0);
	}
}
