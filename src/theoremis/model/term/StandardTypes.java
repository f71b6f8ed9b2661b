package theoremis.model.term;

import static theoremis.model.term.TermBuilder.*;

/**
 * Names and shapes of the standard mathematical vocabulary.
 */
public class StandardTypes {
	private StandardTypes() {}

	public static final String NAT_NAME = "ℕ";
	public static final String INT_NAME = "ℤ";
	public static final String REAL_NAME = "ℝ";
	public static final String COMPLEX_NAME = "ℂ";

	public static final Var NAT = var(NAT_NAME);
	public static final Var INT = var(INT_NAME);
	public static final Var REAL = var(REAL_NAME);
	public static final Var COMPLEX = var(COMPLEX_NAME);
	public static final Var BOOL = var("Bool");
	public static final Var STRING = var("String");
	public static final Sort PROP = prop();
	public static final Sort TYPE0 = type(0);
	public static final Sort TYPE1 = type(1);
	public static final Var GROUP = var("Group");
	public static final Var RING = var("Ring");
	public static final Var FIELD = var("Field");
	public static final Var TOPOLOGICAL_SPACE = var("TopologicalSpace");
	public static final Var GRAPH = var("Graph");

	public static App set(Term elementType) {
		return app(var("Set"), elementType);
	}

	public static App list(Term elementType) {
		return app(var("List"), elementType);
	}

	public static App prime(Term n) {
		return app(var("Prime"), n);
	}

	public static App even(Term n) {
		return app(var("Even"), n);
	}

	public static App odd(Term n) {
		return app(var("Odd"), n);
	}

	public static Term coprime(Term a, Term b) {
		return apps(var("Coprime"), a, b);
	}

	/**
	 * a ∣ b, expressed as membership of a in the divisors of b
	 */
	public static BinOp divides(Term a, Term b) {
		return binOp(BinaryOperator.IN, a, app(var("Divisors"), b));
	}

	public static App zmod(Term n) {
		return app(var("ZMod"), n);
	}
}
