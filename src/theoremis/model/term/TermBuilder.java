package theoremis.model.term;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

public class TermBuilder {
	private TermBuilder() {}

	public static final String ANONYMOUS = "_";

	public static Var var(String name) {
		return new Var(name);
	}

	public static Lam lam(String param, Term paramType, Term body) {
		return new Lam(param, paramType, body);
	}

	public static App app(Term func, Term arg) {
		return new App(func, arg);
	}

	/**
	 * Curried application: f a b c is ((f a) b) c
	 */
	public static Term apps(Term func, Term... args) {
		Term result = func;
		for (Term arg : args) {
			result = new App(result, arg);
		}
		return result;
	}

	public static Pi pi(String param, Term paramType, Term body) {
		return new Pi(param, paramType, body);
	}

	/**
	 * A non-dependent function type from -> to
	 */
	public static Pi arrow(Term from, Term to) {
		return new Pi(ANONYMOUS, from, to);
	}

	public static Sigma sigma(String param, Term paramType, Term body) {
		return new Sigma(param, paramType, body);
	}

	public static Pair pair(Term fst, Term snd) {
		return new Pair(fst, snd);
	}

	public static Proj proj(Term term, int index) {
		return new Proj(term, index);
	}

	public static LetIn letIn(String name, Term type, Term value, Term body) {
		return new LetIn(name, type, value, body);
	}

	public static Sort sort(Universe universe) {
		return new Sort(universe);
	}

	public static Sort prop() {
		return new Sort(Universe.prop());
	}

	public static Sort type(int level) {
		return new Sort(Universe.type(level));
	}

	public static Ind ind(String name, Term type, Constructor... constructors) {
		return new Ind(name, type, Arrays.asList(constructors));
	}

	public static Constructor ctor(String name, Term type) {
		return new Constructor(name, type);
	}

	public static Match match(Term scrutinee, MatchCase... cases) {
		return new Match(scrutinee, Arrays.asList(cases));
	}

	public static MatchCase matchCase(String pattern, List<String> bindings, Term body) {
		return new MatchCase(pattern, bindings, body);
	}

	public static Hole hole(String id) {
		return new Hole(id);
	}

	public static Hole hole(String id, String annotation) {
		return new Hole(id, annotation);
	}

	public static AxiomRef axiomRef(Axiom axiom) {
		return new AxiomRef(axiom);
	}

	public static Literal nat(long n) {
		return new Literal(LiteralKind.Nat, Long.toString(n));
	}

	public static Literal nat(BigInteger n) {
		return new Literal(LiteralKind.Nat, n.toString());
	}

	public static Literal integer(long n) {
		return new Literal(LiteralKind.Int, Long.toString(n));
	}

	public static Literal bool(boolean b) {
		return new Literal(LiteralKind.Bool, Boolean.toString(b));
	}

	public static Literal str(String s) {
		return new Literal(LiteralKind.String, s);
	}

	public static BinOp binOp(BinaryOperator op, Term left, Term right) {
		return new BinOp(op, left, right);
	}

	public static UnaryOp unaryOp(UnaryOperator op, Term operand) {
		return new UnaryOp(op, operand);
	}

	public static UnaryOp not(Term operand) {
		return new UnaryOp(UnaryOperator.NOT, operand);
	}

	public static UnaryOp neg(Term operand) {
		return new UnaryOp(UnaryOperator.NEG, operand);
	}

	public static Equiv equiv(Term left, Term right) {
		return new Equiv(left, right);
	}

	public static Equiv equiv(Term left, Term right, Term modulus) {
		return new Equiv(left, right, modulus);
	}

	public static ForAll forAll(String param, Term domain, Term body) {
		return new ForAll(param, domain, body);
	}

	public static Exists exists(String param, Term domain, Term body) {
		return new Exists(param, domain, body);
	}
}
