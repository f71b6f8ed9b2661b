package theoremis.model.term;

/**
 * AST:
 *
 * ∃ x ∈ D, P
 *
 * Domain-restricted logical quantification; unlike {@link Pi} and
 * {@link Sigma} this denotes a proposition, not a type former.
 */
public class Exists extends Binder {

	public Exists(String param, Term domain, Term body) {
		super(param, domain, body);
	}

	@Override
	public Exists rebuild(String param, Term domain, Term body) {
		return new Exists(param, domain, body);
	}

	@Override
	public <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
