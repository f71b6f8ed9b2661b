package theoremis.model.term;

/**
 * AST:
 *
 * ∀ x ∈ D, P
 *
 * Domain-restricted logical quantification; unlike {@link Pi} and
 * {@link Sigma} this denotes a proposition, not a type former.
 */
public class ForAll extends Binder {

	public ForAll(String param, Term domain, Term body) {
		super(param, domain, body);
	}

	@Override
	public ForAll rebuild(String param, Term domain, Term body) {
		return new ForAll(param, domain, body);
	}

	@Override
	public <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
