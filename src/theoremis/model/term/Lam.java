package theoremis.model.term;

/**
 * AST:
 *
 * λ (x 
 */
public class Lam extends Binder {

	public Lam(String param, Term paramType, Term body) {
		super(param, paramType, body);
	}

	public Term getParamType() {
		return getDomain();
	}

	@Override
	public Lam rebuild(String param, Term paramType, Term body) {
		return new Lam(param, paramType, body);
	}

	@Override
	public <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
