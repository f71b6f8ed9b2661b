package theoremis.model.term;

/**
 * AST:
 *
 * Σ (x 
 */
public class Sigma extends Binder {

	public Sigma(String param, Term paramType, Term body) {
		super(param, paramType, body);
	}

	public Term getParamType() {
		return getDomain();
	}

	@Override
	public Sigma rebuild(String param, Term paramType, Term body) {
		return new Sigma(param, paramType, body);
	}

	@Override
	public <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
