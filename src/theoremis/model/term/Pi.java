package theoremis.model.term;

/**
 * AST:
 *
 * Π (x 
 */
public class Pi extends Binder {

	public Pi(String param, Term paramType, Term body) {
		super(param, paramType, body);
	}

	public Term getParamType() {
		return getDomain();
	}

	@Override
	public Pi rebuild(String param, Term paramType, Term body) {
		return new Pi(param, paramType, body);
	}

	@Override
	public <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
