package theoremis.model.decl;

import theoremis.model.term.Term;

import java.util.List;

/**
 * def name params : returnType := body
 */
public class Definition extends Declaration {
	private final Term returnType;
	private final Term body;

	public Definition(String name, List<Param> params, Term returnType, Term body) {
		super(name, params);
		this.returnType = returnType;
		this.body = body;
	}

	public Term getReturnType() {
		return returnType;
	}

	public Term getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(DeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
