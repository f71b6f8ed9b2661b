package theoremis.model.decl;

import java.util.Collections;
import java.util.List;

/**
 * A top-level declaration of an {@link IRModule}.
 */
public abstract class Declaration {
	private final String name;
	private final List<Param> params;

	protected Declaration(String name, List<Param> params) {
		this.name = name;
		this.params = Collections.unmodifiableList(params);
	}

	public String getName() {
		return name;
	}

	public List<Param> getParams() {
		return params;
	}

	public abstract <T, E extends Throwable> T accept(DeclarationVisitor<T, E> v) throws E;
}
