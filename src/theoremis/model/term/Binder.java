package theoremis.model.term;

import java.util.Objects;

/**
 * A term binding exactly one name over a body: λ, Π, Σ, ∀ and ∃.
 *
 * The domain (the parameter type for λ/Π/Σ, the quantified domain for ∀/∃)
 * lives in the outer scope; the bound name only has meaning inside the body.
 */
public abstract class Binder extends Term {
	private final String param;
	private final Term domain;
	private final Term body;

	protected Binder(String param, Term domain, Term body) {
		this.param = param;
		this.domain = domain;
		this.body = body;
	}

	public String getParam() {
		return param;
	}

	public Term getDomain() {
		return domain;
	}

	public Term getBody() {
		return body;
	}

	/**
	 * @return a binder of the same kind with the given components
	 */
	public abstract Binder rebuild(String param, Term domain, Term body);

	@Override
	public int hashCode() {
		return Objects.hash(getClass(), param, domain, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Binder other = (Binder) obj;
		return param.equals(other.param) && domain.equals(other.domain) && body.equals(other.body);
	}
}
