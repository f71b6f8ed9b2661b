package theoremis.model.term;

import java.util.Objects;

/**
 * AST:
 *
 * let name : type := value in body
 *
 * name is bound in body only; type and value live in the outer scope.
 */
public class LetIn extends Term {
	private final String name;
	private final Term type;
	private final Term value;
	private final Term body;

	public LetIn(String name, Term type, Term value, Term body) {
		this.name = name;
		this.type = type;
		this.value = value;
		this.body = body;
	}

	public String getName() {
		return name;
	}

	public Term getType() {
		return type;
	}

	public Term getValue() {
		return value;
	}

	public Term getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, type, value, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		LetIn other = (LetIn) obj;
		return name.equals(other.name) && type.equals(other.type) && value.equals(other.value) &&
				body.equals(other.body);
	}
}
