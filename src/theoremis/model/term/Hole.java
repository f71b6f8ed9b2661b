package theoremis.model.term;

import java.util.Objects;
import java.util.Optional;

/**
 * AST:
 *
 * ?id
 *
 * A placeholder for a subterm or proof step that has not been supplied yet,
 * optionally carrying a free-text annotation.
 */
public class Hole extends Term {
	private final String id;
	private final String annotation;

	public Hole(String id) {
		this(id, null);
	}

	public Hole(String id, String annotation) {
		this.id = id;
		this.annotation = annotation;
	}

	public String getId() {
		return id;
	}

	public Optional<String> getAnnotation() {
		return Optional.ofNullable(annotation);
	}

	@Override
	public <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(id, annotation);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Hole)) {
			return false;
		}
		Hole other = (Hole) obj;
		return id.equals(other.id) && Objects.equals(annotation, other.annotation);
	}
}
