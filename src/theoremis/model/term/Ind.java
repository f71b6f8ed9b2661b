package theoremis.model.term;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * AST:
 *
 * inductive name : type where
 *   | c1 : T1
 *   | ...
 */
public class Ind extends Term {
	private final String name;
	private final Term type;
	private final List<Constructor> constructors;

	public Ind(String name, Term type, List<Constructor> constructors) {
		this.name = name;
		this.type = type;
		this.constructors = Collections.unmodifiableList(constructors);
	}

	public String getName() {
		return name;
	}

	public Term getType() {
		return type;
	}

	public List<Constructor> getConstructors() {
		return constructors;
	}

	@Override
	public <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, type, constructors);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Ind)) {
			return false;
		}
		Ind other = (Ind) obj;
		return name.equals(other.name) && type.equals(other.type) && constructors.equals(other.constructors);
	}
}
