package theoremis.model.decl;

import theoremis.model.term.Term;

import java.util.Objects;

public class Param {
	private final String name;
	private final Term type;
	private final boolean implicit;

	public Param(String name, Term type, boolean implicit) {
		this.name = name;
		this.type = type;
		this.implicit = implicit;
	}

	public Param(String name, Term type) {
		this(name, type, false);
	}

	public String getName() {
		return name;
	}

	public Term getType() {
		return type;
	}

	public boolean isImplicit() {
		return implicit;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, type, implicit);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Param)) {
			return false;
		}
		Param other = (Param) obj;
		return implicit == other.implicit && name.equals(other.name) && type.equals(other.type);
	}
}
