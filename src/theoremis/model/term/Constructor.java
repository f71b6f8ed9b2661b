package theoremis.model.term;

/**
 * A named constructor of an inductive declaration.
 */
public class Constructor {
	private final String name;
	private final Term type;

	public Constructor(String name, Term type) {
		this.name = name;
		this.type = type;
	}

	public String getName() {
		return name;
	}

	public Term getType() {
		return type;
	}

	@Override
	public int hashCode() {
		return name.hashCode() * 17 + type.hashCode() * 19;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Constructor)) {
			return false;
		}
		Constructor other = (Constructor) obj;
		return name.equals(other.name) && type.equals(other.type);
	}
}
