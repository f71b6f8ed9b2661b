package theoremis.model.term;

/**
 * AST:
 *
 * Prop | Type n
 */
public class Sort extends Term {
	private final Universe universe;

	public Sort(Universe universe) {
		this.universe = universe;
	}

	public Universe getUniverse() {
		return universe;
	}

	@Override
	public <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return universe.hashCode() * 17 + 5;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Sort)) {
			return false;
		}
		return universe.equals(((Sort) obj).universe);
	}
}
