package theoremis.model.term;

/**
 * AST:
 *
 * x
 */
public class Var extends Term {
	private final String name;

	public Var(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return name.hashCode() * 17 + 1;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Var)) {
			return false;
		}
		return name.equals(((Var) obj).name);
	}
}
