package theoremis.model.term;

/**
 * AST:
 *
 * term.1 | term.2
 */
public class Proj extends Term {
	private final Term term;
	private final int index;

	public Proj(Term term, int index) {
		if (index != 1 && index != 2) {
			throw new IllegalArgumentException("projection index must be 1 or 2, got " + index);
		}
		this.term = term;
		this.index = index;
	}

	public Term getTerm() {
		return term;
	}

	public int getIndex() {
		return index;
	}

	@Override
	public <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return term.hashCode() * 17 + index;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Proj)) {
			return false;
		}
		Proj other = (Proj) obj;
		return index == other.index && term.equals(other.term);
	}
}
