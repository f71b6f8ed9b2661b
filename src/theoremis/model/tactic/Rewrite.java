package theoremis.model.tactic;

import theoremis.model.term.Term;

/**
 * rw [t] or rw [← t]
 */
public class Rewrite extends Tactic {
	public enum Direction {
		LTR,
		RTL,
	}

	private final Term term;
	private final Direction direction;

	public Rewrite(Term term, Direction direction) {
		this.term = term;
		this.direction = direction;
	}

	public Term getTerm() {
		return term;
	}

	public Direction getDirection() {
		return direction;
	}

	@Override
	public <T, E extends Throwable> T accept(TacticVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return term.hashCode() * 17 + direction.hashCode() * 19 + 2;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Rewrite)) {
			return false;
		}
		Rewrite other = (Rewrite) obj;
		return direction == other.direction && term.equals(other.term);
	}
}
