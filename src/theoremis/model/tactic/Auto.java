package theoremis.model.tactic;

/**
 * Bounded automatic proof search.
 */
public class Auto extends Tactic {
	private final int depth;

	public Auto(int depth) {
		this.depth = depth;
	}

	public int getDepth() {
		return depth;
	}

	@Override
	public <T, E extends Throwable> T accept(TacticVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return depth * 17 + 8;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Auto)) {
			return false;
		}
		return depth == ((Auto) obj).depth;
	}
}
