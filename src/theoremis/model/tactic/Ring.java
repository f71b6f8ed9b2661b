package theoremis.model.tactic;

/**
 * ring: normalises ring equations
 */
public class Ring extends Tactic {

	@Override
	public <T, E extends Throwable> T accept(TacticVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return 7;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Ring;
	}
}
