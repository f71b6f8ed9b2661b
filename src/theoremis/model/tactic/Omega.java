package theoremis.model.tactic;

/**
 * omega: linear arithmetic decision procedure
 */
public class Omega extends Tactic {

	@Override
	public <T, E extends Throwable> T accept(TacticVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return 3;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Omega;
	}
}
