package theoremis.model.tactic;

public class Induction extends Tactic {
	private final String name;

	public Induction(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(TacticVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return name.hashCode() * 17 + 4;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Induction)) {
			return false;
		}
		return name.equals(((Induction) obj).name);
	}
}
