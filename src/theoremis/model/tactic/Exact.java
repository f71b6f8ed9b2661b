package theoremis.model.tactic;

import theoremis.model.term.Term;

/**
 * exact t
 */
public class Exact extends Tactic {
	private final Term term;

	public Exact(Term term) {
		this.term = term;
	}

	public Term getTerm() {
		return term;
	}

	@Override
	public <T, E extends Throwable> T accept(TacticVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return term.hashCode() * 17 + 5;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Exact)) {
			return false;
		}
		return term.equals(((Exact) obj).term);
	}
}
