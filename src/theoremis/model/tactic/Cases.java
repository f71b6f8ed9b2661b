package theoremis.model.tactic;

import theoremis.model.term.Term;

/**
 * cases t
 */
public class Cases extends Tactic {
	private final Term term;

	public Cases(Term term) {
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
		if (!(obj instanceof Cases)) {
			return false;
		}
		return term.equals(((Cases) obj).term);
	}
}
