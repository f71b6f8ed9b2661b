package theoremis.model.term;

/**
 * AST:
 *
 * ⟨fst, snd⟩
 */
public class Pair extends Term {
	private final Term fst;
	private final Term snd;

	public Pair(Term fst, Term snd) {
		this.fst = fst;
		this.snd = snd;
	}

	public Term getFst() {
		return fst;
	}

	public Term getSnd() {
		return snd;
	}

	@Override
	public <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return fst.hashCode() * 17 + snd.hashCode() * 19 + 3;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Pair)) {
			return false;
		}
		Pair other = (Pair) obj;
		return fst.equals(other.fst) && snd.equals(other.snd);
	}
}
