package theoremis.model.term;

import java.util.Collections;
import java.util.List;

/**
 * AST:
 *
 * match scrutinee with
 *   | pattern x y => body
 *   | ...
 */
public class Match extends Term {
	private final Term scrutinee;
	private final List<MatchCase> cases;

	public Match(Term scrutinee, List<MatchCase> cases) {
		this.scrutinee = scrutinee;
		this.cases = Collections.unmodifiableList(cases);
	}

	public Term getScrutinee() {
		return scrutinee;
	}

	public List<MatchCase> getCases() {
		return cases;
	}

	@Override
	public <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return scrutinee.hashCode() * 17 + cases.hashCode() * 19 + 7;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Match)) {
			return false;
		}
		Match other = (Match) obj;
		return scrutinee.equals(other.scrutinee) && cases.equals(other.cases);
	}
}
