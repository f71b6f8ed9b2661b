package theoremis.parser;

import theoremis.errors.Issue;
import theoremis.errors.IssueVisitor;

/**
 * A parsed term nests deeper than the term limit. Long operator chains such
 * as {@code a + a + ... + a} get here without deep grammar recursion.
 */
public class ExpressionTooDeepIssue extends Issue {
	private final int limit;

	public ExpressionTooDeepIssue(int limit) {
		this.limit = limit;
	}

	public int getLimit() {
		return limit;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
