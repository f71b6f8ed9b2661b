package theoremis.parser;

import theoremis.errors.Issue;
import theoremis.errors.IssueVisitor;
import theoremis.lexer.MathToken;

/**
 * Tokens remained after a complete expression was parsed.
 */
public class TrailingInputIssue extends Issue {
	private final MathToken first;

	public TrailingInputIssue(MathToken first) {
		this.first = first;
	}

	public MathToken getFirst() {
		return first;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
