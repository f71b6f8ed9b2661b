package theoremis.parser;

import theoremis.errors.Issue;
import theoremis.errors.IssueVisitor;
import theoremis.lexer.MathToken;

public class UnexpectedTokenIssue extends Issue {
	private final String expected;
	private final MathToken actual;

	public UnexpectedTokenIssue(String expected, MathToken actual) {
		this.expected = expected;
		this.actual = actual;
	}

	/**
	 * @return the token type name or grammar element that was expected
	 */
	public String getExpected() {
		return expected;
	}

	public MathToken getActual() {
		return actual;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
