package theoremis.parser;

import theoremis.errors.Issue;
import theoremis.errors.IssueVisitor;

public class NestingTooDeepIssue extends Issue {
	private final int limit;
	private final int position;

	public NestingTooDeepIssue(int limit, int position) {
		this.limit = limit;
		this.position = position;
	}

	public int getLimit() {
		return limit;
	}

	public int getPosition() {
		return position;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
