package theoremis;

import theoremis.errors.Issue;
import theoremis.errors.IssueVisitor;

/**
 * A JSON input (module or configuration) that does not have the expected shape.
 */
public class MalformedInputIssue extends Issue {
	private final String what;
	private final String reason;

	public MalformedInputIssue(String what, String reason) {
		this.what = what;
		this.reason = reason;
	}

	public String getWhat() {
		return what;
	}

	public String getReason() {
		return reason;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
