package theoremis;

import theoremis.errors.Issue;
import theoremis.errors.IssueVisitor;

import java.io.IOException;

public class IOErrorIssue extends Issue {
	private final IOException error;

	public IOErrorIssue(IOException error) {
		this.error = error;
	}

	public IOException getError() {
		return error;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
