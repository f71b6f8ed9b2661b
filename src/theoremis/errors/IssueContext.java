package theoremis.errors;

import java.util.Collection;

/**
 * Somewhere to report issues. Contexts nest: an issue reported through
 * {@link #withContext(Context)} reaches the parent tagged with that context.
 */
public abstract class IssueContext {

	public abstract void error(Issue err);

	public abstract boolean hasErrors();

	public void errors(Collection<? extends Issue> errs) {
		for (Issue err : errs) {
			error(err);
		}
	}

	public IssueContext withContext(Context context) {
		return new NestedIssueContext(this, context);
	}

	public IssueContext whileReading(String source) {
		return withContext(new WhileReadingInput(source));
	}
}
