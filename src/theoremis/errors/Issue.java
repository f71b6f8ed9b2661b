package theoremis.errors;

import theoremis.TheoremisException;
import theoremis.Unreachable;
import theoremis.formatters.IndentingWriter;
import theoremis.formatters.IssueFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A problem found in user input. Issues are collected in an {@link IssueContext}
 * rather than thrown, so a caller always gets a best-effort result plus the
 * issues describing what went wrong.
 */
public abstract class Issue extends TheoremisException {
	private static final String prefix = "Issue";

	public Issue() {
		super(prefix, "");
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable("IO error from a StringWriter", e);
		}
		return sw.getBuffer().toString();
	}

	public Issue withContext(Context ctx) {
		return new IssueWithContext(this, ctx);
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;
}
