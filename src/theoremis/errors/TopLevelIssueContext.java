package theoremis.errors;

import theoremis.Unreachable;
import theoremis.formatters.IndentingWriter;
import theoremis.formatters.IssueFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class TopLevelIssueContext extends IssueContext {

	private final List<Issue> issues = new ArrayList<>();

	@Override
	public void error(Issue err) {
		issues.add(err);
	}

	@Override
	public boolean hasErrors() {
		return !issues.isEmpty();
	}

	public List<Issue> getIssues() {
		return Collections.unmodifiableList(issues);
	}

	public void format(IndentingWriter out) throws IOException {
		out.write("Detected ");
		out.write(Integer.toString(issues.size()));
		out.write(" issue(s):");
		for (Issue issue : issues) {
			out.newLine();
			issue.accept(new IssueFormattingVisitor(out));
		}
	}

	public String format() {
		StringWriter w = new StringWriter();
		try {
			format(new IndentingWriter(w));
		} catch (IOException e) {
			throw new Unreachable("IO error from a StringWriter", e);
		}
		return w.toString();
	}
}
