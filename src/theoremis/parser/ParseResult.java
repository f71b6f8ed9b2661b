package theoremis.parser;

import theoremis.errors.Issue;
import theoremis.model.term.Term;

import java.util.Collections;
import java.util.List;

/**
 * A best-effort term and the issues found while parsing it. The term is
 * present even when there are issues.
 */
public class ParseResult {
	private final Term term;
	private final List<Issue> issues;

	public ParseResult(Term term, List<Issue> issues) {
		this.term = term;
		this.issues = Collections.unmodifiableList(issues);
	}

	public Term getTerm() {
		return term;
	}

	public List<Issue> getIssues() {
		return issues;
	}

	public boolean hasIssues() {
		return !issues.isEmpty();
	}
}
