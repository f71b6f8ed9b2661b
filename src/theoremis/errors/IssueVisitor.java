package theoremis.errors;

import theoremis.IOErrorIssue;
import theoremis.MalformedInputIssue;
import theoremis.parser.ExpressionTooDeepIssue;
import theoremis.parser.NestingTooDeepIssue;
import theoremis.parser.TrailingInputIssue;
import theoremis.parser.UnexpectedTokenIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(UnexpectedTokenIssue unexpectedTokenIssue) throws E;
	public abstract T visit(TrailingInputIssue trailingInputIssue) throws E;
	public abstract T visit(NestingTooDeepIssue nestingTooDeepIssue) throws E;
	public abstract T visit(ExpressionTooDeepIssue expressionTooDeepIssue) throws E;
	public abstract T visit(IOErrorIssue ioErrorIssue) throws E;
	public abstract T visit(MalformedInputIssue malformedInputIssue) throws E;
}
