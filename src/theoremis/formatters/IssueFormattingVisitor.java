package theoremis.formatters;

import theoremis.IOErrorIssue;
import theoremis.MalformedInputIssue;
import theoremis.errors.IssueVisitor;
import theoremis.errors.IssueWithContext;
import theoremis.lexer.MathToken;
import theoremis.parser.ExpressionTooDeepIssue;
import theoremis.parser.NestingTooDeepIssue;
import theoremis.parser.TrailingInputIssue;
import theoremis.parser.UnexpectedTokenIssue;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void token(MathToken token) throws IOException {
		out.write(token.getType().name());
		out.write(" ('");
		out.write(token.getValue());
		out.write("') at position ");
		out.write(Integer.toString(token.getPosition()));
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(UnexpectedTokenIssue unexpectedTokenIssue) throws IOException {
		out.write("Expected ");
		out.write(unexpectedTokenIssue.getExpected());
		out.write(" but got ");
		token(unexpectedTokenIssue.getActual());
		return null;
	}

	@Override
	public Void visit(TrailingInputIssue trailingInputIssue) throws IOException {
		out.write("unexpected trailing input starting with ");
		token(trailingInputIssue.getFirst());
		return null;
	}

	@Override
	public Void visit(NestingTooDeepIssue nestingTooDeepIssue) throws IOException {
		out.write("expression nesting exceeds the limit of ");
		out.write(Integer.toString(nestingTooDeepIssue.getLimit()));
		out.write(" at position ");
		out.write(Integer.toString(nestingTooDeepIssue.getPosition()));
		return null;
	}

	@Override
	public Void visit(ExpressionTooDeepIssue expressionTooDeepIssue) throws IOException {
		out.write("parsed expression nests deeper than the limit of ");
		out.write(Integer.toString(expressionTooDeepIssue.getLimit()));
		return null;
	}

	@Override
	public Void visit(IOErrorIssue ioErrorIssue) throws IOException {
		out.write("IO Error: ");
		out.write(ioErrorIssue.getError().toString());
		return null;
	}

	@Override
	public Void visit(MalformedInputIssue malformedInputIssue) throws IOException {
		out.write("malformed ");
		out.write(malformedInputIssue.getWhat());
		out.write(": ");
		out.write(malformedInputIssue.getReason());
		return null;
	}
}
