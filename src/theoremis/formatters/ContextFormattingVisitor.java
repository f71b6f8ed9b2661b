package theoremis.formatters;

import theoremis.errors.ContextVisitor;
import theoremis.errors.WhileReadingInput;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private final IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(WhileReadingInput whileReadingInput) throws IOException {
		out.write("while reading ");
		out.write(whileReadingInput.getSource());
		return null;
	}
}
