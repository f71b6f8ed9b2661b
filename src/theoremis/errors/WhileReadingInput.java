package theoremis.errors;

/**
 * The context of issues found in one input: a file path, or a label such as
 * "command line" for input passed directly.
 */
public class WhileReadingInput extends Context {
	private final String source;

	public WhileReadingInput(String source) {
		this.source = source;
	}

	public String getSource() {
		return source;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
