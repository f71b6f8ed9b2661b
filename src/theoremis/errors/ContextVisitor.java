package theoremis.errors;

public abstract class ContextVisitor<T, E extends Throwable> {
	public abstract T visit(WhileReadingInput whileReadingInput) throws E;
}
