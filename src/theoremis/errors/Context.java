package theoremis.errors;

/**
 * Describes where an issue was found, e.g. which input file was being read.
 */
public abstract class Context {

	public abstract <T, E extends Throwable> T accept(ContextVisitor<T, E> v) throws E;
}
