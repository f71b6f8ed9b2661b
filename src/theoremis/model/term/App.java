package theoremis.model.term;

/**
 * AST:
 *
 * func arg
 */
public class App extends Term {
	private final Term func;
	private final Term arg;

	public App(Term func, Term arg) {
		this.func = func;
		this.arg = arg;
	}

	public Term getFunc() {
		return func;
	}

	public Term getArg() {
		return arg;
	}

	@Override
	public <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return func.hashCode() * 17 + arg.hashCode() * 19 + 2;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof App)) {
			return false;
		}
		App other = (App) obj;
		return func.equals(other.func) && arg.equals(other.arg);
	}
}
