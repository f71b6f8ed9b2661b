package theoremis.model.term;

/**
 * AST:
 *
 * 42 | true | "text"
 *
 * The value is kept as text. Note that decimal numerals read by the expression
 * parser are tagged {@link LiteralKind#Int} while keeping their decimal text,
 * e.g. Int "4.5".
 */
public class Literal extends Term {
	private final LiteralKind kind;
	private final String value;

	public Literal(LiteralKind kind, String value) {
		this.kind = kind;
		this.value = value;
	}

	public LiteralKind getKind() {
		return kind;
	}

	public String getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return kind.hashCode() * 17 + value.hashCode() * 19 + 13;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Literal)) {
			return false;
		}
		Literal other = (Literal) obj;
		return kind == other.kind && value.equals(other.value);
	}
}
