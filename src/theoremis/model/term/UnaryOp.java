package theoremis.model.term;

/**
 * AST:
 *
 * ¬operand | -operand
 */
public class UnaryOp extends Term {
	private final UnaryOperator op;
	private final Term operand;

	public UnaryOp(UnaryOperator op, Term operand) {
		this.op = op;
		this.operand = operand;
	}

	public UnaryOperator getOperator() {
		return op;
	}

	public Term getOperand() {
		return operand;
	}

	@Override
	public <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return op.hashCode() * 17 + operand.hashCode() * 19 + 17;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof UnaryOp)) {
			return false;
		}
		UnaryOp other = (UnaryOp) obj;
		return op == other.op && operand.equals(other.operand);
	}
}
