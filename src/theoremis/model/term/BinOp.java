package theoremis.model.term;

/**
 * AST:
 *
 * left op right
 */
public class BinOp extends Term {
	private final BinaryOperator op;
	private final Term left;
	private final Term right;

	public BinOp(BinaryOperator op, Term left, Term right) {
		this.op = op;
		this.left = left;
		this.right = right;
	}

	public BinaryOperator getOperator() {
		return op;
	}

	public Term getLeft() {
		return left;
	}

	public Term getRight() {
		return right;
	}

	@Override
	public <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + op.hashCode();
		result = prime * result + left.hashCode();
		result = prime * result + right.hashCode();
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof BinOp)) {
			return false;
		}
		BinOp other = (BinOp) obj;
		return op == other.op && left.equals(other.left) && right.equals(other.right);
	}
}
