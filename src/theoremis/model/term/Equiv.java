package theoremis.model.term;

import java.util.Objects;
import java.util.Optional;

/**
 * AST:
 *
 * left ≡ right [MOD modulus]
 */
public class Equiv extends Term {
	private final Term left;
	private final Term right;
	private final Term modulus;

	public Equiv(Term left, Term right) {
		this(left, right, null);
	}

	public Equiv(Term left, Term right, Term modulus) {
		this.left = left;
		this.right = right;
		this.modulus = modulus;
	}

	public Term getLeft() {
		return left;
	}

	public Term getRight() {
		return right;
	}

	public Optional<Term> getModulus() {
		return Optional.ofNullable(modulus);
	}

	@Override
	public <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(left, right, modulus);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Equiv)) {
			return false;
		}
		Equiv other = (Equiv) obj;
		return left.equals(other.left) && right.equals(other.right) && Objects.equals(modulus, other.modulus);
	}
}
