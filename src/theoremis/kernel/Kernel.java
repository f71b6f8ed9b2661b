package theoremis.kernel;

import theoremis.model.term.Term;

import java.util.Set;

/**
 * Entry point to the term kernel: free variables, capture-avoiding substitution,
 * weak-head normalisation and α-equivalence.
 *
 * A Kernel holds only its depth limit, so one instance may be shared freely
 * between threads. Every operation allocates its own depth guard and, for
 * substitution, its own fresh-name counter.
 */
public class Kernel {
	public static final int DEFAULT_MAX_DEPTH = 1000;

	private static final Kernel STANDARD = new Kernel(DEFAULT_MAX_DEPTH);

	private final int maxDepth;

	public Kernel(int maxDepth) {
		if (maxDepth <= 0) {
			throw new IllegalArgumentException("maximum term depth must be positive, got " + maxDepth);
		}
		this.maxDepth = maxDepth;
	}

	public static Kernel standard() {
		return STANDARD;
	}

	public int getMaxDepth() {
		return maxDepth;
	}

	public Set<String> freeVars(Term term) {
		return term.accept(new FreeVariablesVisitor(new DepthGuard("free variable analysis", maxDepth)));
	}

	/**
	 * Replaces every free occurrence of name in term with replacement.
	 */
	public Term substitute(Term term, String name, Term replacement) {
		DepthGuard guard = new DepthGuard("substitution", maxDepth);
		Set<String> replacementFreeVars = replacement.accept(new FreeVariablesVisitor(guard));
		return term.accept(new SubstitutionVisitor(
				name, replacement, replacementFreeVars, new FreshNameGenerator(), guard));
	}

	public Term normalize(Term term, TypingContext ctx) {
		return term.accept(new WeakHeadNormalisationVisitor(this, new DepthGuard("normalisation", maxDepth)));
	}

	public boolean termsEqual(Term a, Term b) {
		return new TermEquality(this, null, new DepthGuard("equality", maxDepth)).equal(a, b);
	}

	/**
	 * Like {@link #termsEqual(Term, Term)}, but compares weak head normal forms.
	 */
	public boolean termsEqual(Term a, Term b, TypingContext ctx) {
		return new TermEquality(this, ctx, new DepthGuard("equality", maxDepth)).equal(a, b);
	}
}
