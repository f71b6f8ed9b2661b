package theoremis.kernel;

import theoremis.model.term.*;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Structural equality up to renaming of λ, Π, Σ, ∀ and ∃ binders. When a
 * typing context is supplied, both sides are first reduced to weak head normal
 * form, and so is every pair of subterms compared below them.
 *
 * Let-bindings and match cases compare their names pointwise.
 */
public class TermEquality {

	private final Kernel kernel;
	private final TypingContext ctx;
	private final DepthGuard guard;

	public TermEquality(Kernel kernel, TypingContext ctx, DepthGuard guard) {
		this.kernel = kernel;
		this.ctx = ctx;
		this.guard = guard;
	}

	public boolean equal(Term a, Term b) {
		guard.enter();
		try {
			if (ctx != null) {
				a = kernel.normalize(a, ctx);
				b = kernel.normalize(b, ctx);
			}
			return a.accept(new EqualityVisitor(b));
		} finally {
			guard.exit();
		}
	}

	private boolean allEqual(List<Term> as, List<Term> bs) {
		if (as.size() != bs.size()) {
			return false;
		}
		for (int i = 0; i < as.size(); i++) {
			if (!equal(as.get(i), bs.get(i))) {
				return false;
			}
		}
		return true;
	}

	private boolean binderEqual(Binder a, Binder b) {
		if (!equal(a.getDomain(), b.getDomain())) {
			return false;
		}
		if (a.getParam().equals(b.getParam())) {
			return equal(a.getBody(), b.getBody());
		}
		Set<String> rightFree = kernel.freeVars(b.getBody());
		if (!rightFree.contains(a.getParam())) {
			return equal(a.getBody(), kernel.substitute(b.getBody(), b.getParam(), new Var(a.getParam())));
		}
		// the left name occurs free on the right, so rename both sides apart
		Set<String> avoid = new HashSet<>(rightFree);
		avoid.addAll(kernel.freeVars(a.getBody()));
		avoid.add(a.getParam());
		avoid.add(b.getParam());
		Var fresh = new Var(new FreshNameGenerator().fresh(a.getParam(), avoid));
		return equal(
				kernel.substitute(a.getBody(), a.getParam(), fresh),
				kernel.substitute(b.getBody(), b.getParam(), fresh));
	}

	private class EqualityVisitor extends TermVisitor<Boolean, RuntimeException> {
		private final Term other;

		EqualityVisitor(Term other) {
			this.other = other;
		}

		@Override
		public Boolean visit(Var var) throws RuntimeException {
			return other instanceof Var && ((Var) other).getName().equals(var.getName());
		}

		@Override
		public Boolean visit(Lam lam) throws RuntimeException {
			return other instanceof Lam && binderEqual(lam, (Binder) other);
		}

		@Override
		public Boolean visit(App app) throws RuntimeException {
			if (!(other instanceof App)) {
				return false;
			}
			App o = (App) other;
			return equal(app.getFunc(), o.getFunc()) && equal(app.getArg(), o.getArg());
		}

		@Override
		public Boolean visit(Pi pi) throws RuntimeException {
			return other instanceof Pi && binderEqual(pi, (Binder) other);
		}

		@Override
		public Boolean visit(Sigma sigma) throws RuntimeException {
			return other instanceof Sigma && binderEqual(sigma, (Binder) other);
		}

		@Override
		public Boolean visit(Pair pair) throws RuntimeException {
			if (!(other instanceof Pair)) {
				return false;
			}
			Pair o = (Pair) other;
			return equal(pair.getFst(), o.getFst()) && equal(pair.getSnd(), o.getSnd());
		}

		@Override
		public Boolean visit(Proj proj) throws RuntimeException {
			if (!(other instanceof Proj)) {
				return false;
			}
			Proj o = (Proj) other;
			return proj.getIndex() == o.getIndex() && equal(proj.getTerm(), o.getTerm());
		}

		@Override
		public Boolean visit(LetIn letIn) throws RuntimeException {
			if (!(other instanceof LetIn)) {
				return false;
			}
			LetIn o = (LetIn) other;
			return letIn.getName().equals(o.getName())
					&& equal(letIn.getType(), o.getType())
					&& equal(letIn.getValue(), o.getValue())
					&& equal(letIn.getBody(), o.getBody());
		}

		@Override
		public Boolean visit(Sort sort) throws RuntimeException {
			return other instanceof Sort && ((Sort) other).getUniverse().equals(sort.getUniverse());
		}

		@Override
		public Boolean visit(Ind ind) throws RuntimeException {
			if (!(other instanceof Ind)) {
				return false;
			}
			Ind o = (Ind) other;
			if (!ind.getName().equals(o.getName()) || !equal(ind.getType(), o.getType())
					|| ind.getConstructors().size() != o.getConstructors().size()) {
				return false;
			}
			for (int i = 0; i < ind.getConstructors().size(); i++) {
				Constructor c = ind.getConstructors().get(i);
				Constructor oc = o.getConstructors().get(i);
				if (!c.getName().equals(oc.getName()) || !equal(c.getType(), oc.getType())) {
					return false;
				}
			}
			return true;
		}

		@Override
		public Boolean visit(Match match) throws RuntimeException {
			if (!(other instanceof Match)) {
				return false;
			}
			Match o = (Match) other;
			if (!equal(match.getScrutinee(), o.getScrutinee()) || match.getCases().size() != o.getCases().size()) {
				return false;
			}
			for (int i = 0; i < match.getCases().size(); i++) {
				MatchCase c = match.getCases().get(i);
				MatchCase oc = o.getCases().get(i);
				if (!c.getPattern().equals(oc.getPattern()) || !c.getBindings().equals(oc.getBindings())
						|| !equal(c.getBody(), oc.getBody())) {
					return false;
				}
			}
			return true;
		}

		@Override
		public Boolean visit(Hole hole) throws RuntimeException {
			return hole.equals(other);
		}

		@Override
		public Boolean visit(AxiomRef axiomRef) throws RuntimeException {
			return axiomRef.equals(other);
		}

		@Override
		public Boolean visit(Literal literal) throws RuntimeException {
			return literal.equals(other);
		}

		@Override
		public Boolean visit(BinOp binOp) throws RuntimeException {
			if (!(other instanceof BinOp)) {
				return false;
			}
			BinOp o = (BinOp) other;
			return binOp.getOperator() == o.getOperator()
					&& equal(binOp.getLeft(), o.getLeft())
					&& equal(binOp.getRight(), o.getRight());
		}

		@Override
		public Boolean visit(UnaryOp unaryOp) throws RuntimeException {
			if (!(other instanceof UnaryOp)) {
				return false;
			}
			UnaryOp o = (UnaryOp) other;
			return unaryOp.getOperator() == o.getOperator() && equal(unaryOp.getOperand(), o.getOperand());
		}

		@Override
		public Boolean visit(Equiv equiv) throws RuntimeException {
			if (!(other instanceof Equiv)) {
				return false;
			}
			Equiv o = (Equiv) other;
			Optional<Term> m = equiv.getModulus();
			Optional<Term> om = o.getModulus();
			if (m.isPresent() != om.isPresent()) {
				return false;
			}
			return equal(equiv.getLeft(), o.getLeft())
					&& equal(equiv.getRight(), o.getRight())
					&& (!m.isPresent() || equal(m.get(), om.get()));
		}

		@Override
		public Boolean visit(ForAll forAll) throws RuntimeException {
			return other instanceof ForAll && binderEqual(forAll, (Binder) other);
		}

		@Override
		public Boolean visit(Exists exists) throws RuntimeException {
			return other instanceof Exists && binderEqual(exists, (Binder) other);
		}
	}
}
