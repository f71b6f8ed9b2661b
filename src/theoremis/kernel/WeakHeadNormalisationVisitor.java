package theoremis.kernel;

import theoremis.model.term.*;

/**
 * Reduces a term to weak head normal form: β-redexes, let-bindings and
 * projections of pairs in head position are contracted, and nothing else is
 * touched. In particular the argument of a stuck application stays as written.
 */
public class WeakHeadNormalisationVisitor extends TermVisitor<Term, RuntimeException> {

	private final Kernel kernel;
	private final DepthGuard guard;

	public WeakHeadNormalisationVisitor(Kernel kernel, DepthGuard guard) {
		this.kernel = kernel;
		this.guard = guard;
	}

	private Term whnf(Term term) {
		guard.enter();
		try {
			return term.accept(this);
		} finally {
			guard.exit();
		}
	}

	@Override
	public Term visit(Var var) throws RuntimeException {
		return var;
	}

	@Override
	public Term visit(Lam lam) throws RuntimeException {
		return lam;
	}

	@Override
	public Term visit(App app) throws RuntimeException {
		Term func = whnf(app.getFunc());
		if (func instanceof Lam) {
			Lam lam = (Lam) func;
			return whnf(kernel.substitute(lam.getBody(), lam.getParam(), app.getArg()));
		}
		return new App(func, app.getArg());
	}

	@Override
	public Term visit(Pi pi) throws RuntimeException {
		return pi;
	}

	@Override
	public Term visit(Sigma sigma) throws RuntimeException {
		return sigma;
	}

	@Override
	public Term visit(Pair pair) throws RuntimeException {
		return pair;
	}

	@Override
	public Term visit(Proj proj) throws RuntimeException {
		Term inner = whnf(proj.getTerm());
		if (inner instanceof Pair) {
			Pair pair = (Pair) inner;
			return whnf(proj.getIndex() == 1 ? pair.getFst() : pair.getSnd());
		}
		return new Proj(inner, proj.getIndex());
	}

	@Override
	public Term visit(LetIn letIn) throws RuntimeException {
		return whnf(kernel.substitute(letIn.getBody(), letIn.getName(), letIn.getValue()));
	}

	@Override
	public Term visit(Sort sort) throws RuntimeException {
		return sort;
	}

	@Override
	public Term visit(Ind ind) throws RuntimeException {
		return ind;
	}

	@Override
	public Term visit(Match match) throws RuntimeException {
		return match;
	}

	@Override
	public Term visit(Hole hole) throws RuntimeException {
		return hole;
	}

	@Override
	public Term visit(AxiomRef axiomRef) throws RuntimeException {
		return axiomRef;
	}

	@Override
	public Term visit(Literal literal) throws RuntimeException {
		return literal;
	}

	@Override
	public Term visit(BinOp binOp) throws RuntimeException {
		return binOp;
	}

	@Override
	public Term visit(UnaryOp unaryOp) throws RuntimeException {
		return unaryOp;
	}

	@Override
	public Term visit(Equiv equiv) throws RuntimeException {
		return equiv;
	}

	@Override
	public Term visit(ForAll forAll) throws RuntimeException {
		return forAll;
	}

	@Override
	public Term visit(Exists exists) throws RuntimeException {
		return exists;
	}
}
