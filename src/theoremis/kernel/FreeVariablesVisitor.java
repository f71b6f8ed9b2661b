package theoremis.kernel;

import theoremis.model.term.*;

import java.util.HashSet;
import java.util.Set;

/**
 * Collects the names occurring free in a term. Binder domains, let types and
 * let values are in the outer scope; the bound name is removed from the body only.
 */
public class FreeVariablesVisitor extends TermVisitor<Set<String>, RuntimeException> {

	private final DepthGuard guard;

	public FreeVariablesVisitor(DepthGuard guard) {
		this.guard = guard;
	}

	private Set<String> of(Term term) {
		guard.enter();
		try {
			return term.accept(this);
		} finally {
			guard.exit();
		}
	}

	private Set<String> union(Term a, Term b) {
		Set<String> result = of(a);
		result.addAll(of(b));
		return result;
	}

	private Set<String> binder(Binder binder) {
		Set<String> result = of(binder.getBody());
		result.remove(binder.getParam());
		result.addAll(of(binder.getDomain()));
		return result;
	}

	@Override
	public Set<String> visit(Var var) throws RuntimeException {
		Set<String> result = new HashSet<>();
		result.add(var.getName());
		return result;
	}

	@Override
	public Set<String> visit(Lam lam) throws RuntimeException {
		return binder(lam);
	}

	@Override
	public Set<String> visit(App app) throws RuntimeException {
		return union(app.getFunc(), app.getArg());
	}

	@Override
	public Set<String> visit(Pi pi) throws RuntimeException {
		return binder(pi);
	}

	@Override
	public Set<String> visit(Sigma sigma) throws RuntimeException {
		return binder(sigma);
	}

	@Override
	public Set<String> visit(Pair pair) throws RuntimeException {
		return union(pair.getFst(), pair.getSnd());
	}

	@Override
	public Set<String> visit(Proj proj) throws RuntimeException {
		return of(proj.getTerm());
	}

	@Override
	public Set<String> visit(LetIn letIn) throws RuntimeException {
		Set<String> result = of(letIn.getBody());
		result.remove(letIn.getName());
		result.addAll(of(letIn.getType()));
		result.addAll(of(letIn.getValue()));
		return result;
	}

	@Override
	public Set<String> visit(Sort sort) throws RuntimeException {
		return new HashSet<>();
	}

	@Override
	public Set<String> visit(Ind ind) throws RuntimeException {
		Set<String> result = of(ind.getType());
		for (Constructor constructor : ind.getConstructors()) {
			result.addAll(of(constructor.getType()));
		}
		return result;
	}

	@Override
	public Set<String> visit(Match match) throws RuntimeException {
		Set<String> result = of(match.getScrutinee());
		for (MatchCase matchCase : match.getCases()) {
			Set<String> body = of(matchCase.getBody());
			body.removeAll(matchCase.getBindings());
			result.addAll(body);
		}
		return result;
	}

	@Override
	public Set<String> visit(Hole hole) throws RuntimeException {
		return new HashSet<>();
	}

	@Override
	public Set<String> visit(AxiomRef axiomRef) throws RuntimeException {
		return new HashSet<>();
	}

	@Override
	public Set<String> visit(Literal literal) throws RuntimeException {
		return new HashSet<>();
	}

	@Override
	public Set<String> visit(BinOp binOp) throws RuntimeException {
		return union(binOp.getLeft(), binOp.getRight());
	}

	@Override
	public Set<String> visit(UnaryOp unaryOp) throws RuntimeException {
		return of(unaryOp.getOperand());
	}

	@Override
	public Set<String> visit(Equiv equiv) throws RuntimeException {
		Set<String> result = union(equiv.getLeft(), equiv.getRight());
		equiv.getModulus().ifPresent(m -> result.addAll(of(m)));
		return result;
	}

	@Override
	public Set<String> visit(ForAll forAll) throws RuntimeException {
		return binder(forAll);
	}

	@Override
	public Set<String> visit(Exists exists) throws RuntimeException {
		return binder(exists);
	}
}
