package theoremis.model.term;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The immediate subterms of a term, in source order.
 */
public class SubtermsVisitor extends TermVisitor<List<Term>, RuntimeException> {

	private static List<Term> binder(Binder binder) {
		return Arrays.asList(binder.getDomain(), binder.getBody());
	}

	@Override
	public List<Term> visit(Var var) {
		return Collections.emptyList();
	}

	@Override
	public List<Term> visit(Lam lam) {
		return binder(lam);
	}

	@Override
	public List<Term> visit(App app) {
		return Arrays.asList(app.getFunc(), app.getArg());
	}

	@Override
	public List<Term> visit(Pi pi) {
		return binder(pi);
	}

	@Override
	public List<Term> visit(Sigma sigma) {
		return binder(sigma);
	}

	@Override
	public List<Term> visit(Pair pair) {
		return Arrays.asList(pair.getFst(), pair.getSnd());
	}

	@Override
	public List<Term> visit(Proj proj) {
		return Collections.singletonList(proj.getTerm());
	}

	@Override
	public List<Term> visit(LetIn letIn) {
		return Arrays.asList(letIn.getType(), letIn.getValue(), letIn.getBody());
	}

	@Override
	public List<Term> visit(Sort sort) {
		return Collections.emptyList();
	}

	@Override
	public List<Term> visit(Ind ind) {
		List<Term> result = new ArrayList<>();
		result.add(ind.getType());
		for (Constructor constructor : ind.getConstructors()) {
			result.add(constructor.getType());
		}
		return result;
	}

	@Override
	public List<Term> visit(Match match) {
		List<Term> result = new ArrayList<>();
		result.add(match.getScrutinee());
		for (MatchCase matchCase : match.getCases()) {
			result.add(matchCase.getBody());
		}
		return result;
	}

	@Override
	public List<Term> visit(Hole hole) {
		return Collections.emptyList();
	}

	@Override
	public List<Term> visit(AxiomRef axiomRef) {
		return Collections.emptyList();
	}

	@Override
	public List<Term> visit(Literal literal) {
		return Collections.emptyList();
	}

	@Override
	public List<Term> visit(BinOp binOp) {
		return Arrays.asList(binOp.getLeft(), binOp.getRight());
	}

	@Override
	public List<Term> visit(UnaryOp unaryOp) {
		return Collections.singletonList(unaryOp.getOperand());
	}

	@Override
	public List<Term> visit(Equiv equiv) {
		List<Term> result = new ArrayList<>(Arrays.asList(equiv.getLeft(), equiv.getRight()));
		equiv.getModulus().ifPresent(result::add);
		return result;
	}

	@Override
	public List<Term> visit(ForAll forAll) {
		return binder(forAll);
	}

	@Override
	public List<Term> visit(Exists exists) {
		return binder(exists);
	}
}
