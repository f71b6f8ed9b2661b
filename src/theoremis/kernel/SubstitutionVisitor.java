package theoremis.kernel;

import theoremis.model.term.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Replaces free occurrences of one name with a term, renaming any binder that
 * would capture a free variable of the replacement.
 *
 * The domain of a binder is always substituted, since it is outside the binder's
 * scope. The body is left alone when the binder shadows the substituted name.
 */
public class SubstitutionVisitor extends TermVisitor<Term, RuntimeException> {

	private static final Logger logger = Logger.getLogger(SubstitutionVisitor.class.getName());

	private final String name;
	private final Term replacement;
	private final Set<String> replacementFreeVars;
	private final FreshNameGenerator freshNames;
	private final DepthGuard guard;

	public SubstitutionVisitor(String name, Term replacement, Set<String> replacementFreeVars,
							   FreshNameGenerator freshNames, DepthGuard guard) {
		this.name = name;
		this.replacement = replacement;
		this.replacementFreeVars = replacementFreeVars;
		this.freshNames = freshNames;
		this.guard = guard;
	}

	private Term sub(Term term) {
		guard.enter();
		try {
			return term.accept(this);
		} finally {
			guard.exit();
		}
	}

	private Set<String> freeVars(Term term) {
		return term.accept(new FreeVariablesVisitor(guard));
	}

	private Term rename(Term term, String from, String to) {
		Set<String> fv = new HashSet<>();
		fv.add(to);
		return term.accept(new SubstitutionVisitor(from, new Var(to), fv, freshNames, guard));
	}

	private String freshFor(String base, Term body, Set<String> extraAvoid) {
		Set<String> avoid = new HashSet<>(replacementFreeVars);
		avoid.addAll(freeVars(body));
		avoid.addAll(extraAvoid);
		avoid.add(name);
		String fresh = freshNames.fresh(base, avoid);
		logger.fine(() -> "renaming bound " + base + " to " + fresh + " while substituting for " + name);
		return fresh;
	}

	private Term binder(Binder binder) {
		Term domain = sub(binder.getDomain());
		String param = binder.getParam();
		if (param.equals(name)) {
			return binder.rebuild(param, domain, binder.getBody());
		}
		if (replacementFreeVars.contains(param)) {
			String fresh = freshFor(param, binder.getBody(), new HashSet<>());
			Term body = rename(binder.getBody(), param, fresh);
			return binder.rebuild(fresh, domain, sub(body));
		}
		return binder.rebuild(param, domain, sub(binder.getBody()));
	}

	@Override
	public Term visit(Var var) throws RuntimeException {
		if (var.getName().equals(name)) {
			return replacement;
		}
		return var;
	}

	@Override
	public Term visit(Lam lam) throws RuntimeException {
		return binder(lam);
	}

	@Override
	public Term visit(App app) throws RuntimeException {
		return new App(sub(app.getFunc()), sub(app.getArg()));
	}

	@Override
	public Term visit(Pi pi) throws RuntimeException {
		return binder(pi);
	}

	@Override
	public Term visit(Sigma sigma) throws RuntimeException {
		return binder(sigma);
	}

	@Override
	public Term visit(Pair pair) throws RuntimeException {
		return new Pair(sub(pair.getFst()), sub(pair.getSnd()));
	}

	@Override
	public Term visit(Proj proj) throws RuntimeException {
		return new Proj(sub(proj.getTerm()), proj.getIndex());
	}

	@Override
	public Term visit(LetIn letIn) throws RuntimeException {
		Term type = sub(letIn.getType());
		Term value = sub(letIn.getValue());
		String bound = letIn.getName();
		if (bound.equals(name)) {
			return new LetIn(bound, type, value, letIn.getBody());
		}
		if (replacementFreeVars.contains(bound)) {
			String fresh = freshFor(bound, letIn.getBody(), new HashSet<>());
			return new LetIn(fresh, type, value, sub(rename(letIn.getBody(), bound, fresh)));
		}
		return new LetIn(bound, type, value, sub(letIn.getBody()));
	}

	@Override
	public Term visit(Sort sort) throws RuntimeException {
		return sort;
	}

	@Override
	public Term visit(Ind ind) throws RuntimeException {
		List<Constructor> constructors = ind.getConstructors().stream()
				.map(c -> new Constructor(c.getName(), sub(c.getType())))
				.collect(Collectors.toList());
		return new Ind(ind.getName(), sub(ind.getType()), constructors);
	}

	private MatchCase matchCase(MatchCase matchCase) {
		if (matchCase.getBindings().contains(name)) {
			return matchCase;
		}
		List<String> bindings = new ArrayList<>();
		Term body = matchCase.getBody();
		for (String binding : matchCase.getBindings()) {
			if (replacementFreeVars.contains(binding)) {
				Set<String> siblings = new HashSet<>(matchCase.getBindings());
				siblings.addAll(bindings);
				String fresh = freshFor(binding, body, siblings);
				body = rename(body, binding, fresh);
				bindings.add(fresh);
			} else {
				bindings.add(binding);
			}
		}
		return new MatchCase(matchCase.getPattern(), bindings, sub(body));
	}

	@Override
	public Term visit(Match match) throws RuntimeException {
		List<MatchCase> cases = match.getCases().stream()
				.map(this::matchCase)
				.collect(Collectors.toList());
		return new Match(sub(match.getScrutinee()), cases);
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
		return new BinOp(binOp.getOperator(), sub(binOp.getLeft()), sub(binOp.getRight()));
	}

	@Override
	public Term visit(UnaryOp unaryOp) throws RuntimeException {
		return new UnaryOp(unaryOp.getOperator(), sub(unaryOp.getOperand()));
	}

	@Override
	public Term visit(Equiv equiv) throws RuntimeException {
		Term left = sub(equiv.getLeft());
		Term right = sub(equiv.getRight());
		if (equiv.getModulus().isPresent()) {
			return new Equiv(left, right, sub(equiv.getModulus().get()));
		}
		return new Equiv(left, right);
	}

	@Override
	public Term visit(ForAll forAll) throws RuntimeException {
		return binder(forAll);
	}

	@Override
	public Term visit(Exists exists) throws RuntimeException {
		return binder(exists);
	}
}
