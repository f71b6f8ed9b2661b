package theoremis.typecheck;

import theoremis.Unreachable;
import theoremis.kernel.DepthGuard;
import theoremis.kernel.Kernel;
import theoremis.kernel.TypingContext;
import theoremis.model.term.*;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

import static theoremis.model.term.StandardTypes.*;
import static theoremis.model.term.TermBuilder.pi;
import static theoremis.model.term.TermBuilder.sigma;
import static theoremis.model.term.TermBuilder.type;

/**
 * Synthesises the type of a term bottom-up. Declared types are only compared
 * afterwards, and a mismatch is a warning or hint rather than an error.
 *
 * An empty result means no type could be determined; the reason, if any, is
 * reported to the {@link InferenceRecorder}.
 */
public class TypeInferenceVisitor extends TermVisitor<Optional<Term>, RuntimeException> {

	private static final Logger logger = Logger.getLogger(TypeInferenceVisitor.class.getName());

	// widening order of the number systems
	private static final List<String> NUMERIC = Arrays.asList(NAT_NAME, INT_NAME, REAL_NAME, COMPLEX_NAME);

	private final Kernel kernel;
	private final TypingContext ctx;
	private final InferenceRecorder recorder;
	private final DepthGuard guard;

	public TypeInferenceVisitor(Kernel kernel, TypingContext ctx, InferenceRecorder recorder, DepthGuard guard) {
		this.kernel = kernel;
		this.ctx = ctx;
		this.recorder = recorder;
		this.guard = guard;
	}

	public Optional<Term> infer(Term term) {
		guard.enter();
		try {
			return term.accept(this);
		} finally {
			guard.exit();
		}
	}

	private Optional<Term> inferUnder(String name, Term type, Term body) {
		return new TypeInferenceVisitor(kernel, ctx.extend(name, type), recorder, guard).infer(body);
	}

	private Term whnf(Term term) {
		return kernel.normalize(term, ctx);
	}

	private static boolean isProp(Term sort) {
		return sort instanceof Sort && ((Sort) sort).getUniverse().isProp();
	}

	private static int typeLevel(Term sort) {
		if (sort instanceof Sort && !((Sort) sort).getUniverse().isProp()) {
			return ((Sort) sort).getUniverse().getLevel();
		}
		return 0;
	}

	@Override
	public Optional<Term> visit(Var var) throws RuntimeException {
		Optional<Term> type = ctx.lookup(var.getName());
		if (!type.isPresent()) {
			recorder.report(Diagnostic.error("Unbound variable '" + var.getName() + "'", var));
		}
		return type;
	}

	@Override
	public Optional<Term> visit(Lam lam) throws RuntimeException {
		if (!infer(lam.getParamType()).isPresent()) {
			return Optional.empty();
		}
		return inferUnder(lam.getParam(), lam.getParamType(), lam.getBody())
				.map(bodyType -> pi(lam.getParam(), lam.getParamType(), bodyType));
	}

	@Override
	public Optional<Term> visit(App app) throws RuntimeException {
		Optional<Term> funcType = infer(app.getFunc());
		if (!funcType.isPresent()) {
			return Optional.empty();
		}
		Term func = whnf(funcType.get());
		if (func instanceof Pi) {
			Pi pi = (Pi) func;
			Optional<Term> argType = infer(app.getArg());
			if (argType.isPresent() && !kernel.termsEqual(whnf(argType.get()), whnf(pi.getParamType()))) {
				recorder.report(Diagnostic.hint("Application: argument type may not match parameter type", app.getArg()));
			}
			return Optional.of(kernel.substitute(pi.getBody(), pi.getParam(), app.getArg()));
		}
		infer(app.getArg());
		return Optional.of(TYPE0);
	}

	private Optional<Term> typeFormer(Binder binder) {
		Optional<Term> domainType = infer(binder.getDomain());
		Optional<Term> bodyType = inferUnder(binder.getParam(), binder.getDomain(), binder.getBody());
		if (!domainType.isPresent() || !bodyType.isPresent()) {
			return Optional.of(TYPE0);
		}
		Term bodySort = whnf(bodyType.get());
		if (isProp(bodySort)) {
			// impredicative
			return Optional.of(PROP);
		}
		return Optional.of(type(Math.max(typeLevel(whnf(domainType.get())), typeLevel(bodySort))));
	}

	@Override
	public Optional<Term> visit(Pi pi) throws RuntimeException {
		return typeFormer(pi);
	}

	@Override
	public Optional<Term> visit(Sigma sigma) throws RuntimeException {
		return typeFormer(sigma);
	}

	@Override
	public Optional<Term> visit(Pair pair) throws RuntimeException {
		Optional<Term> fstType = infer(pair.getFst());
		Optional<Term> sndType = infer(pair.getSnd());
		if (fstType.isPresent() && sndType.isPresent()) {
			return Optional.of(sigma(TermBuilder.ANONYMOUS, fstType.get(), sndType.get()));
		}
		return Optional.empty();
	}

	@Override
	public Optional<Term> visit(Proj proj) throws RuntimeException {
		Optional<Term> pairType = infer(proj.getTerm());
		if (pairType.isPresent()) {
			Term norm = whnf(pairType.get());
			if (norm instanceof Sigma) {
				Sigma sigma = (Sigma) norm;
				return Optional.of(proj.getIndex() == 1 ? sigma.getParamType() : sigma.getBody());
			}
		}
		return Optional.of(TYPE0);
	}

	@Override
	public Optional<Term> visit(LetIn letIn) throws RuntimeException {
		Optional<Term> valueType = infer(letIn.getValue());
		Optional<Term> declaredTypeType = infer(letIn.getType());
		if (valueType.isPresent() && declaredTypeType.isPresent()
				&& !kernel.termsEqual(whnf(valueType.get()), whnf(letIn.getType()))) {
			recorder.report(Diagnostic.warning(
					"let '" + letIn.getName() + "': declared type may not match value type", letIn.getValue()));
		}
		return inferUnder(letIn.getName(), letIn.getType(), letIn.getBody());
	}

	@Override
	public Optional<Term> visit(Sort sort) throws RuntimeException {
		Universe universe = sort.getUniverse();
		return Optional.of(universe.isProp() ? TYPE1 : type(universe.getLevel() + 1));
	}

	@Override
	public Optional<Term> visit(Ind ind) throws RuntimeException {
		infer(ind.getType());
		TypeInferenceVisitor inner = new TypeInferenceVisitor(kernel, ctx.extend(ind.getName(), ind.getType()), recorder, guard);
		for (Constructor constructor : ind.getConstructors()) {
			inner.infer(constructor.getType());
		}
		return Optional.of(TYPE1);
	}

	@Override
	public Optional<Term> visit(Match match) throws RuntimeException {
		infer(match.getScrutinee());
		Optional<Term> result = Optional.empty();
		for (MatchCase matchCase : match.getCases()) {
			TypingContext caseCtx = ctx;
			for (String binding : matchCase.getBindings()) {
				caseCtx = caseCtx.extend(binding, TYPE0);
			}
			Optional<Term> caseType = new TypeInferenceVisitor(kernel, caseCtx, recorder, guard).infer(matchCase.getBody());
			if (!result.isPresent()) {
				result = caseType;
			}
		}
		return Optional.of(result.orElse(TYPE0));
	}

	@Override
	public Optional<Term> visit(Hole hole) throws RuntimeException {
		logger.fine(() -> "hole ?" + hole.getId() + " with " + ctx.getBindings().size() + " name(s) in scope");
		recorder.hole(new HoleInfo(hole.getId(), null, ctx.getBindings(), HoleSuggestions.suggest(ctx, hole)));
		return Optional.empty();
	}

	@Override
	public Optional<Term> visit(AxiomRef axiomRef) throws RuntimeException {
		Axiom axiom = axiomRef.getAxiom();
		recorder.useAxiom(axiom);
		AxiomBundle bundle = ctx.getAxiomBundle();
		if (!bundle.contains(axiom)) {
			recorder.report(Diagnostic.warning(
					"Axiom '" + axiom.name() + "' used but not in current bundle '" + bundle.getName() + "'", axiomRef));
		}
		return Optional.of(PROP);
	}

	@Override
	public Optional<Term> visit(Literal literal) throws RuntimeException {
		switch (literal.getKind()) {
			case Nat:
				return Optional.of(NAT);
			case Int:
				return Optional.of(INT);
			case Bool:
				return Optional.of(BOOL);
			case String:
				return Optional.of(STRING);
			default:
				throw new Unreachable("literal kind " + literal.getKind());
		}
	}

	@Override
	public Optional<Term> visit(BinOp binOp) throws RuntimeException {
		Optional<Term> leftType = infer(binOp.getLeft());
		Optional<Term> rightType = infer(binOp.getRight());
		if (binOp.getOperator().isPropositional()) {
			return Optional.of(PROP);
		}
		if (!leftType.isPresent() || !rightType.isPresent()) {
			return Optional.of(NAT);
		}
		Term left = whnf(leftType.get());
		Term right = whnf(rightType.get());
		if (left instanceof Var && right instanceof Var) {
			String l = ((Var) left).getName();
			String r = ((Var) right).getName();
			if (l.equals(r)) {
				return Optional.of(left);
			}
			int li = NUMERIC.indexOf(l);
			int ri = NUMERIC.indexOf(r);
			if (li >= 0 && ri >= 0) {
				return Optional.of(new Var(NUMERIC.get(Math.max(li, ri))));
			}
		}
		return Optional.of(left);
	}

	@Override
	public Optional<Term> visit(UnaryOp unaryOp) throws RuntimeException {
		Optional<Term> operandType = infer(unaryOp.getOperand());
		if (unaryOp.getOperator() == UnaryOperator.NOT) {
			return Optional.of(PROP);
		}
		if (!operandType.isPresent()) {
			return Optional.of(INT);
		}
		Term norm = whnf(operandType.get());
		if (norm.equals(NAT)) {
			return Optional.of(INT);
		}
		return Optional.of(norm);
	}

	@Override
	public Optional<Term> visit(Equiv equiv) throws RuntimeException {
		infer(equiv.getLeft());
		infer(equiv.getRight());
		equiv.getModulus().ifPresent(this::infer);
		return Optional.of(PROP);
	}

	private Optional<Term> quantifier(Binder binder) {
		infer(binder.getDomain());
		inferUnder(binder.getParam(), binder.getDomain(), binder.getBody());
		return Optional.of(PROP);
	}

	@Override
	public Optional<Term> visit(ForAll forAll) throws RuntimeException {
		return quantifier(forAll);
	}

	@Override
	public Optional<Term> visit(Exists exists) throws RuntimeException {
		return quantifier(exists);
	}
}
