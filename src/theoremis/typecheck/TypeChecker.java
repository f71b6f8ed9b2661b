package theoremis.typecheck;

import theoremis.kernel.DepthGuard;
import theoremis.kernel.Kernel;
import theoremis.kernel.TermTooDeepException;
import theoremis.kernel.TypingContext;
import theoremis.model.decl.*;
import theoremis.model.tactic.Tactic;
import theoremis.model.term.Axiom;
import theoremis.model.term.AxiomBundle;
import theoremis.model.term.Sort;
import theoremis.model.term.Term;
import theoremis.model.term.Universe;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

import static theoremis.model.term.TermBuilder.pi;

/**
 * Checks declarations and whole modules against the standard context.
 *
 * Each declaration is checked on its own: parameters are bound in order, then
 * the body or statement is inferred and compared. Once checked, a declaration's
 * name is in scope for the declarations after it.
 */
public class TypeChecker {

	private static final Logger logger = Logger.getLogger(TypeChecker.class.getName());

	private final Kernel kernel;

	public TypeChecker(Kernel kernel) {
		this.kernel = kernel;
	}

	public TypeChecker() {
		this(Kernel.standard());
	}

	/**
	 * Infers the type of a term, recording diagnostics, holes and axiom usage.
	 * A term nested beyond the kernel's depth limit yields an error diagnostic
	 * and no type.
	 */
	public Optional<Term> inferType(TypingContext ctx, Term term, InferenceRecorder recorder) {
		try {
			return new TypeInferenceVisitor(kernel, ctx, recorder, newGuard()).infer(term);
		} catch (TermTooDeepException e) {
			recorder.report(Diagnostic.error(e.getMsg(), null));
			return Optional.empty();
		}
	}

	private DepthGuard newGuard() {
		return new DepthGuard("type inference", kernel.getMaxDepth());
	}

	public TypeCheckResult typeCheck(IRModule module) {
		logger.fine(() -> "checking module " + module.getName() + " under " + module.getAxiomBundle().getName());
		TypingContext ctx = StandardContext.create(module.getAxiomBundle());
		InferenceRecorder recorder = new InferenceRecorder();
		Map<String, Term> inferredTypes = new LinkedHashMap<>();
		for (Declaration declaration : module.getDeclarations()) {
			checkDeclaration(ctx, declaration, recorder, inferredTypes);
			ctx = ctx.extend(declaration.getName(), declaredType(declaration));
		}
		Set<Axiom> axiomUsage = EnumSet.noneOf(Axiom.class);
		axiomUsage.addAll(recorder.getAxiomUsage());
		return new TypeCheckResult(
				new ArrayList<>(recorder.getDiagnostics()),
				inferredTypes,
				new ArrayList<>(recorder.getHoles()),
				axiomUsage);
	}

	/**
	 * The type later declarations see for a checked declaration: its return type
	 * or statement, abstracted over its parameters.
	 */
	private static Term declaredType(Declaration declaration) {
		Term result = declaration.accept(new DeclarationVisitor<Term, RuntimeException>() {
			@Override
			public Term visit(Definition definition) {
				return definition.getReturnType();
			}

			@Override
			public Term visit(Theorem theorem) {
				return theorem.getStatement();
			}

			@Override
			public Term visit(Lemma lemma) {
				return lemma.getStatement();
			}
		});
		List<Param> params = declaration.getParams();
		for (int i = params.size() - 1; i >= 0; i--) {
			result = pi(params.get(i).getName(), params.get(i).getType(), result);
		}
		return result;
	}

	/**
	 * Checks one declaration in the given context, adding its diagnostics, holes
	 * and axiom usage to the recorder and its type to inferredTypes.
	 */
	public void checkDeclaration(TypingContext ctx, Declaration declaration, InferenceRecorder recorder,
								 Map<String, Term> inferredTypes) {
		InferenceRecorder local = new InferenceRecorder();
		DeclarationChecker checker = new DeclarationChecker(ctx, local, newGuard(), inferredTypes);
		try {
			declaration.accept(checker);
		} catch (TermTooDeepException e) {
			local.report(new Diagnostic(Severity.ERROR, "'" + declaration.getName() + "': " + e.getMsg(),
					declaration.getName(), null));
		}
		recorder.addAll(local);
	}

	private class DeclarationChecker extends DeclarationVisitor<Void, RuntimeException> {
		private final TypingContext ctx;
		private final InferenceRecorder recorder;
		private final DepthGuard guard;
		private final Map<String, Term> inferredTypes;

		DeclarationChecker(TypingContext ctx, InferenceRecorder recorder, DepthGuard guard,
						   Map<String, Term> inferredTypes) {
			this.ctx = ctx;
			this.recorder = recorder;
			this.guard = guard;
			this.inferredTypes = inferredTypes;
		}

		private Optional<Term> infer(TypingContext ctx, Term term) {
			return new TypeInferenceVisitor(kernel, ctx, recorder, guard).infer(term);
		}

		private void report(Severity severity, String message, String location, Term term) {
			recorder.report(new Diagnostic(severity, message, location, term));
		}

		private TypingContext bindParams(List<Param> params) {
			TypingContext result = ctx;
			for (Param param : params) {
				if (!infer(result, param.getType()).isPresent()) {
					report(Severity.ERROR, "Parameter '" + param.getName() + "': type is not well-formed",
							null, param.getType());
				}
				result = result.extend(param.getName(), param.getType());
			}
			return result;
		}

		@Override
		public Void visit(Definition definition) {
			String name = definition.getName();
			logger.fine(() -> "checking Definition " + name);
			TypingContext paramCtx = bindParams(definition.getParams());
			Optional<Term> bodyType = infer(paramCtx, definition.getBody());
			if (!bodyType.isPresent()) {
				report(Severity.ERROR, "Definition '" + name + "': could not infer type of body",
						name, definition.getBody());
				return null;
			}
			inferredTypes.put(name, bodyType.get());
			Term declared = kernel.normalize(definition.getReturnType(), paramCtx);
			Term inferred = kernel.normalize(bodyType.get(), paramCtx);
			if (!(declared instanceof Sort) && !kernel.termsEqual(declared, inferred)) {
				report(Severity.WARNING, "Definition '" + name + "': declared return type may not match inferred type",
						name, bodyType.get());
			}
			report(Severity.INFO, "Definition '" + name + "' type-checks successfully", name, null);
			return null;
		}

		private void checkProof(ProofDeclaration declaration) {
			String kind = declaration.getKind();
			String name = declaration.getName();
			logger.fine(() -> "checking " + kind + " " + name);
			TypingContext paramCtx = bindParams(declaration.getParams());
			Optional<Term> statementType = infer(paramCtx, declaration.getStatement());
			if (statementType.isPresent()) {
				inferredTypes.put(name, declaration.getStatement());
				Term sort = kernel.normalize(statementType.get(), paramCtx);
				if (sort instanceof Sort) {
					Universe universe = ((Sort) sort).getUniverse();
					String description = universe.isProp() ? "propositional" : universe.toString();
					report(Severity.INFO, kind + " '" + name + "' statement is well-formed (" + description + ")",
							name, null);
				} else {
					report(Severity.WARNING, kind + " '" + name + "': statement type could not be fully resolved",
							name, statementType.get());
				}
			} else {
				report(Severity.ERROR, kind + " '" + name + "': statement is not well-formed",
						name, declaration.getStatement());
			}

			List<Tactic> proof = declaration.getProof();
			PlaceholderTacticVisitor placeholders = new PlaceholderTacticVisitor();
			if (proof.stream().anyMatch(t -> t.accept(placeholders))) {
				report(Severity.WARNING, kind + " '" + name + "' contains unresolved proof obligations (sorry)",
						name, null);
			} else if (!proof.isEmpty()) {
				String count = proof.size() == 1 ? "1 tactic" : proof.size() + " tactics";
				report(Severity.INFO, kind + " '" + name + "' proof script provided (" + count + ")", name, null);
			} else {
				report(Severity.WARNING, kind + " '" + name + "' has no proof", name, null);
			}
		}

		@Override
		public Void visit(Theorem theorem) {
			checkProof(theorem);
			if (theorem.getAxiomBundle().isPresent()) {
				AxiomBundle bundle = theorem.getAxiomBundle().get();
				for (Axiom axiom : recorder.getAxiomUsage()) {
					if (!bundle.contains(axiom)) {
						report(Severity.WARNING, "Theorem '" + theorem.getName() + "' uses axiom '" + axiom.name()
								+ "' not in bundle '" + bundle.getName() + "'", theorem.getName(), null);
					}
				}
			}
			return null;
		}

		@Override
		public Void visit(Lemma lemma) {
			checkProof(lemma);
			return null;
		}
	}
}
