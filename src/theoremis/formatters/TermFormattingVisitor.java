package theoremis.formatters;

import theoremis.model.term.*;

import java.io.IOException;

/**
 * Renders terms in mathematical notation, e.g. λ (x : ℕ) ⇒ (x + 1).
 */
public class TermFormattingVisitor extends TermVisitor<Void, IOException> {

	private final IndentingWriter out;

	public TermFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void binder(String symbol, String param, Term domain) throws IOException {
		out.write(symbol);
		out.write(" (");
		out.write(param);
		out.write(" : ");
		domain.accept(this);
		out.write(")");
	}

	@Override
	public Void visit(Var var) throws IOException {
		out.write(var.getName());
		return null;
	}

	@Override
	public Void visit(Lam lam) throws IOException {
		binder("λ", lam.getParam(), lam.getParamType());
		out.write(" ⇒ ");
		lam.getBody().accept(this);
		return null;
	}

	@Override
	public Void visit(App app) throws IOException {
		out.write("(");
		app.getFunc().accept(this);
		out.write(" ");
		app.getArg().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(Pi pi) throws IOException {
		if (pi.getParam().equals(TermBuilder.ANONYMOUS)) {
			pi.getParamType().accept(this);
			out.write(" → ");
		} else {
			binder("Π", pi.getParam(), pi.getParamType());
			out.write(", ");
		}
		pi.getBody().accept(this);
		return null;
	}

	@Override
	public Void visit(Sigma sigma) throws IOException {
		binder("Σ", sigma.getParam(), sigma.getParamType());
		out.write(", ");
		sigma.getBody().accept(this);
		return null;
	}

	@Override
	public Void visit(Pair pair) throws IOException {
		out.write("⟨");
		pair.getFst().accept(this);
		out.write(", ");
		pair.getSnd().accept(this);
		out.write("⟩");
		return null;
	}

	@Override
	public Void visit(Proj proj) throws IOException {
		proj.getTerm().accept(this);
		out.write(".");
		out.write(Integer.toString(proj.getIndex()));
		return null;
	}

	@Override
	public Void visit(LetIn letIn) throws IOException {
		out.write("let ");
		out.write(letIn.getName());
		out.write(" : ");
		letIn.getType().accept(this);
		out.write(" := ");
		letIn.getValue().accept(this);
		out.write(" in");
		out.newLine();
		letIn.getBody().accept(this);
		return null;
	}

	@Override
	public Void visit(Sort sort) throws IOException {
		out.write(sort.getUniverse().toString());
		return null;
	}

	@Override
	public Void visit(Ind ind) throws IOException {
		out.write("inductive ");
		out.write(ind.getName());
		out.write(" : ");
		ind.getType().accept(this);
		out.write(" where");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (Constructor constructor : ind.getConstructors()) {
				out.newLine();
				out.write("| ");
				out.write(constructor.getName());
				out.write(" : ");
				constructor.getType().accept(this);
			}
		}
		return null;
	}

	@Override
	public Void visit(Match match) throws IOException {
		out.write("match ");
		match.getScrutinee().accept(this);
		out.write(" with");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (MatchCase matchCase : match.getCases()) {
				out.newLine();
				out.write("| ");
				out.write(matchCase.getPattern());
				for (String binding : matchCase.getBindings()) {
					out.write(" ");
					out.write(binding);
				}
				out.write(" => ");
				matchCase.getBody().accept(this);
			}
		}
		return null;
	}

	@Override
	public Void visit(Hole hole) throws IOException {
		out.write("?");
		out.write(hole.getId());
		return null;
	}

	@Override
	public Void visit(AxiomRef axiomRef) throws IOException {
		out.write("axiom[");
		out.write(axiomRef.getAxiom().name());
		out.write("]");
		return null;
	}

	@Override
	public Void visit(Literal literal) throws IOException {
		out.write(literal.getValue());
		return null;
	}

	@Override
	public Void visit(BinOp binOp) throws IOException {
		out.write("(");
		binOp.getLeft().accept(this);
		out.write(" ");
		out.write(binOp.getOperator().getSymbol());
		out.write(" ");
		binOp.getRight().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(UnaryOp unaryOp) throws IOException {
		out.write("(");
		out.write(unaryOp.getOperator().getSymbol());
		unaryOp.getOperand().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(Equiv equiv) throws IOException {
		equiv.getLeft().accept(this);
		out.write(" ≡ ");
		equiv.getRight().accept(this);
		if (equiv.getModulus().isPresent()) {
			out.write(" [MOD ");
			equiv.getModulus().get().accept(this);
			out.write("]");
		}
		return null;
	}

	@Override
	public Void visit(ForAll forAll) throws IOException {
		quantifier("∀", forAll);
		return null;
	}

	@Override
	public Void visit(Exists exists) throws IOException {
		quantifier("∃", exists);
		return null;
	}

	private void quantifier(String symbol, Binder binder) throws IOException {
		out.write(symbol);
		out.write(" ");
		out.write(binder.getParam());
		out.write(" ∈ ");
		binder.getDomain().accept(this);
		out.write(", ");
		binder.getBody().accept(this);
	}
}
