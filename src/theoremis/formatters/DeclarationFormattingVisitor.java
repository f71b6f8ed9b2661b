package theoremis.formatters;

import theoremis.model.decl.*;
import theoremis.model.tactic.Tactic;

import java.io.IOException;

/**
 * Renders declarations as def/theorem/lemma blocks. A proof script that is
 * empty is written as {@code sorry}.
 */
public class DeclarationFormattingVisitor extends DeclarationVisitor<Void, IOException> {

	private final IndentingWriter out;

	public DeclarationFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void header(String keyword, Declaration declaration) throws IOException {
		out.write(keyword);
		out.write(" ");
		out.write(declaration.getName());
		for (Param param : declaration.getParams()) {
			out.write(" ");
			out.write(param.isImplicit() ? "{" : "(");
			out.write(param.getName());
			out.write(" : ");
			param.getType().accept(new TermFormattingVisitor(out));
			out.write(param.isImplicit() ? "}" : ")");
		}
	}

	@Override
	public Void visit(Definition definition) throws IOException {
		header("def", definition);
		out.write(" : ");
		definition.getReturnType().accept(new TermFormattingVisitor(out));
		out.write(" :=");
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			definition.getBody().accept(new TermFormattingVisitor(out));
		}
		return null;
	}

	private void proofDeclaration(String keyword, ProofDeclaration declaration) throws IOException {
		header(keyword, declaration);
		out.write(" :");
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			declaration.getStatement().accept(new TermFormattingVisitor(out));
			out.write(" := by");
			if (declaration.getProof().isEmpty()) {
				out.newLine();
				out.write("sorry");
			}
			for (Tactic tactic : declaration.getProof()) {
				out.newLine();
				tactic.accept(new TacticFormattingVisitor(out));
			}
		}
	}

	@Override
	public Void visit(Theorem theorem) throws IOException {
		proofDeclaration("theorem", theorem);
		return null;
	}

	@Override
	public Void visit(Lemma lemma) throws IOException {
		proofDeclaration("lemma", lemma);
		return null;
	}
}
