package theoremis.formatters;

import theoremis.model.tactic.*;
import theoremis.model.term.Term;

import java.io.IOException;

/**
 * Renders tactics in Lean-like proof script syntax. A {@link Seq} puts each
 * step on its own line; an {@link Alt} joins its alternatives with {@code <|>}.
 */
public class TacticFormattingVisitor extends TacticVisitor<Void, IOException> {

	private final IndentingWriter out;

	public TacticFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void withTerm(String keyword, Term term) throws IOException {
		out.write(keyword);
		out.write(" ");
		term.accept(new TermFormattingVisitor(out));
	}

	@Override
	public Void visit(Intro intro) throws IOException {
		out.write("intro");
		for (String name : intro.getNames()) {
			out.write(" ");
			out.write(name);
		}
		return null;
	}

	@Override
	public Void visit(Apply apply) throws IOException {
		withTerm("apply", apply.getTerm());
		return null;
	}

	@Override
	public Void visit(Rewrite rewrite) throws IOException {
		out.write("rw [");
		if (rewrite.getDirection() == Rewrite.Direction.RTL) {
			out.write("← ");
		}
		rewrite.getTerm().accept(new TermFormattingVisitor(out));
		out.write("]");
		return null;
	}

	@Override
	public Void visit(Induction induction) throws IOException {
		out.write("induction ");
		out.write(induction.getName());
		return null;
	}

	@Override
	public Void visit(Cases cases) throws IOException {
		withTerm("cases", cases.getTerm());
		return null;
	}

	@Override
	public Void visit(Simp simp) throws IOException {
		out.write("simp");
		if (!simp.getLemmas().isEmpty()) {
			out.write(" [");
			FormattingTools.writeCommaSeparated(out, simp.getLemmas(), out::write);
			out.write("]");
		}
		return null;
	}

	@Override
	public Void visit(Omega omega) throws IOException {
		out.write("omega");
		return null;
	}

	@Override
	public Void visit(Sorry sorry) throws IOException {
		out.write("sorry");
		return null;
	}

	@Override
	public Void visit(Auto auto) throws IOException {
		out.write("auto ");
		out.write(Integer.toString(auto.getDepth()));
		return null;
	}

	@Override
	public Void visit(Seq seq) throws IOException {
		FormattingTools.writeSeparated(out, "\n", seq.getTactics(), t -> t.accept(this));
		return null;
	}

	@Override
	public Void visit(Alt alt) throws IOException {
		FormattingTools.writeSeparated(out, " <|> ", alt.getTactics(), t -> t.accept(this));
		return null;
	}

	@Override
	public Void visit(Exact exact) throws IOException {
		withTerm("exact", exact.getTerm());
		return null;
	}

	@Override
	public Void visit(Ring ring) throws IOException {
		out.write("ring");
		return null;
	}

	@Override
	public Void visit(LLMSuggest llmSuggest) throws IOException {
		out.write("-- LLM suggestion: ");
		out.write(llmSuggest.getContext());
		return null;
	}
}
