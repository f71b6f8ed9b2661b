package theoremis.typecheck;

import theoremis.Unreachable;
import theoremis.formatters.IndentingWriter;
import theoremis.model.term.Axiom;
import theoremis.model.term.Term;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class TypeCheckResult {
	private final boolean valid;
	private final List<Diagnostic> diagnostics;
	private final Map<String, Term> inferredTypes;
	private final List<HoleInfo> holes;
	private final Set<Axiom> axiomUsage;

	public TypeCheckResult(List<Diagnostic> diagnostics, Map<String, Term> inferredTypes, List<HoleInfo> holes,
						   Set<Axiom> axiomUsage) {
		this.valid = diagnostics.stream().noneMatch(d -> d.getSeverity() == Severity.ERROR);
		this.diagnostics = Collections.unmodifiableList(diagnostics);
		this.inferredTypes = Collections.unmodifiableMap(inferredTypes);
		this.holes = Collections.unmodifiableList(holes);
		this.axiomUsage = Collections.unmodifiableSet(axiomUsage);
	}

	/**
	 * @return false exactly when some diagnostic has severity {@link Severity#ERROR}
	 */
	public boolean isValid() {
		return valid;
	}

	public List<Diagnostic> getDiagnostics() {
		return diagnostics;
	}

	/**
	 * @return for each declaration that could be typed, the inferred type of a
	 * definition's body or the statement of a theorem or lemma
	 */
	public Map<String, Term> getInferredTypes() {
		return inferredTypes;
	}

	public List<HoleInfo> getHoles() {
		return holes;
	}

	public Set<Axiom> getAxiomUsage() {
		return axiomUsage;
	}

	public void format(IndentingWriter out) throws IOException {
		out.write(valid ? "valid" : "invalid");
		out.write(" (");
		out.write(Integer.toString(diagnostics.size()));
		out.write(" diagnostic(s), ");
		out.write(Integer.toString(holes.size()));
		out.write(" hole(s))");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (Diagnostic diagnostic : diagnostics) {
				out.newLine();
				out.write(diagnostic.toString());
				if (diagnostic.getTerm().isPresent()) {
					out.write(": ");
					out.write(diagnostic.getTerm().get().toString());
				}
			}
			for (HoleInfo hole : holes) {
				out.newLine();
				out.write("?");
				out.write(hole.getId());
				try (IndentingWriter.Indent ignored2 = out.indent()) {
					for (String suggestion : hole.getSuggestions()) {
						out.newLine();
						out.write(suggestion);
					}
				}
			}
			if (!axiomUsage.isEmpty()) {
				out.newLine();
				out.write("axioms used: ");
				boolean first = true;
				for (Axiom axiom : axiomUsage) {
					if (!first) {
						out.write(", ");
					}
					first = false;
					out.write(axiom.name());
				}
			}
		}
	}

	public String format() {
		StringWriter w = new StringWriter();
		try {
			format(new IndentingWriter(w));
		} catch (IOException e) {
			throw new Unreachable("IO error from a StringWriter", e);
		}
		return w.toString();
	}
}
