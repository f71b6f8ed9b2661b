package theoremis.typecheck;

import theoremis.model.term.Axiom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Collects what type inference finds besides types: diagnostics, holes and
 * the axioms referenced.
 */
public class InferenceRecorder {
	private final List<Diagnostic> diagnostics = new ArrayList<>();
	private final List<HoleInfo> holes = new ArrayList<>();
	private final Set<Axiom> axiomUsage = EnumSet.noneOf(Axiom.class);

	public void report(Diagnostic diagnostic) {
		diagnostics.add(diagnostic);
	}

	public void hole(HoleInfo hole) {
		holes.add(hole);
	}

	public void useAxiom(Axiom axiom) {
		axiomUsage.add(axiom);
	}

	public void addAll(InferenceRecorder other) {
		diagnostics.addAll(other.diagnostics);
		holes.addAll(other.holes);
		axiomUsage.addAll(other.axiomUsage);
	}

	public List<Diagnostic> getDiagnostics() {
		return Collections.unmodifiableList(diagnostics);
	}

	public List<HoleInfo> getHoles() {
		return Collections.unmodifiableList(holes);
	}

	public Set<Axiom> getAxiomUsage() {
		return Collections.unmodifiableSet(axiomUsage);
	}

	public boolean hasErrors() {
		return diagnostics.stream().anyMatch(d -> d.getSeverity() == Severity.ERROR);
	}
}
