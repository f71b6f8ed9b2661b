package theoremis.model.decl;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Provenance of a theorem extracted from a document.
 */
public class TheoremMeta {
	private final String source;
	private final Integer lineNumber;
	private final double confidence;
	private final List<String> dependencies;

	public TheoremMeta(String source, Integer lineNumber, double confidence, List<String> dependencies) {
		this.source = source;
		this.lineNumber = lineNumber;
		this.confidence = confidence;
		this.dependencies = Collections.unmodifiableList(dependencies);
	}

	public static TheoremMeta empty() {
		return new TheoremMeta(null, null, 1.0, Collections.emptyList());
	}

	public Optional<String> getSource() {
		return Optional.ofNullable(source);
	}

	public Optional<Integer> getLineNumber() {
		return Optional.ofNullable(lineNumber);
	}

	public double getConfidence() {
		return confidence;
	}

	public List<String> getDependencies() {
		return dependencies;
	}
}
