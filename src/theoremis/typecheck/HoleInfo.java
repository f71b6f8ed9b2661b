package theoremis.typecheck;

import theoremis.model.term.Term;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * What the checker knows at a hole: the names in scope there and some tactics
 * worth trying.
 */
public class HoleInfo {
	private final String id;
	private final Term expectedType;
	private final Map<String, Term> context;
	private final List<String> suggestions;

	public HoleInfo(String id, Term expectedType, Map<String, Term> context, List<String> suggestions) {
		this.id = id;
		this.expectedType = expectedType;
		this.context = Collections.unmodifiableMap(context);
		this.suggestions = Collections.unmodifiableList(suggestions);
	}

	public String getId() {
		return id;
	}

	public Optional<Term> getExpectedType() {
		return Optional.ofNullable(expectedType);
	}

	public Map<String, Term> getContext() {
		return context;
	}

	public List<String> getSuggestions() {
		return suggestions;
	}
}
