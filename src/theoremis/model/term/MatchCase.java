package theoremis.model.term;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One arm of a {@link Match}: a pattern tag, the names it binds, and a body in
 * which those names are bound.
 */
public class MatchCase {
	private final String pattern;
	private final List<String> bindings;
	private final Term body;

	public MatchCase(String pattern, List<String> bindings, Term body) {
		this.pattern = pattern;
		this.bindings = Collections.unmodifiableList(bindings);
		this.body = body;
	}

	public String getPattern() {
		return pattern;
	}

	public List<String> getBindings() {
		return bindings;
	}

	public Term getBody() {
		return body;
	}

	@Override
	public int hashCode() {
		return Objects.hash(pattern, bindings, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof MatchCase)) {
			return false;
		}
		MatchCase other = (MatchCase) obj;
		return pattern.equals(other.pattern) && bindings.equals(other.bindings) && body.equals(other.body);
	}
}
