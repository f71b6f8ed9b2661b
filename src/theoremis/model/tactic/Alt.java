package theoremis.model.tactic;

import java.util.Collections;
import java.util.List;

/**
 * Combinator that tries tactics until one succeeds.
 */
public class Alt extends Tactic {
	private final List<Tactic> tactics;

	public Alt(List<Tactic> tactics) {
		this.tactics = Collections.unmodifiableList(tactics);
	}

	public List<Tactic> getTactics() {
		return tactics;
	}

	@Override
	public <T, E extends Throwable> T accept(TacticVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return tactics.hashCode() * 17 + 3;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Alt)) {
			return false;
		}
		return tactics.equals(((Alt) obj).tactics);
	}
}
