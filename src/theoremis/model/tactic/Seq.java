package theoremis.model.tactic;

import java.util.Collections;
import java.util.List;

/**
 * Combinator that runs tactics in order.
 */
public class Seq extends Tactic {
	private final List<Tactic> tactics;

	public Seq(List<Tactic> tactics) {
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
		if (!(obj instanceof Seq)) {
			return false;
		}
		return tactics.equals(((Seq) obj).tactics);
	}
}
