package theoremis.model.tactic;

import java.util.Collections;
import java.util.List;

/**
 * simp [lemma, ...]
 */
public class Simp extends Tactic {
	private final List<String> lemmas;

	public Simp(List<String> lemmas) {
		this.lemmas = Collections.unmodifiableList(lemmas);
	}

	public List<String> getLemmas() {
		return lemmas;
	}

	@Override
	public <T, E extends Throwable> T accept(TacticVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return lemmas.hashCode() * 17 + 6;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Simp)) {
			return false;
		}
		return lemmas.equals(((Simp) obj).lemmas);
	}
}
