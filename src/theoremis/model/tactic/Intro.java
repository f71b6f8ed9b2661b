package theoremis.model.tactic;

import java.util.Collections;
import java.util.List;

public class Intro extends Tactic {
	private final List<String> names;

	public Intro(List<String> names) {
		this.names = Collections.unmodifiableList(names);
	}

	public List<String> getNames() {
		return names;
	}

	@Override
	public <T, E extends Throwable> T accept(TacticVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return names.hashCode() * 17 + 1;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Intro)) {
			return false;
		}
		return names.equals(((Intro) obj).names);
	}
}
