package theoremis.kernel;

import java.util.Set;

/**
 * Generates binder names for capture-avoiding renaming: x becomes x′, then x′1, x′2, ...
 * on collision. The counter belongs to one substitution and is threaded through
 * all of its recursive calls, so results are deterministic.
 */
public class FreshNameGenerator {
	public static final String PRIME = "′";

	private int counter = 0;

	public String fresh(String base, Set<String> avoid) {
		String candidate = base + PRIME;
		while (avoid.contains(candidate)) {
			counter++;
			candidate = base + PRIME + counter;
		}
		return candidate;
	}
}
