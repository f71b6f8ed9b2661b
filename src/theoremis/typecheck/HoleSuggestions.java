package theoremis.typecheck;

import theoremis.kernel.TypingContext;
import theoremis.model.term.Hole;

import java.util.ArrayList;
import java.util.List;

public class HoleSuggestions {

	private static final String[] FALLBACK = {
			"Try: induction on parameter",
			"Try: cases analysis",
			"Try: simp [relevant_lemma]",
			"Try: omega (linear arithmetic)",
			"Try: ring (ring equations)",
	};

	private HoleSuggestions() {}

	public static List<String> suggest(TypingContext ctx, Hole hole) {
		List<String> suggestions = new ArrayList<>();
		ctx.getMostRecentlyBound().ifPresent(name -> suggestions.add("Try: apply " + name));
		for (String fallback : FALLBACK) {
			suggestions.add(fallback);
		}
		hole.getAnnotation().ifPresent(annotation -> suggestions.add("Hole annotation: " + annotation));
		return suggestions;
	}
}
