package theoremis.kernel;

import theoremis.model.term.AxiomBundle;
import theoremis.model.term.Term;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps names to their types under an active axiom bundle.
 *
 * A context is never modified: {@link #extend(String, Term)} returns a new context
 * that links back to this one, so an enclosing binder keeps seeing exactly the
 * names that were in scope when it was entered.
 */
public final class TypingContext {
	private final TypingContext parent;
	private final String name;
	private final Term type;
	private final AxiomBundle axiomBundle;

	private TypingContext(TypingContext parent, String name, Term type, AxiomBundle axiomBundle) {
		this.parent = parent;
		this.name = name;
		this.type = type;
		this.axiomBundle = axiomBundle;
	}

	public static TypingContext empty(AxiomBundle axiomBundle) {
		return new TypingContext(null, null, null, axiomBundle);
	}

	public TypingContext extend(String name, Term type) {
		return new TypingContext(this, name, type, axiomBundle);
	}

	public Optional<Term> lookup(String name) {
		for (TypingContext ctx = this; ctx.parent != null; ctx = ctx.parent) {
			if (ctx.name.equals(name)) {
				return Optional.of(ctx.type);
			}
		}
		return Optional.empty();
	}

	public Optional<String> getMostRecentlyBound() {
		return Optional.ofNullable(name);
	}

	public AxiomBundle getAxiomBundle() {
		return axiomBundle;
	}

	/**
	 * @return the visible bindings, ordered from least to most recently bound
	 */
	public Map<String, Term> getBindings() {
		Deque<TypingContext> chain = new ArrayDeque<>();
		for (TypingContext ctx = this; ctx.parent != null; ctx = ctx.parent) {
			chain.push(ctx);
		}
		Map<String, Term> bindings = new LinkedHashMap<>();
		for (TypingContext ctx : chain) {
			// a rebinding shadows and moves to the end
			bindings.remove(ctx.name);
			bindings.put(ctx.name, ctx.type);
		}
		return Collections.unmodifiableMap(bindings);
	}
}
