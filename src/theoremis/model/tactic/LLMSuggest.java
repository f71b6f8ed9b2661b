package theoremis.model.tactic;

/**
 * A proof step proposed by an external assistant, kept as free text.
 */
public class LLMSuggest extends Tactic {
	private final String context;

	public LLMSuggest(String context) {
		this.context = context;
	}

	public String getContext() {
		return context;
	}

	@Override
	public <T, E extends Throwable> T accept(TacticVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return context.hashCode() * 17 + 9;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof LLMSuggest)) {
			return false;
		}
		return context.equals(((LLMSuggest) obj).context);
	}
}
