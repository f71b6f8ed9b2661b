package theoremis.model.tactic;

public abstract class TacticVisitor<T, E extends Throwable> {
	public abstract T visit(Intro intro) throws E;
	public abstract T visit(Apply apply) throws E;
	public abstract T visit(Rewrite rewrite) throws E;
	public abstract T visit(Induction induction) throws E;
	public abstract T visit(Cases cases) throws E;
	public abstract T visit(Simp simp) throws E;
	public abstract T visit(Omega omega) throws E;
	public abstract T visit(Sorry sorry) throws E;
	public abstract T visit(Auto auto) throws E;
	public abstract T visit(Seq seq) throws E;
	public abstract T visit(Alt alt) throws E;
	public abstract T visit(Exact exact) throws E;
	public abstract T visit(Ring ring) throws E;
	public abstract T visit(LLMSuggest llmSuggest) throws E;
}
