package theoremis.typecheck;

import theoremis.model.tactic.*;

import java.util.List;

/**
 * Whether a tactic is, or contains within a sequence or alternative, the
 * placeholder {@link Sorry}.
 */
public class PlaceholderTacticVisitor extends TacticVisitor<Boolean, RuntimeException> {

	private boolean any(List<Tactic> tactics) {
		return tactics.stream().anyMatch(t -> t.accept(this));
	}

	@Override
	public Boolean visit(Intro intro) throws RuntimeException {
		return false;
	}

	@Override
	public Boolean visit(Apply apply) throws RuntimeException {
		return false;
	}

	@Override
	public Boolean visit(Rewrite rewrite) throws RuntimeException {
		return false;
	}

	@Override
	public Boolean visit(Induction induction) throws RuntimeException {
		return false;
	}

	@Override
	public Boolean visit(Cases cases) throws RuntimeException {
		return false;
	}

	@Override
	public Boolean visit(Simp simp) throws RuntimeException {
		return false;
	}

	@Override
	public Boolean visit(Omega omega) throws RuntimeException {
		return false;
	}

	@Override
	public Boolean visit(Sorry sorry) throws RuntimeException {
		return true;
	}

	@Override
	public Boolean visit(Auto auto) throws RuntimeException {
		return false;
	}

	@Override
	public Boolean visit(Seq seq) throws RuntimeException {
		return any(seq.getTactics());
	}

	@Override
	public Boolean visit(Alt alt) throws RuntimeException {
		return any(alt.getTactics());
	}

	@Override
	public Boolean visit(Exact exact) throws RuntimeException {
		return false;
	}

	@Override
	public Boolean visit(Ring ring) throws RuntimeException {
		return false;
	}

	@Override
	public Boolean visit(LLMSuggest llmSuggest) throws RuntimeException {
		return false;
	}
}
