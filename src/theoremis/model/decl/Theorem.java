package theoremis.model.decl;

import theoremis.model.tactic.Tactic;
import theoremis.model.term.AxiomBundle;
import theoremis.model.term.Term;

import java.util.List;
import java.util.Optional;

public class Theorem extends ProofDeclaration {
	private final AxiomBundle axiomBundle;
	private final TheoremMeta meta;

	public Theorem(String name, List<Param> params, Term statement, List<Tactic> proof, AxiomBundle axiomBundle,
	               TheoremMeta meta) {
		super(name, params, statement, proof);
		this.axiomBundle = axiomBundle;
		this.meta = meta;
	}

	/**
	 * @return the bundle the proof is allowed to use, if the theorem declares one
	 */
	public Optional<AxiomBundle> getAxiomBundle() {
		return Optional.ofNullable(axiomBundle);
	}

	public TheoremMeta getMeta() {
		return meta;
	}

	@Override
	public String getKind() {
		return "Theorem";
	}

	@Override
	public <T, E extends Throwable> T accept(DeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
