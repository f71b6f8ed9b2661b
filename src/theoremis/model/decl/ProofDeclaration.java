package theoremis.model.decl;

import theoremis.model.tactic.Tactic;
import theoremis.model.term.Term;

import java.util.Collections;
import java.util.List;

/**
 * A declaration stating a proposition together with a (possibly incomplete)
 * proof script.
 */
public abstract class ProofDeclaration extends Declaration {
	private final Term statement;
	private final List<Tactic> proof;

	protected ProofDeclaration(String name, List<Param> params, Term statement, List<Tactic> proof) {
		super(name, params);
		this.statement = statement;
		this.proof = Collections.unmodifiableList(proof);
	}

	public Term getStatement() {
		return statement;
	}

	public List<Tactic> getProof() {
		return proof;
	}

	/**
	 * @return "Theorem" or "Lemma", as used in diagnostics
	 */
	public abstract String getKind();
}
