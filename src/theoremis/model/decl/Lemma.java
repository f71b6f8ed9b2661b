package theoremis.model.decl;

import theoremis.model.tactic.Tactic;
import theoremis.model.term.Term;

import java.util.List;

public class Lemma extends ProofDeclaration {

	public Lemma(String name, List<Param> params, Term statement, List<Tactic> proof) {
		super(name, params, statement, proof);
	}

	@Override
	public String getKind() {
		return "Lemma";
	}

	@Override
	public <T, E extends Throwable> T accept(DeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
