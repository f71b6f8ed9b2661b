package theoremis.model.term;

/**
 * AST:
 *
 * axiom[name]
 */
public class AxiomRef extends Term {
	private final Axiom axiom;

	public AxiomRef(Axiom axiom) {
		this.axiom = axiom;
	}

	public Axiom getAxiom() {
		return axiom;
	}

	@Override
	public <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return axiom.hashCode() * 17 + 11;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof AxiomRef)) {
			return false;
		}
		return axiom == ((AxiomRef) obj).axiom;
	}
}
