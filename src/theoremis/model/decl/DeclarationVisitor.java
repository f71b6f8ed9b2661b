package theoremis.model.decl;

public abstract class DeclarationVisitor<T, E extends Throwable> {
	public abstract T visit(Definition definition) throws E;
	public abstract T visit(Theorem theorem) throws E;
	public abstract T visit(Lemma lemma) throws E;
}
