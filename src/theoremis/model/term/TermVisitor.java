package theoremis.model.term;

public abstract class TermVisitor<T, E extends Throwable> {
	public abstract T visit(Var var) throws E;
	public abstract T visit(Lam lam) throws E;
	public abstract T visit(App app) throws E;
	public abstract T visit(Pi pi) throws E;
	public abstract T visit(Sigma sigma) throws E;
	public abstract T visit(Pair pair) throws E;
	public abstract T visit(Proj proj) throws E;
	public abstract T visit(LetIn letIn) throws E;
	public abstract T visit(Sort sort) throws E;
	public abstract T visit(Ind ind) throws E;
	public abstract T visit(Match match) throws E;
	public abstract T visit(Hole hole) throws E;
	public abstract T visit(AxiomRef axiomRef) throws E;
	public abstract T visit(Literal literal) throws E;
	public abstract T visit(BinOp binOp) throws E;
	public abstract T visit(UnaryOp unaryOp) throws E;
	public abstract T visit(Equiv equiv) throws E;
	public abstract T visit(ForAll forAll) throws E;
	public abstract T visit(Exists exists) throws E;
}
