package theoremis.model.term;

public enum LiteralKind {
	Nat,
	Int,
	Bool,
	String,
}
