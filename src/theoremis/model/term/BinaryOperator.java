package theoremis.model.term;

import java.util.Optional;

public enum BinaryOperator {
	ADD("+", false),
	SUB("-", false),
	MUL("*", false),
	DIV("/", false),
	POW("^", false),
	EQ("=", true),
	LT("<", true),
	GT(">", true),
	LEQ("≤", true),
	GEQ("≥", true),
	AND("∧", true),
	OR("∨", true),
	IMPLIES("→", true),
	IFF("↔", true),
	MOD("mod", false),
	IN("∈", true),
	NOT_IN("∉", true),
	SUBSET("⊆", true),
	UNION("∪", false),
	INTERSECTION("∩", false);

	private final String symbol;
	private final boolean propositional;

	BinaryOperator(String symbol, boolean propositional) {
		this.symbol = symbol;
		this.propositional = propositional;
	}

	public String getSymbol() {
		return symbol;
	}

	/**
	 * @return whether applying this operator always yields a proposition
	 */
	public boolean isPropositional() {
		return propositional;
	}

	public static Optional<BinaryOperator> fromSymbol(String symbol) {
		for (BinaryOperator op : values()) {
			if (op.symbol.equals(symbol)) {
				return Optional.of(op);
			}
		}
		return Optional.empty();
	}
}
