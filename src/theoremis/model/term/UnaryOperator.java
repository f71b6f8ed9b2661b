package theoremis.model.term;

import java.util.Optional;

public enum UnaryOperator {
	NOT("¬"),
	NEG("-");

	private final String symbol;

	UnaryOperator(String symbol) {
		this.symbol = symbol;
	}

	public String getSymbol() {
		return symbol;
	}

	public static Optional<UnaryOperator> fromSymbol(String symbol) {
		for (UnaryOperator op : values()) {
			if (op.symbol.equals(symbol)) {
				return Optional.of(op);
			}
		}
		return Optional.empty();
	}
}
