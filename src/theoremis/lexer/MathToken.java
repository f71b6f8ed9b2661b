package theoremis.lexer;

import java.util.Objects;

/**
 * A token together with the 0-based character offset at which it starts.
 */
public class MathToken {
	private final MathTokenType type;
	private final String value;
	private final int position;

	public MathToken(MathTokenType type, String value, int position) {
		this.type = type;
		this.value = value;
		this.position = position;
	}

	public MathTokenType getType() {
		return type;
	}

	public String getValue() {
		return value;
	}

	public int getPosition() {
		return position;
	}

	public boolean is(MathTokenType type, String value) {
		return this.type == type && this.value.equals(value);
	}

	@Override
	public String toString() {
		return type + "('" + value + "')@" + position;
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, value, position);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof MathToken)) {
			return false;
		}
		MathToken other = (MathToken) obj;
		return type == other.type && value.equals(other.value) && position == other.position;
	}
}
