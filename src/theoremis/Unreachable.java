package theoremis;

/**
 * Thrown from a branch the surrounding code rules out, such as an
 * {@link java.io.IOException} from a {@link java.io.StringWriter} or an
 * enum constant a switch already covers.
 */
public class Unreachable extends IllegalStateException {
	public Unreachable(String reason) {
		super("unreachable: " + reason);
	}

	public Unreachable(String reason, Throwable cause) {
		super("unreachable: " + reason, cause);
	}
}
