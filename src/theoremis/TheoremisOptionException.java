package theoremis;

public class TheoremisOptionException extends TheoremisException {
	private static final String prefix = "Option Error";

	public TheoremisOptionException(String msg) {
		super(prefix, msg);
	}
}
