package theoremis;

/**
 * Base of the unchecked exceptions raised by the kernel and the command line
 * front end, consisting of a prefix (kind of error) and a message.
 */
public abstract class TheoremisException extends RuntimeException {
	private final String msg;
	private final String prefix;

	public TheoremisException(String prefix, String msg) {
		super(prefix + ": " + msg);
		this.prefix = prefix;
		this.msg = msg;
	}

	public String getMsg() {
		return msg;
	}

	public String getPrefix() {
		return prefix;
	}
}
