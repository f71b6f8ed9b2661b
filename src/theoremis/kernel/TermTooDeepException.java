package theoremis.kernel;

import theoremis.TheoremisException;

/**
 * Raised when a kernel operation nests deeper than its configured limit, instead
 * of letting the call stack overflow on adversarially deep terms.
 */
public class TermTooDeepException extends TheoremisException {
	private static final String prefix = "Kernel Error";

	private final int limit;

	public TermTooDeepException(String operation, int limit) {
		super(prefix, operation + " exceeded the maximum term depth of " + limit);
		this.limit = limit;
	}

	public int getLimit() {
		return limit;
	}
}
