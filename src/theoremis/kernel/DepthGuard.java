package theoremis.kernel;

/**
 * Counts the recursion depth of a single kernel operation. Not shared between
 * operations: every call into {@link Kernel} creates its own guard.
 */
public class DepthGuard {
	private final String operation;
	private final int limit;
	private int depth = 0;

	public DepthGuard(String operation, int limit) {
		this.operation = operation;
		this.limit = limit;
	}

	public void enter() {
		if (depth >= limit) {
			throw new TermTooDeepException(operation, limit);
		}
		depth++;
	}

	public void exit() {
		depth--;
	}

	public int getDepth() {
		return depth;
	}

	public int getLimit() {
		return limit;
	}
}
