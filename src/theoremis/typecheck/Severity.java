package theoremis.typecheck;

/**
 * Only {@link #ERROR} makes a {@link TypeCheckResult} invalid; the other
 * severities are advisory.
 */
public enum Severity {
	ERROR,
	WARNING,
	INFO,
	HINT;

	@Override
	public String toString() {
		return name().toLowerCase();
	}
}
