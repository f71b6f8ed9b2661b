package theoremis.typecheck;

import theoremis.model.term.Term;

import java.util.Objects;
import java.util.Optional;

public class Diagnostic {
	private final Severity severity;
	private final String message;
	private final String location;
	private final Term term;

	public Diagnostic(Severity severity, String message, String location, Term term) {
		this.severity = severity;
		this.message = message;
		this.location = location;
		this.term = term;
	}

	public static Diagnostic error(String message, Term term) {
		return new Diagnostic(Severity.ERROR, message, null, term);
	}

	public static Diagnostic warning(String message, Term term) {
		return new Diagnostic(Severity.WARNING, message, null, term);
	}

	public static Diagnostic hint(String message, Term term) {
		return new Diagnostic(Severity.HINT, message, null, term);
	}

	public Severity getSeverity() {
		return severity;
	}

	public String getMessage() {
		return message;
	}

	/**
	 * @return the name of the declaration the diagnostic concerns, when known
	 */
	public Optional<String> getLocation() {
		return Optional.ofNullable(location);
	}

	public Optional<Term> getTerm() {
		return Optional.ofNullable(term);
	}

	@Override
	public String toString() {
		return "[" + severity + "] " + message;
	}

	@Override
	public int hashCode() {
		return Objects.hash(severity, message, location, term);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Diagnostic)) {
			return false;
		}
		Diagnostic other = (Diagnostic) obj;
		return severity == other.severity && message.equals(other.message)
				&& Objects.equals(location, other.location) && Objects.equals(term, other.term);
	}
}
