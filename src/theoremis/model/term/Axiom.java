package theoremis.model.term;

import java.util.Optional;

public enum Axiom {
	// law of excluded middle
	LEM,
	Choice,
	// HoTT univalence
	Univalence,
	// function extensionality
	Funext,
	// propositional extensionality
	Propext,
	Quotient,
	ClassicalLogic;

	public static Optional<Axiom> fromName(String name) {
		for (Axiom axiom : values()) {
			if (axiom.name().equals(name)) {
				return Optional.of(axiom);
			}
		}
		return Optional.empty();
	}
}
