package theoremis.model.term;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A named, immutable set of axioms attached to a module or a theorem. Tracks which
 * non-constructive principles a development is allowed to rely on.
 */
public final class AxiomBundle {
	public static final AxiomBundle CLASSICAL_MATH = new AxiomBundle(
			"ClassicalMath",
			EnumSet.of(Axiom.LEM, Axiom.Choice, Axiom.Funext, Axiom.Propext),
			"Standard classical mathematics with full choice");
	public static final AxiomBundle CONSTRUCTIVE_HOTT = new AxiomBundle(
			"ConstructiveHoTT",
			EnumSet.of(Axiom.Univalence, Axiom.Funext, Axiom.Quotient),
			"Homotopy Type Theory (constructive)");
	public static final AxiomBundle LEAN4_DEFAULT = new AxiomBundle(
			"Lean4Default",
			EnumSet.of(Axiom.Quotient, Axiom.Propext, Axiom.Choice),
			"Lean 4 native axiom set");
	public static final AxiomBundle MINIMAL_CORE = new AxiomBundle(
			"MinimalCore",
			EnumSet.noneOf(Axiom.class),
			"Pure intuitionistic type theory, no axioms");

	private static final Map<String, AxiomBundle> STANDARD;

	static {
		Map<String, AxiomBundle> bundles = new LinkedHashMap<>();
		for (AxiomBundle bundle : new AxiomBundle[]{CLASSICAL_MATH, CONSTRUCTIVE_HOTT, LEAN4_DEFAULT, MINIMAL_CORE}) {
			bundles.put(bundle.getName(), bundle);
		}
		STANDARD = Collections.unmodifiableMap(bundles);
	}

	private final String name;
	private final Set<Axiom> axioms;
	private final String description;

	public AxiomBundle(String name, Set<Axiom> axioms, String description) {
		this.name = name;
		this.axioms = axioms.isEmpty()
				? Collections.unmodifiableSet(EnumSet.noneOf(Axiom.class))
				: Collections.unmodifiableSet(EnumSet.copyOf(axioms));
		this.description = description;
	}

	public static Optional<AxiomBundle> standard(String name) {
		return Optional.ofNullable(STANDARD.get(name));
	}

	public static Map<String, AxiomBundle> standardBundles() {
		return STANDARD;
	}

	public String getName() {
		return name;
	}

	public Set<Axiom> getAxioms() {
		return axioms;
	}

	public String getDescription() {
		return description;
	}

	public boolean contains(Axiom axiom) {
		return axioms.contains(axiom);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, axioms, description);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof AxiomBundle)) {
			return false;
		}
		AxiomBundle other = (AxiomBundle) obj;
		return name.equals(other.name) && axioms.equals(other.axioms) && description.equals(other.description);
	}

	@Override
	public String toString() {
		return "AxiomBundle [name=" + name + ", axioms=" + axioms + "]";
	}
}
