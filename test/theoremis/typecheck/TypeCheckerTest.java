package theoremis.typecheck;

import org.junit.Test;
import theoremis.kernel.Kernel;
import theoremis.model.decl.*;
import theoremis.model.tactic.*;
import theoremis.model.term.Axiom;
import theoremis.model.term.AxiomBundle;
import theoremis.model.term.BinaryOperator;
import theoremis.model.term.Term;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;
import static theoremis.model.term.StandardTypes.*;
import static theoremis.model.term.TermBuilder.*;

public class TypeCheckerTest {

	private static IRModule module(Declaration... declarations) {
		return new IRModule("Test", Arrays.asList(declarations), AxiomBundle.CLASSICAL_MATH, Collections.emptyList());
	}

	private static Theorem theorem(String name, Term statement, Tactic... proof) {
		return new Theorem(name, Collections.emptyList(), statement, Arrays.asList(proof), null, TheoremMeta.empty());
	}

	private static List<String> messages(TypeCheckResult result, Severity severity) {
		return result.getDiagnostics().stream()
				.filter(d -> d.getSeverity() == severity)
				.map(Diagnostic::getMessage)
				.collect(Collectors.toList());
	}

	private static final Term NON_NEGATIVE = forAll("n", NAT, binOp(BinaryOperator.GEQ, var("n"), nat(0)));

	@Test
	public void sorryIsAnOpenObligation() {
		TypeCheckResult result = new TypeChecker().typeCheck(module(theorem("t", NON_NEGATIVE, new Sorry())));
		assertTrue(result.isValid());
		assertThat(messages(result, Severity.INFO), hasItem("Theorem 't' statement is well-formed (propositional)"));
		assertThat(messages(result, Severity.WARNING),
				hasItem("Theorem 't' contains unresolved proof obligations (sorry)"));
		assertThat(result.getInferredTypes().get("t"), is(NON_NEGATIVE));
	}

	@Test
	public void sorryInsideCombinatorsIsFound() {
		Tactic proof = new Seq(Arrays.asList(new Intro(Collections.singletonList("n")),
				new Alt(Arrays.asList(new Omega(), new Sorry()))));
		TypeCheckResult result = new TypeChecker().typeCheck(module(theorem("t", NON_NEGATIVE, proof)));
		assertThat(messages(result, Severity.WARNING),
				hasItem("Theorem 't' contains unresolved proof obligations (sorry)"));
	}

	@Test
	public void completeProofIsReported() {
		TypeCheckResult result = new TypeChecker().typeCheck(module(
				theorem("t", NON_NEGATIVE, new Intro(Collections.singletonList("n")), new Omega())));
		assertThat(messages(result, Severity.INFO), hasItem("Theorem 't' proof script provided (2 tactics)"));
		assertTrue(messages(result, Severity.WARNING).isEmpty());
	}

	@Test
	public void emptyProofWarns() {
		Lemma lemma = new Lemma("l", Collections.emptyList(), NON_NEGATIVE, Collections.emptyList());
		TypeCheckResult result = new TypeChecker().typeCheck(module(lemma));
		assertThat(messages(result, Severity.WARNING), hasItem("Lemma 'l' has no proof"));
		assertTrue(result.isValid());
	}

	@Test
	public void illFormedStatementIsAnError() {
		TypeCheckResult result = new TypeChecker().typeCheck(module(theorem("t", var("Undefined"), new Sorry())));
		assertFalse(result.isValid());
		assertThat(messages(result, Severity.ERROR), hasItem("Unbound variable 'Undefined'"));
		assertThat(messages(result, Severity.ERROR), hasItem("Theorem 't': statement is not well-formed"));
	}

	@Test
	public void definitionChecks() {
		Definition twice = new Definition("twice",
				Collections.singletonList(new Param("n", NAT)),
				NAT,
				binOp(BinaryOperator.ADD, var("n"), var("n")));
		TypeCheckResult result = new TypeChecker().typeCheck(module(twice));
		assertTrue(result.isValid());
		assertThat(messages(result, Severity.INFO), hasItem("Definition 'twice' type-checks successfully"));
		assertTrue(messages(result, Severity.WARNING).isEmpty());
		assertThat(result.getInferredTypes().get("twice"), is((Term) NAT));
	}

	@Test
	public void definitionReturnTypeMismatchWarns() {
		Definition d = new Definition("d", Collections.emptyList(), BOOL, nat(1));
		TypeCheckResult result = new TypeChecker().typeCheck(module(d));
		assertTrue(result.isValid());
		assertThat(messages(result, Severity.WARNING),
				hasItem("Definition 'd': declared return type may not match inferred type"));
	}

	@Test
	public void definitionReturningSortSkipsComparison() {
		Definition d = new Definition("Pos", Collections.emptyList(), TYPE0, arrow(NAT, PROP));
		TypeCheckResult result = new TypeChecker().typeCheck(module(d));
		assertTrue(messages(result, Severity.WARNING).isEmpty());
	}

	@Test
	public void badParameterTypeIsAnError() {
		Lemma lemma = new Lemma("l", Collections.singletonList(new Param("x", var("Foo"))),
				binOp(BinaryOperator.EQ, var("x"), var("x")), Collections.singletonList(new Sorry()));
		TypeCheckResult result = new TypeChecker().typeCheck(module(lemma));
		assertFalse(result.isValid());
		assertThat(messages(result, Severity.ERROR), hasItem("Parameter 'x': type is not well-formed"));
	}

	@Test
	public void laterDeclarationsSeeEarlierOnes() {
		Definition two = new Definition("two", Collections.emptyList(), NAT, nat(2));
		Theorem t = theorem("two_eq", binOp(BinaryOperator.EQ, var("two"), nat(2)), new Ring());
		TypeCheckResult result = new TypeChecker().typeCheck(module(two, t));
		assertTrue(result.isValid());
		assertTrue(messages(result, Severity.ERROR).isEmpty());
	}

	@Test
	public void theoremBundleRestrictsAxioms() {
		Theorem t = new Theorem("em", Collections.emptyList(), axiomRef(Axiom.LEM),
				Collections.singletonList(new Exact(axiomRef(Axiom.LEM))), AxiomBundle.MINIMAL_CORE,
				TheoremMeta.empty());
		TypeCheckResult result = new TypeChecker().typeCheck(module(t));
		assertTrue(result.isValid());
		assertThat(messages(result, Severity.WARNING),
				hasItem("Theorem 'em' uses axiom 'LEM' not in bundle 'MinimalCore'"));
		assertEquals(EnumSet.of(Axiom.LEM), result.getAxiomUsage());
	}

	@Test
	public void axiomUsageIsTrackedPerDeclaration() {
		Theorem uses = theorem("uses", axiomRef(Axiom.Choice), new Sorry());
		Theorem strict = new Theorem("strict", Collections.emptyList(), NON_NEGATIVE,
				Collections.singletonList(new Omega()), AxiomBundle.MINIMAL_CORE, TheoremMeta.empty());
		TypeCheckResult result = new TypeChecker().typeCheck(module(uses, strict));
		// Choice is used by another declaration, not by 'strict'
		assertThat(messages(result, Severity.WARNING), not(hasItem(containsString("'strict' uses axiom"))));
		assertEquals(EnumSet.of(Axiom.Choice), result.getAxiomUsage());
	}

	@Test
	public void moduleBundleAppliesToAxiomReferences() {
		IRModule m = new IRModule("M", Collections.singletonList(theorem("t", axiomRef(Axiom.Univalence), new Sorry())),
				AxiomBundle.CLASSICAL_MATH, Collections.emptyList());
		TypeCheckResult result = new TypeChecker().typeCheck(m);
		assertThat(messages(result, Severity.WARNING),
				hasItem("Axiom 'Univalence' used but not in current bundle 'ClassicalMath'"));
	}

	@Test
	public void holesAreCollected() {
		TypeCheckResult result = new TypeChecker().typeCheck(module(theorem("t", hole("stmt"), new Sorry())));
		assertEquals(1, result.getHoles().size());
		assertEquals("stmt", result.getHoles().get(0).getId());
		assertFalse(result.isValid());
	}

	@Test
	public void deepDeclarationBecomesAnError() {
		Term deep = nat(0);
		for (int i = 0; i < 200; i++) {
			deep = binOp(BinaryOperator.ADD, deep, nat(1));
		}
		Theorem t = theorem("deep", binOp(BinaryOperator.EQ, deep, nat(200)), new Ring());
		TypeCheckResult result = new TypeChecker(new Kernel(50)).typeCheck(module(t));
		assertFalse(result.isValid());
		assertThat(messages(result, Severity.ERROR).get(0), startsWith("'deep': "));
	}

	@Test
	public void formattedResultSummarisesDiagnostics() {
		TypeCheckResult result = new TypeChecker().typeCheck(module(theorem("t", NON_NEGATIVE, new Sorry())));
		String text = result.format();
		assertThat(text, startsWith("valid (2 diagnostic(s), 0 hole(s))"));
		assertThat(text, containsString("[warning] Theorem 't' contains unresolved proof obligations (sorry)"));
	}
}
