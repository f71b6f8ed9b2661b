package theoremis.typecheck;

import org.junit.Before;
import org.junit.Test;
import theoremis.kernel.Kernel;
import theoremis.kernel.TypingContext;
import theoremis.model.term.Axiom;
import theoremis.model.term.AxiomBundle;
import theoremis.model.term.BinaryOperator;
import theoremis.model.term.Term;
import theoremis.model.term.TermBuilder;

import java.util.EnumSet;
import java.util.Optional;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;
import static theoremis.model.term.StandardTypes.*;
import static theoremis.model.term.TermBuilder.*;

public class TypeInferenceTest {
	private TypeChecker checker;
	private TypingContext ctx;
	private InferenceRecorder recorder;

	@Before
	public void setup() {
		checker = new TypeChecker();
		ctx = StandardContext.create(AxiomBundle.CLASSICAL_MATH);
		recorder = new InferenceRecorder();
	}

	private Optional<Term> infer(Term term) {
		return checker.inferType(ctx, term, recorder);
	}

	@Test
	public void literals() {
		assertThat(infer(nat(3)), is(Optional.<Term>of(NAT)));
		assertThat(infer(integer(-3)), is(Optional.<Term>of(INT)));
		assertThat(infer(bool(true)), is(Optional.<Term>of(BOOL)));
		assertThat(infer(str("hi")), is(Optional.<Term>of(STRING)));
		assertTrue(recorder.getDiagnostics().isEmpty());
	}

	@Test
	public void unboundVariableIsAnError() {
		assertFalse(infer(var("q")).isPresent());
		assertEquals(1, recorder.getDiagnostics().size());
		Diagnostic d = recorder.getDiagnostics().get(0);
		assertEquals(Severity.ERROR, d.getSeverity());
		assertEquals("Unbound variable 'q'", d.getMessage());
		assertThat(d.getTerm(), is(Optional.<Term>of(var("q"))));
		assertTrue(recorder.hasErrors());
	}

	@Test
	public void sorts() {
		assertThat(infer(PROP), is(Optional.<Term>of(TYPE1)));
		assertThat(infer(TYPE0), is(Optional.<Term>of(TYPE1)));
		assertThat(infer(type(3)), is(Optional.<Term>of(type(4))));
	}

	@Test
	public void lambdaHasPiType() {
		Term t = lam("x", NAT, binOp(BinaryOperator.ADD, var("x"), nat(1)));
		assertThat(infer(t), is(Optional.<Term>of(pi("x", NAT, NAT))));
	}

	@Test
	public void applicationSubstitutesArgument() {
		assertThat(infer(prime(nat(7))), is(Optional.<Term>of(PROP)));
		assertTrue(recorder.getDiagnostics().isEmpty());
	}

	@Test
	public void mismatchedArgumentIsOnlyAHint() {
		assertThat(infer(prime(bool(true))), is(Optional.<Term>of(PROP)));
		assertEquals(1, recorder.getDiagnostics().size());
		assertEquals(Severity.HINT, recorder.getDiagnostics().get(0).getSeverity());
		assertFalse(recorder.hasErrors());
	}

	@Test
	public void piOverPropositionIsAProposition() {
		assertThat(infer(pi("n", NAT, prime(var("n")))), is(Optional.<Term>of(PROP)));
		assertThat(infer(arrow(NAT, NAT)), is(Optional.<Term>of(TYPE0)));
		assertThat(infer(arrow(TYPE0, TYPE0)), is(Optional.<Term>of(TYPE1)));
	}

	@Test
	public void pairsAndProjections() {
		Term p = pair(nat(1), bool(false));
		assertThat(infer(p), is(Optional.<Term>of(sigma(ANONYMOUS, NAT, BOOL))));
		assertThat(infer(proj(p, 1)), is(Optional.<Term>of(NAT)));
		assertThat(infer(proj(p, 2)), is(Optional.<Term>of(BOOL)));
	}

	@Test
	public void letBindsItsName() {
		Term t = letIn("x", NAT, nat(1), binOp(BinaryOperator.MUL, var("x"), var("x")));
		assertThat(infer(t), is(Optional.<Term>of(NAT)));
		assertTrue(recorder.getDiagnostics().isEmpty());
	}

	@Test
	public void letWithWrongTypeWarns() {
		infer(letIn("x", BOOL, nat(1), var("x")));
		assertEquals(1, recorder.getDiagnostics().size());
		assertEquals(Severity.WARNING, recorder.getDiagnostics().get(0).getSeverity());
	}

	@Test
	public void arithmeticWidens() {
		ctx = ctx.extend("r", REAL).extend("z", INT);
		assertThat(infer(binOp(BinaryOperator.ADD, var("r"), nat(1))), is(Optional.<Term>of(REAL)));
		assertThat(infer(binOp(BinaryOperator.SUB, nat(1), var("z"))), is(Optional.<Term>of(INT)));
		assertThat(infer(neg(nat(1))), is(Optional.<Term>of(INT)));
	}

	@Test
	public void logicalFormsArePropositions() {
		Term statement = forAll("n", NAT, binOp(BinaryOperator.GEQ, var("n"), nat(0)));
		assertThat(infer(statement), is(Optional.<Term>of(PROP)));
		assertThat(infer(equiv(nat(3), nat(1), nat(2))), is(Optional.<Term>of(PROP)));
		assertThat(infer(TermBuilder.not(bool(true))), is(Optional.<Term>of(PROP)));
		assertTrue(recorder.getDiagnostics().isEmpty());
	}

	@Test
	public void standardVocabulary() {
		for (Term structure : new Term[] { GROUP, RING, FIELD, TOPOLOGICAL_SPACE, GRAPH }) {
			assertThat(infer(structure), is(Optional.<Term>of(TYPE0)));
		}
		assertThat(infer(set(NAT)), is(Optional.<Term>of(TYPE0)));
		assertThat(infer(list(REAL)), is(Optional.<Term>of(TYPE0)));
		assertThat(infer(zmod(nat(7))), is(Optional.<Term>of(TYPE0)));
		assertThat(infer(odd(nat(3))), is(Optional.<Term>of(PROP)));
		assertThat(infer(coprime(nat(4), nat(9))), is(Optional.<Term>of(PROP)));
		assertThat(infer(divides(nat(3), nat(12))), is(Optional.<Term>of(PROP)));
		assertThat(coprime(nat(4), nat(9)), is(app(app(var("Coprime"), nat(4)), nat(9))));
		assertThat(apps(var("f")), is(var("f")));
		assertTrue(recorder.getDiagnostics().isEmpty());
	}

	@Test
	public void quantifierBodySeesBoundName() {
		infer(exists("p", NAT, binOp(BinaryOperator.AND, prime(var("p")), even(var("p")))));
		assertTrue(recorder.getDiagnostics().isEmpty());
	}

	@Test
	public void axiomOutsideBundleWarns() {
		ctx = StandardContext.create(AxiomBundle.MINIMAL_CORE);
		assertThat(infer(axiomRef(Axiom.LEM)), is(Optional.<Term>of(PROP)));
		assertEquals(1, recorder.getDiagnostics().size());
		assertEquals("Axiom 'LEM' used but not in current bundle 'MinimalCore'",
				recorder.getDiagnostics().get(0).getMessage());
		assertEquals(EnumSet.of(Axiom.LEM), recorder.getAxiomUsage());
	}

	@Test
	public void axiomInsideBundleIsRecordedSilently() {
		infer(axiomRef(Axiom.Choice));
		assertTrue(recorder.getDiagnostics().isEmpty());
		assertEquals(EnumSet.of(Axiom.Choice), recorder.getAxiomUsage());
	}

	@Test
	public void holesAreRecordedWithSuggestions() {
		ctx = ctx.extend("h", PROP);
		assertFalse(infer(hole("goal", "show h")).isPresent());
		assertEquals(1, recorder.getHoles().size());
		HoleInfo info = recorder.getHoles().get(0);
		assertEquals("goal", info.getId());
		assertThat(info.getContext().get("h"), is((Term) PROP));
		assertEquals("Try: apply h", info.getSuggestions().get(0));
		assertThat(info.getSuggestions(), hasItem("Hole annotation: show h"));
		assertTrue(recorder.getDiagnostics().isEmpty());
	}

	@Test
	public void deepTermsBecomeErrors() {
		Term t = nat(0);
		for (int i = 0; i < 100; i++) {
			t = binOp(BinaryOperator.ADD, t, nat(1));
		}
		Optional<Term> type = new TypeChecker(new Kernel(40)).inferType(ctx, t, recorder);
		assertFalse(type.isPresent());
		assertTrue(recorder.hasErrors());
		assertThat(recorder.getDiagnostics().get(0).getMessage(), containsString("40"));
	}
}
