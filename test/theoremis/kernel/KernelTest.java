package theoremis.kernel;

import org.junit.Test;
import theoremis.model.term.AxiomBundle;
import theoremis.model.term.BinaryOperator;
import theoremis.model.term.StandardTypes;
import theoremis.model.term.Term;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;
import static theoremis.model.term.StandardTypes.NAT;
import static theoremis.model.term.TermBuilder.*;

public class KernelTest {

	private final Kernel kernel = Kernel.standard();

	private static Term add(Term a, Term b) {
		return binOp(BinaryOperator.ADD, a, b);
	}

	@Test
	public void freeVarsExcludeBoundNames() {
		Term t = lam("x", var("A"), app(var("f"), add(var("x"), var("y"))));
		assertThat(kernel.freeVars(t), is(new HashSet<>(Arrays.asList("A", "f", "y"))));
	}

	@Test
	public void freeVarsIncludeLetValueButNotBoundName() {
		Term t = letIn("x", NAT, var("v"), add(var("x"), var("z")));
		assertThat(kernel.freeVars(t), is(new HashSet<>(Arrays.asList("ℕ", "v", "z"))));
	}

	@Test
	public void freeVarsOfMatchSkipBindings() {
		Term t = match(var("s"), matchCase("cons", Arrays.asList("h", "t"), app(var("h"), var("k"))));
		assertThat(kernel.freeVars(t), is(new HashSet<>(Arrays.asList("s", "k"))));
	}

	@Test
	public void substituteReplacesFreeOccurrences() {
		Term t = add(var("x"), var("y"));
		assertThat(kernel.substitute(t, "x", nat(1)), is(add(nat(1), var("y"))));
	}

	@Test
	public void substituteAvoidsCapture() {
		// (λ y. x + y)[x := y] must not capture the free y
		Term t = lam("y", NAT, add(var("x"), var("y")));
		Term result = kernel.substitute(t, "x", var("y"));
		assertThat(result, is(lam("y′", NAT, add(var("y"), var("y′")))));
	}

	@Test
	public void freshNamesSkipNamesInUse() {
		Term t = lam("y", NAT, add(var("x"), add(var("y"), var("y′"))));
		Term result = kernel.substitute(t, "x", var("y"));
		assertThat(result, is(lam("y′1", NAT, add(var("y"), add(var("y′1"), var("y′"))))));
	}

	@Test
	public void unrelatedBinderIsKeptWhenReplacementIsFresh() {
		Term t = lam("y", NAT, var("x"));
		assertThat(kernel.substitute(t, "x", var("z")), is(lam("y", NAT, var("z"))));
	}

	@Test
	public void shadowingBinderKeepsBodyButSubstitutesDomain() {
		Term t = lam("x", var("x"), var("x"));
		assertThat(kernel.substitute(t, "x", var("z")), is(lam("x", var("z"), var("x"))));
	}

	@Test
	public void substituteAvoidsCaptureUnderQuantifiers() {
		Term t = forAll("n", NAT, binOp(BinaryOperator.LT, var("n"), var("m")));
		Term result = kernel.substitute(t, "m", add(var("n"), nat(1)));
		assertThat(result, is(forAll("n′", NAT,
				binOp(BinaryOperator.LT, var("n′"), add(var("n"), nat(1))))));
	}

	@Test
	public void substituteAvoidsCaptureInLet() {
		Term t = letIn("y", NAT, nat(0), add(var("x"), var("y")));
		Term result = kernel.substitute(t, "x", var("y"));
		assertThat(result, is(letIn("y′", NAT, nat(0), add(var("y"), var("y′")))));
	}

	@Test
	public void substituteAvoidsCaptureInMatchBindings() {
		Term t = match(var("l"), matchCase("cons", Arrays.asList("h", "t"), add(var("h"), var("x"))));
		Term result = kernel.substitute(t, "x", var("h"));
		assertThat(result, is(match(var("l"),
				matchCase("cons", Arrays.asList("h′", "t"), add(var("h′"), var("h"))))));
	}

	@Test
	public void substitutionLeavesUnrelatedTermsAlone() {
		Term t = pi("a", StandardTypes.TYPE0, arrow(var("a"), var("a")));
		assertThat(kernel.substitute(t, "q", nat(3)), is(t));
	}

	@Test
	public void normalizeContractsBetaRedex() {
		Term redex = app(lam("x", NAT, add(var("x"), var("x"))), nat(2));
		TypingContext ctx = TypingContext.empty(AxiomBundle.CLASSICAL_MATH);
		assertThat(kernel.normalize(redex, ctx), is(add(nat(2), nat(2))));
	}

	@Test
	public void normalizeContractsLetAndProjection() {
		TypingContext ctx = TypingContext.empty(AxiomBundle.CLASSICAL_MATH);
		assertThat(kernel.normalize(letIn("x", NAT, nat(5), var("x")), ctx), is(nat(5)));
		assertThat(kernel.normalize(proj(pair(var("a"), var("b")), 2), ctx), is(var("b")));
	}

	@Test
	public void normalizeLeavesStuckArguments() {
		TypingContext ctx = TypingContext.empty(AxiomBundle.CLASSICAL_MATH);
		Term inner = app(lam("x", NAT, var("x")), nat(1));
		Term stuck = app(var("f"), inner);
		assertThat(kernel.normalize(stuck, ctx), is(stuck));
	}

	@Test
	public void normalizeIsIdempotent() {
		TypingContext ctx = TypingContext.empty(AxiomBundle.CLASSICAL_MATH);
		Term t = app(app(lam("x", NAT, lam("y", NAT, var("x"))), nat(1)), nat(2));
		Term once = kernel.normalize(t, ctx);
		assertThat(once, is(nat(1)));
		assertThat(kernel.normalize(once, ctx), is(once));
	}

	@Test
	public void boundAndFreeBodiesDiffer() {
		assertFalse(kernel.termsEqual(lam("x", NAT, var("x")), lam("x", NAT, var("y"))));
		assertFalse(kernel.termsEqual(lam("x", NAT, var("y")), lam("x", NAT, var("x"))));
	}

	@Test
	public void alphaEquivalentBindersAreEqual() {
		assertTrue(kernel.termsEqual(lam("x", NAT, var("x")), lam("y", NAT, var("y"))));
		assertTrue(kernel.termsEqual(
				forAll("a", NAT, exists("b", NAT, binOp(BinaryOperator.LT, var("a"), var("b")))),
				forAll("c", NAT, exists("d", NAT, binOp(BinaryOperator.LT, var("c"), var("d"))))));
	}

	@Test
	public void differentDomainsAreNotEqual() {
		assertFalse(kernel.termsEqual(lam("x", NAT, var("x")), lam("x", StandardTypes.INT, var("x"))));
	}

	@Test
	public void freeNameOnOneSideIsNotCaptured() {
		// λ x. y and λ y. y differ: y is free on the left but bound on the right
		assertFalse(kernel.termsEqual(lam("x", NAT, var("y")), lam("y", NAT, var("y"))));
		assertFalse(kernel.termsEqual(lam("y", NAT, var("y")), lam("x", NAT, var("y"))));
	}

	@Test
	public void equalityComparesModulus() {
		assertTrue(kernel.termsEqual(equiv(var("a"), var("b"), var("n")), equiv(var("a"), var("b"), var("n"))));
		assertFalse(kernel.termsEqual(equiv(var("a"), var("b"), var("n")), equiv(var("a"), var("b"))));
	}

	@Test
	public void equalityUnderContextNormalizes() {
		TypingContext ctx = TypingContext.empty(AxiomBundle.CLASSICAL_MATH);
		Term redex = app(lam("x", NAT, var("x")), nat(7));
		assertFalse(kernel.termsEqual(redex, nat(7)));
		assertTrue(kernel.termsEqual(redex, nat(7), ctx));
	}

	@Test
	public void matchCasesMustAgree() {
		Term a = match(var("s"), matchCase("zero", Collections.emptyList(), nat(0)));
		Term b = match(var("s"), matchCase("succ", Collections.singletonList("n"), nat(0)));
		assertFalse(kernel.termsEqual(a, b));
		assertTrue(kernel.termsEqual(a, a));
	}

	private static Term deepApplication(int depth) {
		Term t = var("x");
		for (int i = 0; i < depth; i++) {
			t = app(var("f"), t);
		}
		return t;
	}

	@Test
	public void deepTermsFailWithLimit() {
		Kernel small = new Kernel(50);
		try {
			small.freeVars(deepApplication(100));
			fail("expected TermTooDeepException");
		} catch (TermTooDeepException e) {
			assertEquals(50, e.getLimit());
			assertThat(e.getMessage(), containsString("50"));
		}
	}

	@Test(expected = TermTooDeepException.class)
	public void deepSubstitutionFails() {
		new Kernel(50).substitute(deepApplication(100), "x", nat(0));
	}

	@Test
	public void termsWithinLimitAreFine() {
		assertThat(new Kernel(50).freeVars(deepApplication(20)), is(new HashSet<>(Arrays.asList("f", "x"))));
	}

	@Test(expected = IllegalArgumentException.class)
	public void nonPositiveLimitIsRejected() {
		new Kernel(0);
	}

	@Test
	public void typingContextExtensionDoesNotMutate() {
		TypingContext base = TypingContext.empty(AxiomBundle.MINIMAL_CORE);
		TypingContext extended = base.extend("x", NAT);
		assertFalse(base.lookup("x").isPresent());
		assertThat(extended.lookup("x").get(), is((Term) NAT));
		assertThat(extended.extend("x", StandardTypes.INT).lookup("x").get(), is((Term) StandardTypes.INT));
		assertThat(extended.lookup("x").get(), is((Term) NAT));
	}
}
