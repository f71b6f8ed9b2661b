package theoremis.json;

import org.json.JSONObject;
import org.junit.Test;
import theoremis.model.term.Axiom;
import theoremis.model.term.BinaryOperator;
import theoremis.model.term.Term;
import theoremis.model.term.TermBuilder;

import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;
import static theoremis.model.term.StandardTypes.*;
import static theoremis.model.term.TermBuilder.*;

public class TermJsonTest {

	private final TermJsonReader reader = new TermJsonReader();

	private void assertReadsBack(Term term) {
		JSONObject json = TermJsonWriter.write(term);
		assertThat(reader.read(json), is(Optional.of(term)));
		// and through its text form
		assertThat(reader.read(json.toString()), is(Optional.of(term)));
	}

	@Test
	public void readsHandWrittenApplication() {
		String text = "{\"tag\": \"App\", \"func\": {\"tag\": \"Var\", \"name\": \"f\"}," +
				" \"arg\": {\"tag\": \"Literal\", \"kind\": \"Nat\", \"value\": \"1\"}}";
		assertThat(reader.read(text), is(Optional.<Term>of(app(var("f"), nat(1)))));
	}

	@Test
	public void binderAndLogicalTerms() {
		assertReadsBack(forAll("n", NAT, binOp(BinaryOperator.GEQ, var("n"), nat(0))));
		assertReadsBack(lam("x", NAT, TermBuilder.not(prime(var("x")))));
		assertReadsBack(equiv(var("a"), var("b"), var("n")));
		assertReadsBack(equiv(var("a"), var("b")));
		assertReadsBack(letIn("x", NAT, nat(2), proj(pair(var("x"), bool(true)), 1)));
	}

	@Test
	public void sortsHolesAndAxioms() {
		assertReadsBack(pi("A", type(2), arrow(var("A"), PROP)));
		assertReadsBack(hole("goal", "show P"));
		assertReadsBack(hole("goal"));
		assertReadsBack(axiomRef(Axiom.Univalence));
	}

	@Test
	public void inductivesAndMatches() {
		assertReadsBack(ind("Bit", TYPE0, ctor("zero", var("Bit")), ctor("one", var("Bit"))));
		assertReadsBack(match(var("l"),
				matchCase("nil", Collections.emptyList(), nat(0)),
				matchCase("cons", Arrays.asList("h", "t"), var("h"))));
	}

	@Test
	public void writerUsesOperatorSymbols() {
		JSONObject json = TermJsonWriter.write(binOp(BinaryOperator.SUBSET, var("A"), var("B")));
		assertEquals("BinOp", json.getString("tag"));
		assertEquals("⊆", json.getString("op"));
		assertFalse(TermJsonWriter.write(equiv(var("a"), var("b"))).has("modulus"));
	}

	@Test
	public void malformedInputIsEmpty() {
		assertFalse(reader.read("not json").isPresent());
		assertFalse(reader.read("{\"tag\": \"Nope\"}").isPresent());
		assertFalse(reader.read("{\"tag\": \"Var\"}").isPresent());
		assertFalse(reader.read("{\"tag\": \"AxiomRef\", \"axiom\": \"Magic\"}").isPresent());
		assertFalse(reader.read("{\"tag\": \"BinOp\", \"op\": \"??\", \"left\": {\"tag\": \"Var\", \"name\": \"a\"}," +
				" \"right\": {\"tag\": \"Var\", \"name\": \"b\"}}").isPresent());
		assertFalse(reader.read("{\"tag\": \"Literal\", \"kind\": \"Float\", \"value\": \"1\"}").isPresent());
		assertFalse(reader.read(Integer.valueOf(3)).isPresent());
	}

	@Test
	public void missingInputIsEmpty() {
		assertFalse(reader.read(null).isPresent());
		assertFalse(reader.read(JSONObject.NULL).isPresent());
	}

	@Test
	public void overlyDeepInputIsEmpty() {
		Term t = var("x");
		for (int i = 0; i < 60; i++) {
			t = app(var("f"), t);
		}
		JSONObject json = TermJsonWriter.write(t);
		assertFalse(new TermJsonReader(50).read(json).isPresent());
		assertTrue(new TermJsonReader(100).read(json).isPresent());
	}
}
