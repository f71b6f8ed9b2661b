package theoremis.json;

import org.junit.Test;
import theoremis.model.decl.*;
import theoremis.model.tactic.*;
import theoremis.model.term.Axiom;
import theoremis.model.term.AxiomBundle;
import theoremis.model.term.BinaryOperator;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;
import static theoremis.model.term.StandardTypes.*;
import static theoremis.model.term.TermBuilder.*;

public class ModuleJsonReaderTest {

	private static final String NAT_JSON = "{\"tag\": \"Var\", \"name\": \"ℕ\"}";

	private static final String MODULE = "{" +
			"\"name\": \"Primes\"," +
			"\"axiomBundle\": \"MinimalCore\"," +
			"\"imports\": [\"Mathlib.Data.Nat.Prime\"]," +
			"\"declarations\": [" +
			"  {\"tag\": \"Definition\", \"name\": \"two\", \"returnType\": " + NAT_JSON + "," +
			"   \"body\": {\"tag\": \"Literal\", \"kind\": \"Nat\", \"value\": \"2\"}}," +
			"  {\"tag\": \"Theorem\", \"name\": \"two_prime\"," +
			"   \"statement\": {\"tag\": \"App\", \"func\": {\"tag\": \"Var\", \"name\": \"Prime\"}," +
			"                   \"arg\": {\"tag\": \"Var\", \"name\": \"two\"}}," +
			"   \"proof\": [{\"tag\": \"Rewrite\", \"term\": {\"tag\": \"Var\", \"name\": \"h\"}, \"direction\": \"rtl\"}," +
			"             {\"tag\": \"Alt\", \"tactics\": [{\"tag\": \"Omega\"}, {\"tag\": \"Sorry\"}]}]," +
			"   \"axiomBundle\": \"ClassicalMath\"," +
			"   \"metadata\": {\"source\": \"notes.tex\", \"lineNumber\": 12, \"confidence\": 0.5," +
			"                  \"dependencies\": [\"two\"]}}," +
			"  {\"tag\": \"Lemma\", \"name\": \"l\"," +
			"   \"params\": [{\"name\": \"n\", \"type\": " + NAT_JSON + ", \"implicit\": true}]," +
			"   \"statement\": {\"tag\": \"BinOp\", \"op\": \"≥\", \"left\": {\"tag\": \"Var\", \"name\": \"n\"}," +
			"                   \"right\": {\"tag\": \"Literal\", \"kind\": \"Nat\", \"value\": \"0\"}}}" +
			"]}";

	@Test
	public void readsFullModule() {
		Optional<IRModule> read = new ModuleJsonReader().read(MODULE);
		assertTrue(read.isPresent());
		IRModule module = read.get();
		assertEquals("Primes", module.getName());
		assertThat(module.getAxiomBundle(), is(AxiomBundle.MINIMAL_CORE));
		assertEquals(Arrays.asList("Mathlib.Data.Nat.Prime"), module.getImports());
		assertEquals(3, module.getDeclarations().size());

		Definition two = (Definition) module.getDeclarations().get(0);
		assertThat(two.getBody(), is(nat(2)));

		Theorem theorem = (Theorem) module.getDeclarations().get(1);
		assertThat(theorem.getStatement(), is(prime(var("two"))));
		assertEquals(Arrays.asList(
				new Rewrite(var("h"), Rewrite.Direction.RTL),
				new Alt(Arrays.asList(new Omega(), new Sorry()))), theorem.getProof());
		assertThat(theorem.getAxiomBundle(), is(Optional.of(AxiomBundle.CLASSICAL_MATH)));
		assertThat(theorem.getMeta().getSource(), is(Optional.of("notes.tex")));
		assertThat(theorem.getMeta().getLineNumber(), is(Optional.of(12)));
		assertEquals(0.5, theorem.getMeta().getConfidence(), 1e-9);
		assertEquals(Arrays.asList("two"), theorem.getMeta().getDependencies());

		Lemma lemma = (Lemma) module.getDeclarations().get(2);
		assertTrue(lemma.getParams().get(0).isImplicit());
		assertThat(lemma.getParams().get(0).getType(), is(NAT));
		assertThat(lemma.getStatement(), is(binOp(BinaryOperator.GEQ, var("n"), nat(0))));
		assertTrue(lemma.getProof().isEmpty());
	}

	@Test
	public void defaultsToClassicalBundle() {
		IRModule module = new ModuleJsonReader().read("{\"name\": \"E\", \"declarations\": []}").get();
		assertThat(module.getAxiomBundle(), is(AxiomBundle.CLASSICAL_MATH));
		assertTrue(module.getImports().isEmpty());
	}

	@Test
	public void readsInlineBundle() {
		IRModule module = new ModuleJsonReader().read("{\"name\": \"E\", \"declarations\": []," +
				"\"axiomBundle\": {\"name\": \"Custom\", \"axioms\": [\"LEM\", \"Funext\"]}}").get();
		assertEquals("Custom", module.getAxiomBundle().getName());
		assertEquals(EnumSet.of(Axiom.LEM, Axiom.Funext), module.getAxiomBundle().getAxioms());
	}

	@Test
	public void rejectsMalformedModules() {
		ModuleJsonReader reader = new ModuleJsonReader();
		assertFalse(reader.read("{\"name\": \"E\"}").isPresent());
		assertFalse(reader.read("{\"name\": \"E\", \"declarations\": [], \"axiomBundle\": \"Nope\"}").isPresent());
		assertFalse(reader.read("{\"name\": \"E\", \"declarations\": [{\"tag\": \"Axiom\", \"name\": \"a\"}]}")
				.isPresent());
		assertFalse(reader.read("{\"name\": \"E\", \"declarations\": [{\"tag\": \"Lemma\", \"name\": \"a\"," +
				" \"statement\": " + NAT_JSON + ", \"proof\": [{\"tag\": \"Magic\"}]}]}").isPresent());
		assertFalse(reader.read("[]").isPresent());
		assertFalse(reader.read("{\"name\": \"E\", \"declarations\": [], \"axiomBundle\": 3}").isPresent());
	}

	@Test
	public void missingInputIsEmpty() {
		ModuleJsonReader reader = new ModuleJsonReader();
		assertFalse(reader.read(null).isPresent());
		assertFalse(reader.read(Integer.valueOf(3)).isPresent());
	}
}
