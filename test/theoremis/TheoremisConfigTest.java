package theoremis;

import org.json.JSONObject;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import theoremis.kernel.Kernel;
import theoremis.model.term.Axiom;
import theoremis.model.term.AxiomBundle;
import theoremis.parser.MathExprParser;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;

import org.apache.commons.io.FileUtils;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class TheoremisConfigTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void defaults() {
		TheoremisConfig config = TheoremisConfig.defaults();
		assertEquals("ClassicalMath", config.getAxiomBundle());
		assertEquals(Kernel.DEFAULT_MAX_DEPTH, config.getMaxTermDepth());
		assertEquals(MathExprParser.DEFAULT_MAX_DEPTH, config.getMaxParseDepth());
		assertThat(config.getBundles().keySet(), hasItems("ClassicalMath", "ConstructiveHoTT", "Lean4Default", "MinimalCore"));
	}

	@Test
	public void customBundlesAreResolvable() throws TheoremisOptionException {
		TheoremisConfig config = TheoremisConfig.fromJson(new JSONObject(
				"{\"axiomBundle\": \"Finitist\", \"maxTermDepth\": 64," +
						" \"bundles\": [{\"name\": \"Finitist\", \"axioms\": [\"LEM\"]}]}"));
		assertEquals(64, config.getMaxTermDepth());
		assertEquals(MathExprParser.DEFAULT_MAX_DEPTH, config.getMaxParseDepth());
		AxiomBundle bundle = config.resolveBundle(config.getAxiomBundle());
		assertEquals(EnumSet.of(Axiom.LEM), bundle.getAxioms());
		assertThat(config.resolveBundle("MinimalCore"), is(AxiomBundle.MINIMAL_CORE));
	}

	@Test
	public void unknownBundleIsRejected() {
		try {
			TheoremisConfig.defaults().resolveBundle("Magic");
			fail("expected TheoremisOptionException");
		} catch (TheoremisOptionException e) {
			assertThat(e.getMsg(), containsString("Unknown axiom bundle 'Magic'"));
		}
	}

	@Test(expected = TheoremisOptionException.class)
	public void nonPositiveDepthIsRejected() throws TheoremisOptionException {
		TheoremisConfig.fromJson(new JSONObject("{\"maxParseDepth\": 0}"));
	}

	@Test(expected = TheoremisOptionException.class)
	public void badBundleAxiomIsRejected() throws TheoremisOptionException {
		TheoremisConfig.fromJson(new JSONObject("{\"bundles\": [{\"name\": \"B\", \"axioms\": [\"Magic\"]}]}"));
	}

	@Test
	public void readsFromFile() throws IOException, TheoremisOptionException {
		File file = folder.newFile("theoremis.json");
		FileUtils.writeStringToFile(file, "{\"axiomBundle\": \"MinimalCore\", \"maxParseDepth\": 30}",
				StandardCharsets.UTF_8);
		TheoremisConfig config = TheoremisConfig.read(file.getPath());
		assertEquals("MinimalCore", config.getAxiomBundle());
		assertEquals(30, config.getMaxParseDepth());
	}

	@Test
	public void unparsableFileIsReported() throws IOException {
		File file = folder.newFile("broken.json");
		FileUtils.writeStringToFile(file, "{axiomBundle", StandardCharsets.UTF_8);
		try {
			TheoremisConfig.read(file.getPath());
			fail("expected TheoremisOptionException");
		} catch (TheoremisOptionException e) {
			assertThat(e.getMsg(), containsString("parsing error"));
		}
	}
}
