package theoremis;

import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import theoremis.json.ModuleJsonReader;
import theoremis.kernel.Kernel;
import theoremis.model.term.AxiomBundle;
import theoremis.parser.MathExprParser;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings read from the JSON configuration file:
 *
 * {
 *   "axiomBundle": "ClassicalMath",
 *   "maxTermDepth": 1000,
 *   "maxParseDepth": 200,
 *   "bundles": [{"name": "Finitist", "axioms": ["LEM"], "description": "..."}]
 * }
 *
 * Every field is optional. Custom bundles are available alongside the
 * standard ones and may replace them by name.
 */
public class TheoremisConfig {
	public static final String DEFAULT_BUNDLE = AxiomBundle.CLASSICAL_MATH.getName();

	private final String axiomBundle;
	private final int maxTermDepth;
	private final int maxParseDepth;
	private final Map<String, AxiomBundle> bundles;

	public TheoremisConfig(String axiomBundle, int maxTermDepth, int maxParseDepth, Map<String, AxiomBundle> bundles) {
		this.axiomBundle = axiomBundle;
		this.maxTermDepth = maxTermDepth;
		this.maxParseDepth = maxParseDepth;
		this.bundles = Collections.unmodifiableMap(new LinkedHashMap<>(bundles));
	}

	public static TheoremisConfig defaults() {
		return new TheoremisConfig(DEFAULT_BUNDLE, Kernel.DEFAULT_MAX_DEPTH, MathExprParser.DEFAULT_MAX_DEPTH,
				AxiomBundle.standardBundles());
	}

	public static TheoremisConfig read(String configFilePath) throws TheoremisOptionException {
		String s;
		try {
			s = FileUtils.readFileToString(new File(configFilePath), StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new TheoremisOptionException("Error reading configuration file: " + ex.getMessage());
		}

		JSONObject config;
		try {
			config = new JSONObject(s);
		} catch (JSONException e) {
			throw new TheoremisOptionException(configFilePath + ": parsing error: " + e.getMessage());
		}
		return fromJson(config);
	}

	public static TheoremisConfig fromJson(JSONObject config) throws TheoremisOptionException {
		try {
			Map<String, AxiomBundle> bundles = new LinkedHashMap<>(AxiomBundle.standardBundles());
			if (config.has("bundles")) {
				JSONArray array = config.getJSONArray("bundles");
				for (int i = 0; i < array.length(); i++) {
					AxiomBundle bundle = ModuleJsonReader.readBundle(array.getJSONObject(i));
					bundles.put(bundle.getName(), bundle);
				}
			}
			int maxTermDepth = config.optInt("maxTermDepth", Kernel.DEFAULT_MAX_DEPTH);
			int maxParseDepth = config.optInt("maxParseDepth", MathExprParser.DEFAULT_MAX_DEPTH);
			if (maxTermDepth <= 0 || maxParseDepth <= 0) {
				throw new TheoremisOptionException("maxTermDepth and maxParseDepth must be positive");
			}
			return new TheoremisConfig(config.optString("axiomBundle", DEFAULT_BUNDLE), maxTermDepth, maxParseDepth,
					bundles);
		} catch (JSONException e) {
			throw new TheoremisOptionException("invalid configuration: " + e.getMessage());
		}
	}

	public String getAxiomBundle() {
		return axiomBundle;
	}

	public int getMaxTermDepth() {
		return maxTermDepth;
	}

	public int getMaxParseDepth() {
		return maxParseDepth;
	}

	public Map<String, AxiomBundle> getBundles() {
		return bundles;
	}

	public AxiomBundle resolveBundle(String name) throws TheoremisOptionException {
		AxiomBundle bundle = bundles.get(name);
		if (bundle == null) {
			throw new TheoremisOptionException("Unknown axiom bundle '" + name + "', expected one of " + bundles.keySet());
		}
		return bundle;
	}
}
