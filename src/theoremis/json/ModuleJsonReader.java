package theoremis.json;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import theoremis.kernel.DepthGuard;
import theoremis.kernel.Kernel;
import theoremis.kernel.TermTooDeepException;
import theoremis.model.decl.*;
import theoremis.model.tactic.*;
import theoremis.model.term.Axiom;
import theoremis.model.term.AxiomBundle;
import theoremis.model.term.Term;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Reads an {@link IRModule} from JSON:
 *
 * {
 *   "name": "M",
 *   "axiomBundle": "ClassicalMath" | {"name": ..., "axioms": [...], "description": ...},
 *   "imports": ["Mathlib.Tactic"],
 *   "declarations": [{"tag": "Theorem", "name": ..., "params": [...], "statement": ..., "proof": [...]}]
 * }
 *
 * Like {@link TermJsonReader}, malformed input yields an empty result rather
 * than an exception.
 */
public class ModuleJsonReader {

	private static final Logger logger = Logger.getLogger(ModuleJsonReader.class.getName());

	private final Map<String, AxiomBundle> bundles;
	private final TermJsonReader terms;
	private final int maxDepth;

	public ModuleJsonReader() {
		this(AxiomBundle.standardBundles(), Kernel.DEFAULT_MAX_DEPTH);
	}

	/**
	 * @param bundles the bundles a module may refer to by name
	 */
	public ModuleJsonReader(Map<String, AxiomBundle> bundles, int maxDepth) {
		this.bundles = new HashMap<>(bundles);
		this.terms = new TermJsonReader(maxDepth);
		this.maxDepth = maxDepth;
	}

	/**
	 * @param json a {@link JSONObject} or JSON text
	 */
	public Optional<IRModule> read(Object json) {
		if (!(json instanceof String) && !(json instanceof JSONObject)) {
			logger.fine(() -> "rejected module JSON: expected text or an object, got " + json);
			return Optional.empty();
		}
		try {
			JSONObject obj = json instanceof String ? new JSONObject((String) json) : (JSONObject) json;
			return Optional.of(module(obj));
		} catch (JSONException | IllegalArgumentException | TermTooDeepException e) {
			logger.fine(() -> "rejected module JSON: " + e.getMessage());
			return Optional.empty();
		}
	}

	private IRModule module(JSONObject obj) {
		AxiomBundle bundle = obj.has("axiomBundle") ? bundle(obj.get("axiomBundle")) : AxiomBundle.CLASSICAL_MATH;
		List<Declaration> declarations = new ArrayList<>();
		JSONArray array = obj.getJSONArray("declarations");
		for (int i = 0; i < array.length(); i++) {
			declarations.add(declaration(array.getJSONObject(i)));
		}
		List<String> imports = obj.has("imports")
				? TermJsonReader.strings(obj.getJSONArray("imports"))
				: Collections.emptyList();
		return new IRModule(obj.getString("name"), declarations, bundle, imports);
	}

	private AxiomBundle bundle(Object json) {
		if (json instanceof String) {
			AxiomBundle bundle = bundles.get(json);
			if (bundle == null) {
				throw new JSONException("unknown axiom bundle " + json);
			}
			return bundle;
		}
		if (!(json instanceof JSONObject)) {
			throw new JSONException("axiom bundle must be a name or an object, got " + json);
		}
		return readBundle((JSONObject) json);
	}

	/**
	 * Reads an inline bundle definition {"name": ..., "axioms": [...], "description": ...}.
	 */
	public static AxiomBundle readBundle(JSONObject obj) {
		Set<Axiom> axioms = EnumSet.noneOf(Axiom.class);
		for (String name : TermJsonReader.strings(obj.getJSONArray("axioms"))) {
			axioms.add(Axiom.fromName(name).orElseThrow(() -> new JSONException("unknown axiom " + name)));
		}
		return new AxiomBundle(obj.getString("name"), axioms, obj.optString("description", ""));
	}

	private Term term(JSONObject obj, String key) {
		return terms.term(obj.getJSONObject(key), new DepthGuard("json", maxDepth));
	}

	private Declaration declaration(JSONObject obj) {
		String tag = obj.getString("tag");
		String name = obj.getString("name");
		List<Param> params = new ArrayList<>();
		if (obj.has("params")) {
			JSONArray array = obj.getJSONArray("params");
			for (int i = 0; i < array.length(); i++) {
				JSONObject p = array.getJSONObject(i);
				params.add(new Param(p.getString("name"), term(p, "type"), p.optBoolean("implicit", false)));
			}
		}
		switch (tag) {
			case "Definition":
				return new Definition(name, params, term(obj, "returnType"), term(obj, "body"));
			case "Theorem":
				return new Theorem(name, params, term(obj, "statement"), proof(obj),
						obj.has("axiomBundle") ? bundle(obj.get("axiomBundle")) : null,
						obj.has("metadata") ? meta(obj.getJSONObject("metadata")) : TheoremMeta.empty());
			case "Lemma":
				return new Lemma(name, params, term(obj, "statement"), proof(obj));
			default:
				throw new JSONException("unknown declaration tag " + tag);
		}
	}

	private static TheoremMeta meta(JSONObject obj) {
		return new TheoremMeta(
				obj.has("source") ? obj.getString("source") : null,
				obj.has("lineNumber") ? obj.getInt("lineNumber") : null,
				obj.optDouble("confidence", 1.0),
				obj.has("dependencies") ? TermJsonReader.strings(obj.getJSONArray("dependencies")) : Collections.emptyList());
	}

	private List<Tactic> proof(JSONObject obj) {
		if (!obj.has("proof")) {
			return Collections.emptyList();
		}
		return tactics(obj.getJSONArray("proof"));
	}

	private List<Tactic> tactics(JSONArray array) {
		List<Tactic> result = new ArrayList<>();
		for (int i = 0; i < array.length(); i++) {
			result.add(tactic(array.getJSONObject(i)));
		}
		return result;
	}

	private Tactic tactic(JSONObject obj) {
		String tag = obj.getString("tag");
		switch (tag) {
			case "Intro":
				return new Intro(TermJsonReader.strings(obj.getJSONArray("names")));
			case "Apply":
				return new Apply(term(obj, "term"));
			case "Rewrite":
				return new Rewrite(term(obj, "term"),
						"rtl".equals(obj.optString("direction", "ltr")) ? Rewrite.Direction.RTL : Rewrite.Direction.LTR);
			case "Induction":
				return new Induction(obj.getString("name"));
			case "Cases":
				return new Cases(term(obj, "term"));
			case "Simp":
				return new Simp(obj.has("lemmas") ? TermJsonReader.strings(obj.getJSONArray("lemmas")) : Collections.emptyList());
			case "Omega":
				return new Omega();
			case "Sorry":
				return new Sorry();
			case "Auto":
				return new Auto(obj.getInt("depth"));
			case "Seq":
				return new Seq(tactics(obj.getJSONArray("tactics")));
			case "Alt":
				return new Alt(tactics(obj.getJSONArray("tactics")));
			case "Exact":
				return new Exact(term(obj, "term"));
			case "Ring":
				return new Ring();
			case "LLMSuggest":
				return new LLMSuggest(obj.getString("context"));
			default:
				throw new JSONException("unknown tactic tag " + tag);
		}
	}
}
