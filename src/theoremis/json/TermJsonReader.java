package theoremis.json;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import theoremis.kernel.DepthGuard;
import theoremis.kernel.Kernel;
import theoremis.kernel.TermTooDeepException;
import theoremis.model.term.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Reads terms from their tagged JSON shape, e.g.
 *
 * {"tag": "App", "func": {"tag": "Var", "name": "f"}, "arg": {"tag": "Literal", "kind": "Nat", "value": "1"}}
 *
 * Reading never throws: anything that is not a well-formed term yields an
 * empty result.
 */
public class TermJsonReader {

	private static final Logger logger = Logger.getLogger(TermJsonReader.class.getName());

	private final int maxDepth;

	public TermJsonReader() {
		this(Kernel.DEFAULT_MAX_DEPTH);
	}

	public TermJsonReader(int maxDepth) {
		this.maxDepth = maxDepth;
	}

	/**
	 * @param json a {@link JSONObject} or JSON text
	 */
	public Optional<Term> read(Object json) {
		if (!(json instanceof String) && !(json instanceof JSONObject)) {
			logger.fine(() -> "rejected term JSON: expected text or an object, got " + json);
			return Optional.empty();
		}
		try {
			JSONObject obj = json instanceof String ? new JSONObject((String) json) : (JSONObject) json;
			return Optional.of(term(obj, new DepthGuard("json", maxDepth)));
		} catch (JSONException | IllegalArgumentException | TermTooDeepException e) {
			logger.fine(() -> "rejected term JSON: " + e.getMessage());
			return Optional.empty();
		}
	}

	Term term(JSONObject obj, DepthGuard guard) {
		guard.enter();
		try {
			return readTagged(obj, guard);
		} finally {
			guard.exit();
		}
	}

	private Term child(JSONObject obj, String key, DepthGuard guard) {
		return term(obj.getJSONObject(key), guard);
	}

	private Term readTagged(JSONObject obj, DepthGuard guard) {
		String tag = obj.getString("tag");
		switch (tag) {
			case "Var":
				return new Var(obj.getString("name"));
			case "Lam":
				return new Lam(obj.getString("param"), child(obj, "paramType", guard), child(obj, "body", guard));
			case "App":
				return new App(child(obj, "func", guard), child(obj, "arg", guard));
			case "Pi":
				return new Pi(obj.getString("param"), child(obj, "paramType", guard), child(obj, "body", guard));
			case "Sigma":
				return new Sigma(obj.getString("param"), child(obj, "paramType", guard), child(obj, "body", guard));
			case "Pair":
				return new Pair(child(obj, "fst", guard), child(obj, "snd", guard));
			case "Proj":
				return new Proj(child(obj, "term", guard), obj.getInt("index"));
			case "LetIn":
				return new LetIn(obj.getString("name"), child(obj, "type", guard), child(obj, "value", guard),
						child(obj, "body", guard));
			case "Sort":
				return new Sort(universe(obj.getJSONObject("universe")));
			case "Ind": {
				List<Constructor> constructors = new ArrayList<>();
				JSONArray array = obj.getJSONArray("constructors");
				for (int i = 0; i < array.length(); i++) {
					JSONObject c = array.getJSONObject(i);
					constructors.add(new Constructor(c.getString("name"), child(c, "type", guard)));
				}
				return new Ind(obj.getString("name"), child(obj, "type", guard), constructors);
			}
			case "Match": {
				List<MatchCase> cases = new ArrayList<>();
				JSONArray array = obj.getJSONArray("cases");
				for (int i = 0; i < array.length(); i++) {
					JSONObject c = array.getJSONObject(i);
					cases.add(new MatchCase(c.getString("pattern"), strings(c.getJSONArray("bindings")),
							child(c, "body", guard)));
				}
				return new Match(child(obj, "scrutinee", guard), cases);
			}
			case "Hole":
				return new Hole(obj.getString("id"), obj.has("context") ? obj.getString("context") : null);
			case "AxiomRef": {
				String name = obj.getString("axiom");
				return new AxiomRef(Axiom.fromName(name)
						.orElseThrow(() -> new JSONException("unknown axiom " + name)));
			}
			case "Literal": {
				String kind = obj.getString("kind");
				return new Literal(LiteralKind.valueOf(kind), obj.getString("value"));
			}
			case "BinOp": {
				String op = obj.getString("op");
				return new BinOp(BinaryOperator.fromSymbol(op)
						.orElseThrow(() -> new JSONException("unknown binary operator " + op)),
						child(obj, "left", guard), child(obj, "right", guard));
			}
			case "UnaryOp": {
				String op = obj.getString("op");
				return new UnaryOp(UnaryOperator.fromSymbol(op)
						.orElseThrow(() -> new JSONException("unknown unary operator " + op)),
						child(obj, "operand", guard));
			}
			case "Equiv":
				if (obj.has("modulus") && !obj.isNull("modulus")) {
					return new Equiv(child(obj, "left", guard), child(obj, "right", guard), child(obj, "modulus", guard));
				}
				return new Equiv(child(obj, "left", guard), child(obj, "right", guard));
			case "ForAll":
				return new ForAll(obj.getString("param"), child(obj, "domain", guard), child(obj, "body", guard));
			case "Exists":
				return new Exists(obj.getString("param"), child(obj, "domain", guard), child(obj, "body", guard));
			default:
				throw new JSONException("unknown term tag " + tag);
		}
	}

	private static Universe universe(JSONObject obj) {
		String tag = obj.getString("tag");
		switch (tag) {
			case "Prop":
				return Universe.prop();
			case "Type":
				return Universe.type(obj.getInt("level"));
			default:
				throw new JSONException("unknown universe " + tag);
		}
	}

	static List<String> strings(JSONArray array) {
		List<String> result = new ArrayList<>();
		for (int i = 0; i < array.length(); i++) {
			result.add(array.getString(i));
		}
		return result;
	}
}
