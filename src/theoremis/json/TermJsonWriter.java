package theoremis.json;

import org.json.JSONArray;
import org.json.JSONObject;
import theoremis.model.term.*;

/**
 * Produces the tagged JSON shape read by {@link TermJsonReader}.
 */
public class TermJsonWriter extends TermVisitor<JSONObject, RuntimeException> {

	public static JSONObject write(Term term) {
		return term.accept(new TermJsonWriter());
	}

	private static JSONObject tagged(String tag) {
		return new JSONObject().put("tag", tag);
	}

	private JSONObject binder(String tag, String param, String domainKey, Term domain, Term body) {
		return tagged(tag)
				.put("param", param)
				.put(domainKey, domain.accept(this))
				.put("body", body.accept(this));
	}

	@Override
	public JSONObject visit(Var var) {
		return tagged("Var").put("name", var.getName());
	}

	@Override
	public JSONObject visit(Lam lam) {
		return binder("Lam", lam.getParam(), "paramType", lam.getParamType(), lam.getBody());
	}

	@Override
	public JSONObject visit(App app) {
		return tagged("App").put("func", app.getFunc().accept(this)).put("arg", app.getArg().accept(this));
	}

	@Override
	public JSONObject visit(Pi pi) {
		return binder("Pi", pi.getParam(), "paramType", pi.getParamType(), pi.getBody());
	}

	@Override
	public JSONObject visit(Sigma sigma) {
		return binder("Sigma", sigma.getParam(), "paramType", sigma.getParamType(), sigma.getBody());
	}

	@Override
	public JSONObject visit(Pair pair) {
		return tagged("Pair").put("fst", pair.getFst().accept(this)).put("snd", pair.getSnd().accept(this));
	}

	@Override
	public JSONObject visit(Proj proj) {
		return tagged("Proj").put("term", proj.getTerm().accept(this)).put("index", proj.getIndex());
	}

	@Override
	public JSONObject visit(LetIn letIn) {
		return tagged("LetIn")
				.put("name", letIn.getName())
				.put("type", letIn.getType().accept(this))
				.put("value", letIn.getValue().accept(this))
				.put("body", letIn.getBody().accept(this));
	}

	@Override
	public JSONObject visit(Sort sort) {
		Universe universe = sort.getUniverse();
		JSONObject u = universe.isProp()
				? tagged("Prop")
				: tagged("Type").put("level", universe.getLevel());
		return tagged("Sort").put("universe", u);
	}

	@Override
	public JSONObject visit(Ind ind) {
		JSONArray constructors = new JSONArray();
		for (Constructor c : ind.getConstructors()) {
			constructors.put(new JSONObject().put("name", c.getName()).put("type", c.getType().accept(this)));
		}
		return tagged("Ind")
				.put("name", ind.getName())
				.put("type", ind.getType().accept(this))
				.put("constructors", constructors);
	}

	@Override
	public JSONObject visit(Match match) {
		JSONArray cases = new JSONArray();
		for (MatchCase c : match.getCases()) {
			cases.put(new JSONObject()
					.put("pattern", c.getPattern())
					.put("bindings", new JSONArray(c.getBindings()))
					.put("body", c.getBody().accept(this)));
		}
		return tagged("Match").put("scrutinee", match.getScrutinee().accept(this)).put("cases", cases);
	}

	@Override
	public JSONObject visit(Hole hole) {
		JSONObject obj = tagged("Hole").put("id", hole.getId());
		hole.getAnnotation().ifPresent(a -> obj.put("context", a));
		return obj;
	}

	@Override
	public JSONObject visit(AxiomRef axiomRef) {
		return tagged("AxiomRef").put("axiom", axiomRef.getAxiom().name());
	}

	@Override
	public JSONObject visit(Literal literal) {
		return tagged("Literal").put("kind", literal.getKind().name()).put("value", literal.getValue());
	}

	@Override
	public JSONObject visit(BinOp binOp) {
		return tagged("BinOp")
				.put("op", binOp.getOperator().getSymbol())
				.put("left", binOp.getLeft().accept(this))
				.put("right", binOp.getRight().accept(this));
	}

	@Override
	public JSONObject visit(UnaryOp unaryOp) {
		return tagged("UnaryOp")
				.put("op", unaryOp.getOperator().getSymbol())
				.put("operand", unaryOp.getOperand().accept(this));
	}

	@Override
	public JSONObject visit(Equiv equiv) {
		JSONObject obj = tagged("Equiv")
				.put("left", equiv.getLeft().accept(this))
				.put("right", equiv.getRight().accept(this));
		equiv.getModulus().ifPresent(m -> obj.put("modulus", m.accept(this)));
		return obj;
	}

	@Override
	public JSONObject visit(ForAll forAll) {
		return binder("ForAll", forAll.getParam(), "domain", forAll.getDomain(), forAll.getBody());
	}

	@Override
	public JSONObject visit(Exists exists) {
		return binder("Exists", exists.getParam(), "domain", exists.getDomain(), exists.getBody());
	}
}
