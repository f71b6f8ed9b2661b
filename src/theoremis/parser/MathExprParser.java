package theoremis.parser;

import theoremis.errors.IssueContext;
import theoremis.errors.TopLevelIssueContext;
import theoremis.lexer.MathLexer;
import theoremis.lexer.MathToken;
import theoremis.lexer.MathTokenType;
import theoremis.model.term.BinaryOperator;
import theoremis.model.term.Literal;
import theoremis.model.term.LiteralKind;
import theoremis.model.term.StandardTypes;
import theoremis.model.term.Term;
import theoremis.model.term.TermHeight;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static theoremis.model.term.TermBuilder.*;

/**
 * Recursive descent parser from LaTeX-flavoured math notation to terms.
 *
 * Precedence, loosest first: quantifiers, ↔, →, ∨, ∧, relations (≡, ∈, ∉, ⊆),
 * comparisons, additive, multiplicative, unary, ^ (right associative),
 * application, atoms.
 *
 * The parser never gives up: on unexpected input it records an issue, skips
 * the offending token and carries on, so every call yields a term.
 */
public class MathExprParser {

	private static final Logger logger = Logger.getLogger(MathExprParser.class.getName());

	public static final int DEFAULT_MAX_DEPTH = 200;
	// matches the kernel's default recursion limit
	public static final int DEFAULT_MAX_TERM_HEIGHT = 1000;

	public static final String EMPTY_HOLE = "empty";
	public static final String NESTING_HOLE = "nesting_too_deep";

	private static final Map<String, Term> DOMAIN_NAMES = new HashMap<>();
	private static final Map<String, Term> BLACKBOARD = new HashMap<>();
	private static final Map<String, String> GREEK = new HashMap<>();

	static {
		DOMAIN_NAMES.put("N", StandardTypes.NAT);
		DOMAIN_NAMES.put("ℕ", StandardTypes.NAT);
		DOMAIN_NAMES.put("Nat", StandardTypes.NAT);
		DOMAIN_NAMES.put("Z", StandardTypes.INT);
		DOMAIN_NAMES.put("ℤ", StandardTypes.INT);
		DOMAIN_NAMES.put("Int", StandardTypes.INT);
		DOMAIN_NAMES.put("R", StandardTypes.REAL);
		DOMAIN_NAMES.put("ℝ", StandardTypes.REAL);
		DOMAIN_NAMES.put("Real", StandardTypes.REAL);
		DOMAIN_NAMES.put("C", StandardTypes.COMPLEX);
		DOMAIN_NAMES.put("ℂ", StandardTypes.COMPLEX);
		DOMAIN_NAMES.put("Complex", StandardTypes.COMPLEX);
		DOMAIN_NAMES.put("true", bool(true));
		DOMAIN_NAMES.put("false", bool(false));

		BLACKBOARD.put("N", StandardTypes.NAT);
		BLACKBOARD.put("Z", StandardTypes.INT);
		BLACKBOARD.put("R", StandardTypes.REAL);
		BLACKBOARD.put("C", StandardTypes.COMPLEX);

		String[][] greek = {
				{"alpha", "α"}, {"beta", "β"}, {"gamma", "γ"}, {"delta", "δ"},
				{"epsilon", "ε"}, {"varepsilon", "ε"}, {"zeta", "ζ"}, {"eta", "η"},
				{"theta", "θ"}, {"vartheta", "θ"}, {"iota", "ι"}, {"kappa", "κ"},
				{"lambda", "λ"}, {"mu", "μ"}, {"nu", "ν"}, {"xi", "ξ"}, {"pi", "π"},
				{"rho", "ρ"}, {"sigma", "σ"}, {"tau", "τ"}, {"upsilon", "υ"},
				{"phi", "φ"}, {"varphi", "φ"}, {"chi", "χ"}, {"psi", "ψ"}, {"omega", "ω"},
				{"Gamma", "Γ"}, {"Delta", "Δ"}, {"Theta", "Θ"}, {"Lambda", "Λ"},
				{"Xi", "Ξ"}, {"Sigma", "Σ"}, {"Phi", "Φ"}, {"Psi", "Ψ"}, {"Omega", "Ω"},
		};
		for (String[] letter : greek) {
			GREEK.put("\\" + letter[0], letter[1]);
		}
	}

	private final List<MathToken> tokens;
	private final IssueContext ctx;
	private final int maxDepth;
	private int pos = 0;
	private int depth = 0;
	private boolean abandoned = false;

	public MathExprParser(List<MathToken> tokens, IssueContext ctx, int maxDepth) {
		this.tokens = tokens;
		this.ctx = ctx;
		this.maxDepth = maxDepth;
	}

	public static ParseResult parse(String input) {
		return parse(input, DEFAULT_MAX_DEPTH);
	}

	/**
	 * Parses one expression. Surrounding {@code $} or {@code $$} delimiters are
	 * ignored; input that is empty apart from them yields the hole {@code ?empty}.
	 */
	public static ParseResult parse(String input, int maxDepth) {
		return parse(input, maxDepth, DEFAULT_MAX_TERM_HEIGHT);
	}

	/**
	 * As {@link #parse(String, int)}, also rejecting a result that nests more
	 * than {@code maxTermHeight} terms deep. Operator chains build such terms
	 * without deep grammar nesting; they come back as the nesting hole.
	 */
	public static ParseResult parse(String input, int maxDepth, int maxTermHeight) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		String cleaned = input.trim().replace("$", "").trim();
		if (cleaned.isEmpty()) {
			return new ParseResult(hole(EMPTY_HOLE), ctx.getIssues());
		}
		List<MathToken> tokens = MathLexer.tokenize(cleaned);
		logger.fine(() -> "tokenized " + tokens.size() + " token(s) from: " + cleaned);
		Term term = new MathExprParser(tokens, ctx, maxDepth).parseComplete();
		if (TermHeight.exceeds(term, maxTermHeight)) {
			ctx.error(new ExpressionTooDeepIssue(maxTermHeight));
			term = hole(NESTING_HOLE);
		}
		return new ParseResult(term, ctx.getIssues());
	}

	/**
	 * Parses an expression that must span all of the tokens.
	 */
	public Term parseComplete() {
		Term term = parseExpression();
		if (!isAtEnd()) {
			ctx.error(new TrailingInputIssue(peek()));
		}
		return term;
	}

	// token helpers

	private MathToken peek() {
		return tokens.get(Math.min(pos, tokens.size() - 1));
	}

	private MathToken peekAhead(int n) {
		return tokens.get(Math.min(pos + n, tokens.size() - 1));
	}

	private MathToken advance() {
		MathToken tok = peek();
		if (tok.getType() != MathTokenType.EOF) {
			pos++;
		}
		return tok;
	}

	private boolean isAtEnd() {
		return peek().getType() == MathTokenType.EOF;
	}

	private void expect(MathTokenType type) {
		MathToken tok = peek();
		if (tok.getType() == type) {
			advance();
			return;
		}
		if (!abandoned) {
			ctx.error(new UnexpectedTokenIssue(type.name(), tok));
		}
		advance();
	}

	private boolean match(MathTokenType type) {
		if (peek().getType() == type) {
			advance();
			return true;
		}
		return false;
	}

	private boolean matchCommand(String... commands) {
		for (String command : commands) {
			if (peek().is(MathTokenType.COMMAND, command)) {
				advance();
				return true;
			}
		}
		return false;
	}

	private boolean matchSymbol(String symbol) {
		if (peek().is(MathTokenType.IDENT, symbol)) {
			advance();
			return true;
		}
		return false;
	}

	/**
	 * Enters a recursive grammar rule. Past the depth limit the rest of the input
	 * is abandoned and the caller must return a hole.
	 */
	private boolean descend() {
		if (abandoned) {
			return false;
		}
		if (depth >= maxDepth) {
			ctx.error(new NestingTooDeepIssue(maxDepth, peek().getPosition()));
			abandoned = true;
			pos = tokens.size() - 1;
			return false;
		}
		depth++;
		return true;
	}

	// grammar

	public Term parseExpression() {
		return parseQuantifier();
	}

	private Term parseQuantifier() {
		if (!descend()) {
			return hole(NESTING_HOLE);
		}
		try {
			MathToken tok = peek();
			boolean forAll = tok.is(MathTokenType.COMMAND, "\\forall") || tok.is(MathTokenType.IDENT, "∀");
			boolean exists = tok.is(MathTokenType.COMMAND, "\\exists") || tok.is(MathTokenType.IDENT, "∃");
			if (!forAll && !exists) {
				return parseIff();
			}
			advance();
			String param = parseIdent();
			Term domain = StandardTypes.TYPE0;
			if (matchCommand("\\in") || matchSymbol("∈")) {
				domain = parseComparison();
			}
			match(MathTokenType.COMMA);
			Term body = parseQuantifier();
			return forAll ? forAll(param, domain, body) : exists(param, domain, body);
		} finally {
			depth--;
		}
	}

	private Term parseIff() {
		Term left = parseImplication();
		while (matchCommand("\\iff", "\\Leftrightarrow") || matchSymbol("↔")) {
			left = binOp(BinaryOperator.IFF, left, parseImplication());
		}
		return left;
	}

	private Term parseImplication() {
		Term left = parseDisjunction();
		while (matchCommand("\\implies", "\\Rightarrow", "\\to") || matchSymbol("→")) {
			left = binOp(BinaryOperator.IMPLIES, left, parseDisjunction());
		}
		return left;
	}

	private Term parseDisjunction() {
		Term left = parseConjunction();
		while (matchCommand("\\lor", "\\vee") || matchSymbol("∨")) {
			left = binOp(BinaryOperator.OR, left, parseConjunction());
		}
		return left;
	}

	private Term parseConjunction() {
		Term left = parseRelation();
		while (matchCommand("\\land", "\\wedge") || matchSymbol("∧")) {
			left = binOp(BinaryOperator.AND, left, parseRelation());
		}
		return left;
	}

	private Term parseRelation() {
		Term left = parseComparison();
		if (matchCommand("\\equiv") || matchSymbol("≡")) {
			Term right = parseComparison();
			Term modulus = parseModulus();
			return modulus == null ? equiv(left, right) : equiv(left, right, modulus);
		}
		if (matchCommand("\\in") || matchSymbol("∈")) {
			return binOp(BinaryOperator.IN, left, parseComparison());
		}
		if (matchCommand("\\notin") || matchSymbol("∉")) {
			return binOp(BinaryOperator.NOT_IN, left, parseComparison());
		}
		if (matchCommand("\\subseteq", "\\subset") || matchSymbol("⊆")) {
			return binOp(BinaryOperator.SUBSET, left, parseComparison());
		}
		return left;
	}

	/**
	 * \pmod{m} or (\bmod m) after a congruence; null when neither follows.
	 */
	private Term parseModulus() {
		if (matchCommand("\\pmod")) {
			expect(MathTokenType.LBRACE);
			Term modulus = parseAdditive();
			expect(MathTokenType.RBRACE);
			return modulus;
		}
		if (peek().getType() == MathTokenType.LPAREN && peekAhead(1).is(MathTokenType.COMMAND, "\\bmod")) {
			advance();
			advance();
			Term modulus = parseAdditive();
			expect(MathTokenType.RPAREN);
			return modulus;
		}
		return null;
	}

	private Term parseComparison() {
		Term left = parseAdditive();
		if (match(MathTokenType.EQUALS)) {
			return binOp(BinaryOperator.EQ, left, parseAdditive());
		}
		if (matchCommand("\\leq", "\\le") || matchSymbol("≤")) {
			return binOp(BinaryOperator.LEQ, left, parseAdditive());
		}
		if (matchCommand("\\geq", "\\ge") || matchSymbol("≥")) {
			return binOp(BinaryOperator.GEQ, left, parseAdditive());
		}
		if (match(MathTokenType.LT)) {
			return binOp(BinaryOperator.LT, left, parseAdditive());
		}
		if (match(MathTokenType.GT)) {
			return binOp(BinaryOperator.GT, left, parseAdditive());
		}
		return left;
	}

	private Term parseAdditive() {
		Term left = parseMultiplicative();
		while (true) {
			if (match(MathTokenType.PLUS)) {
				left = binOp(BinaryOperator.ADD, left, parseMultiplicative());
			} else if (match(MathTokenType.MINUS)) {
				left = binOp(BinaryOperator.SUB, left, parseMultiplicative());
			} else if (matchCommand("\\cup")) {
				left = binOp(BinaryOperator.UNION, left, parseMultiplicative());
			} else if (matchCommand("\\cap")) {
				left = binOp(BinaryOperator.INTERSECTION, left, parseMultiplicative());
			} else {
				return left;
			}
		}
	}

	private Term parseMultiplicative() {
		Term left = parseUnary();
		while (true) {
			if (match(MathTokenType.STAR) || matchCommand("\\cdot", "\\times")) {
				left = binOp(BinaryOperator.MUL, left, parseUnary());
			} else if (match(MathTokenType.SLASH) || matchCommand("\\div")) {
				left = binOp(BinaryOperator.DIV, left, parseUnary());
			} else if (matchCommand("\\mod", "\\bmod")) {
				left = binOp(BinaryOperator.MOD, left, parseUnary());
			} else {
				return left;
			}
		}
	}

	private Term parseUnary() {
		if (!descend()) {
			return hole(NESTING_HOLE);
		}
		try {
			if (matchCommand("\\neg", "\\lnot") || matchSymbol("¬")) {
				return not(parseUnary());
			}
			if (match(MathTokenType.MINUS)) {
				Term operand = parsePower();
				if (operand instanceof Literal && ((Literal) operand).getKind() == LiteralKind.Nat) {
					operand = new Literal(LiteralKind.Int, ((Literal) operand).getValue());
				}
				return neg(operand);
			}
			return parsePower();
		} finally {
			depth--;
		}
	}

	private Term parsePower() {
		return parsePowerTail(parseApplication());
	}

	private Term parsePowerTail(Term base) {
		if (peek().getType() != MathTokenType.CARET) {
			return base;
		}
		if (!descend()) {
			return hole(NESTING_HOLE);
		}
		try {
			advance();
			Term exponent;
			if (match(MathTokenType.LBRACE)) {
				exponent = parseExpression();
				expect(MathTokenType.RBRACE);
			} else {
				exponent = parseAtom();
			}
			return binOp(BinaryOperator.POW, base, parsePowerTail(exponent));
		} finally {
			depth--;
		}
	}

	private Term parseApplication() {
		Term func = parseAtom();
		// (\bmod m) belongs to an enclosing congruence
		while (peek().getType() == MathTokenType.LPAREN && !peekAhead(1).is(MathTokenType.COMMAND, "\\bmod")) {
			advance();
			func = app(func, parseExpression());
			while (match(MathTokenType.COMMA)) {
				func = app(func, parseExpression());
			}
			expect(MathTokenType.RPAREN);
		}
		return func;
	}

	private Term parseAtom() {
		MathToken tok = peek();
		switch (tok.getType()) {
			case NUMBER:
				advance();
				return number(tok.getValue());
			case IDENT: {
				advance();
				String ident = tok.getValue();
				if (ident.endsWith("_") && peek().getType() == MathTokenType.LBRACE) {
					// x_{ij} names the variable x_ij
					return var(ident + parseBracedText());
				}
				return DOMAIN_NAMES.getOrDefault(ident, var(ident));
			}
			case COMMAND:
				return parseCommand();
			case LPAREN: {
				advance();
				List<Term> items = new ArrayList<>();
				items.add(parseExpression());
				while (match(MathTokenType.COMMA)) {
					items.add(parseExpression());
				}
				expect(MathTokenType.RPAREN);
				Term result = items.get(items.size() - 1);
				for (int i = items.size() - 2; i >= 0; i--) {
					result = pair(items.get(i), result);
				}
				return result;
			}
			case LBRACE: {
				advance();
				Term inner = parseExpression();
				expect(MathTokenType.RBRACE);
				return inner;
			}
			default:
				if (!abandoned) {
					ctx.error(new UnexpectedTokenIssue("expression", tok));
				}
				advance();
				return hole("parse_error_" + tok.getPosition());
		}
	}

	private static Term number(String text) {
		if (text.contains(".")) {
			// decimals keep their text under the Int kind
			return new Literal(LiteralKind.Int, new BigDecimal(text).stripTrailingZeros().toPlainString());
		}
		return nat(new BigInteger(text));
	}

	/**
	 * Consumes {@code _x}, {@code _{...}}, {@code ^x} or {@code ^{...}} when present.
	 */
	private Term parseScript(MathTokenType marker) {
		if (!match(marker)) {
			return null;
		}
		if (match(MathTokenType.LBRACE)) {
			Term script = parseExpression();
			expect(MathTokenType.RBRACE);
			return script;
		}
		return parseAtom();
	}

	private Term parseBraced() {
		expect(MathTokenType.LBRACE);
		Term inner = parseExpression();
		expect(MathTokenType.RBRACE);
		return inner;
	}

	/**
	 * The raw token text between braces, as written by \text{...} and friends.
	 */
	private String parseBracedText() {
		expect(MathTokenType.LBRACE);
		StringBuilder text = new StringBuilder();
		while (peek().getType() != MathTokenType.RBRACE && !isAtEnd()) {
			text.append(advance().getValue());
		}
		expect(MathTokenType.RBRACE);
		return text.toString();
	}

	private Term parseCommand() {
		// scripts and bodies of \sum, \frac and friends parse atoms again
		if (!descend()) {
			return hole(NESTING_HOLE);
		}
		try {
			return parseCommandBody();
		} finally {
			depth--;
		}
	}

	private Term parseCommandBody() {
		MathToken cmd = advance();
		String name = cmd.getValue();
		if (GREEK.containsKey(name)) {
			return var(GREEK.get(name));
		}
		switch (name) {
			case "\\mathbb": {
				expect(MathTokenType.LBRACE);
				MathToken inner = advance();
				expect(MathTokenType.RBRACE);
				return BLACKBOARD.getOrDefault(inner.getValue(), var(inner.getValue()));
			}
			case "\\frac": {
				Term numerator = parseBraced();
				Term denominator = parseBraced();
				return binOp(BinaryOperator.DIV, numerator, denominator);
			}
			case "\\sqrt": {
				if (match(MathTokenType.LBRACKET)) {
					Term index = parseExpression();
					expect(MathTokenType.RBRACKET);
					Term radicand = parseBraced();
					return binOp(BinaryOperator.POW, radicand, binOp(BinaryOperator.DIV, nat(1), index));
				}
				return app(var("sqrt"), parseBraced());
			}
			case "\\sum":
			case "\\prod": {
				Term lower = parseScript(MathTokenType.UNDERSCORE);
				Term upper = parseScript(MathTokenType.CARET);
				Term body = parseMultiplicative();
				Term result = app(var(name.equals("\\sum") ? "Sum" : "Prod"), body);
				if (lower != null) {
					result = app(result, lower);
				}
				if (upper != null) {
					result = app(result, upper);
				}
				return result;
			}
			case "\\int":
				// bounds are not represented
				parseScript(MathTokenType.UNDERSCORE);
				parseScript(MathTokenType.CARET);
				return app(var("Integral"), parseMultiplicative());
			case "\\lim":
				parseScript(MathTokenType.UNDERSCORE);
				return app(var("Limit"), parseMultiplicative());
			case "\\binom": {
				Term n = parseBraced();
				Term k = parseBraced();
				return app(app(var("Binom"), n), k);
			}
			case "\\operatorname": {
				String operator = parseBracedText();
				if (match(MathTokenType.LPAREN)) {
					Term arg = parseExpression();
					expect(MathTokenType.RPAREN);
					return app(var(operator), arg);
				}
				return var(operator);
			}
			case "\\text":
			case "\\mathrm":
			case "\\mathit":
			case "\\mathsf":
			case "\\mathcal":
			case "\\mathfrak":
			case "\\emph":
			case "\\textit":
			case "\\textbf":
				return var(parseBracedText());
			case "\\left": {
				advance();
				Term inner = parseExpression();
				if (matchCommand("\\right")) {
					advance();
				} else if (!abandoned) {
					ctx.error(new UnexpectedTokenIssue("\\right", peek()));
				}
				return inner;
			}
			case "\\right":
				if (!abandoned) {
					ctx.error(new UnexpectedTokenIssue("expression", cmd));
				}
				advance();
				return hole("right_delim");
			case "\\infty":
				return var("∞");
			case "\\ldots":
			case "\\cdots":
			case "\\dots":
				return var("…");
			default:
				String word = name.substring(1);
				return var(word.isEmpty() ? "unknown" : word);
		}
	}

	/**
	 * The name bound by a quantifier. Greek commands bind the glyph their uses
	 * produce.
	 */
	private String parseIdent() {
		MathToken tok = peek();
		if (tok.getType() == MathTokenType.IDENT) {
			advance();
			return tok.getValue();
		}
		if (tok.getType() == MathTokenType.COMMAND) {
			advance();
			return GREEK.getOrDefault(tok.getValue(), tok.getValue().substring(1));
		}
		if (!abandoned) {
			ctx.error(new UnexpectedTokenIssue("identifier", tok));
		}
		advance();
		return ANONYMOUS;
	}
}
