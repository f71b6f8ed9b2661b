package theoremis.parser;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import theoremis.model.term.BinaryOperator;
import theoremis.model.term.Literal;
import theoremis.model.term.LiteralKind;
import theoremis.model.term.StandardTypes;
import theoremis.model.term.Term;
import theoremis.model.term.TermBuilder;

import static theoremis.model.term.TermBuilder.*;

@RunWith(Parameterized.class)
public class MathExprParserTest {

	private static Term add(Term a, Term b) {
		return binOp(BinaryOperator.ADD, a, b);
	}

	private static Term mul(Term a, Term b) {
		return binOp(BinaryOperator.MUL, a, b);
	}

	private static Term pow(Term a, Term b) {
		return binOp(BinaryOperator.POW, a, b);
	}

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{ "42", nat(42) },
				{ "$x$", var("x") },
				{ "", hole(MathExprParser.EMPTY_HOLE) },
				{ "$$ $$", hole(MathExprParser.EMPTY_HOLE) },
				{ "1.50", new Literal(LiteralKind.Int, "1.5") },
				{ "-3", neg(new Literal(LiteralKind.Int, "3")) },
				{ "-x", neg(var("x")) },
				{ "a + b \\cdot c", add(var("a"), mul(var("b"), var("c"))) },
				{ "a - b - c", binOp(BinaryOperator.SUB, binOp(BinaryOperator.SUB, var("a"), var("b")), var("c")) },
				{ "a^{n-1}", pow(var("a"), binOp(BinaryOperator.SUB, var("n"), nat(1))) },
				// exponentiation groups to the right
				{ "2^3^4", pow(nat(2), pow(nat(3), nat(4))) },
				{ "\\frac{a}{b}", binOp(BinaryOperator.DIV, var("a"), var("b")) },
				{ "a \\div b", binOp(BinaryOperator.DIV, var("a"), var("b")) },
				{ "A \\cup B \\cap C", binOp(BinaryOperator.INTERSECTION,
						binOp(BinaryOperator.UNION, var("A"), var("B")), var("C")) },
				{ "a \\bmod n", binOp(BinaryOperator.MOD, var("a"), var("n")) },
				{ "\\sqrt{x}", app(var("sqrt"), var("x")) },
				{ "\\sqrt[3]{x}", pow(var("x"), binOp(BinaryOperator.DIV, nat(1), nat(3))) },
				{ "f(x, y)", app(app(var("f"), var("x")), var("y")) },
				{ "(a, b)", pair(var("a"), var("b")) },
				{ "(a, b, c)", pair(var("a"), pair(var("b"), var("c"))) },
				{ "\\left( a + b \\right)", add(var("a"), var("b")) },
				{ "x_{ij}", var("x_ij") },
				{ "\\alpha + \\beta", add(var("α"), var("β")) },
				{ "\\mathbb{R}", StandardTypes.REAL },
				{ "\\text{Prime}", var("Prime") },
				{ "\\operatorname{gcd}(a)", app(var("gcd"), var("a")) },
				{ "\\binom{n}{k}", app(app(var("Binom"), var("n")), var("k")) },
				{ "\\sum_{i} i", app(app(var("Sum"), var("i")), var("i")) },
				{ "\\infty", var("∞") },
				{ "a = b", binOp(BinaryOperator.EQ, var("a"), var("b")) },
				{ "a \\leq b", binOp(BinaryOperator.LEQ, var("a"), var("b")) },
				{ "a ≥ b", binOp(BinaryOperator.GEQ, var("a"), var("b")) },
				{ "x \\in S", binOp(BinaryOperator.IN, var("x"), var("S")) },
				{ "A \\subseteq B", binOp(BinaryOperator.SUBSET, var("A"), var("B")) },
				{ "\\neg P", TermBuilder.not(var("P")) },
				{ "P \\land Q \\lor R", binOp(BinaryOperator.OR,
						binOp(BinaryOperator.AND, var("P"), var("Q")), var("R")) },
				{ "P \\implies Q \\iff R", binOp(BinaryOperator.IFF,
						binOp(BinaryOperator.IMPLIES, var("P"), var("Q")), var("R")) },
				{ "a \\equiv b", equiv(var("a"), var("b")) },
				{ "a \\equiv b \\pmod{n}", equiv(var("a"), var("b"), var("n")) },
				{ "a \\equiv b (\\bmod m)", equiv(var("a"), var("b"), var("m")) },
				{ "\\forall x \\in \\mathbb{N}, x \\geq 0",
						forAll("x", StandardTypes.NAT, binOp(BinaryOperator.GEQ, var("x"), nat(0))) },
				{ "\\exists n \\in ℤ, n < 0",
						exists("n", StandardTypes.INT, binOp(BinaryOperator.LT, var("n"), nat(0))) },
				{ "\\forall x, P(x)", forAll("x", StandardTypes.TYPE0, app(var("P"), var("x"))) },
				// the bound name matches the glyph its uses produce
				{ "\\forall \\epsilon \\in \\mathbb{R}, \\epsilon = \\epsilon",
						forAll("ε", StandardTypes.REAL, binOp(BinaryOperator.EQ, var("ε"), var("ε"))) },
		});
	}

	String input;
	Term expected;

	public MathExprParserTest(String input, Term expected) {
		this.input = input;
		this.expected = expected;
	}

	@Test
	public void test() {
		ParseResult result = MathExprParser.parse(input);
		assertEquals(Collections.emptyList(), result.getIssues());
		assertThat(result.getTerm(), is(expected));
	}
}
