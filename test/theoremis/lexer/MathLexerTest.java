package theoremis.lexer;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

@RunWith(Parameterized.class)
public class MathLexerTest {

	private static MathToken tok(MathTokenType type, String value, int position) {
		return new MathToken(type, value, position);
	}

	private static MathToken ident(String value, int position) {
		return tok(MathTokenType.IDENT, value, position);
	}

	private static MathToken cmd(String value, int position) {
		return tok(MathTokenType.COMMAND, value, position);
	}

	private static MathToken eof(int position) {
		return tok(MathTokenType.EOF, "", position);
	}

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{ "", Arrays.asList(eof(0)) },
				{ "42", Arrays.asList(tok(MathTokenType.NUMBER, "42", 0), eof(2)) },
				{ "3.14", Arrays.asList(tok(MathTokenType.NUMBER, "3.14", 0), eof(4)) },
				{ "a + 1", Arrays.asList(
						ident("a", 0),
						tok(MathTokenType.PLUS, "+", 2),
						tok(MathTokenType.NUMBER, "1", 4),
						eof(5)) },
				{ "x_1'", Arrays.asList(ident("x_1'", 0), eof(4)) },
				{ "\\sum_{i}", Arrays.asList(
						cmd("\\sum", 0),
						tok(MathTokenType.UNDERSCORE, "_", 4),
						tok(MathTokenType.LBRACE, "{", 5),
						ident("i", 6),
						tok(MathTokenType.RBRACE, "}", 7),
						eof(8)) },
				// spacing commands vanish
				{ "\\alpha\\,x", Arrays.asList(cmd("\\alpha", 0), ident("x", 8), eof(9)) },
				{ "a\\quad b", Arrays.asList(ident("a", 0), ident("b", 7), eof(8)) },
				{ "\\{", Arrays.asList(cmd("\\{", 0), eof(2)) },
				{ "ℕ ≤ ∀", Arrays.asList(ident("ℕ", 0), ident("≤", 2), ident("∀", 4), eof(5)) },
				{ "αβ", Arrays.asList(ident("αβ", 0), eof(2)) },
				// unknown characters are dropped
				{ "a ? b", Arrays.asList(ident("a", 0), ident("b", 4), eof(5)) },
				{ "f(x, y)", Arrays.asList(
						ident("f", 0),
						tok(MathTokenType.LPAREN, "(", 1),
						ident("x", 2),
						tok(MathTokenType.COMMA, ",", 3),
						ident("y", 5),
						tok(MathTokenType.RPAREN, ")", 6),
						eof(7)) },
		});
	}

	String input;
	List<MathToken> expected;

	public MathLexerTest(String input, List<MathToken> expected) {
		this.input = input;
		this.expected = expected;
	}

	@Test
	public void test() {
		assertThat(MathLexer.tokenize(input), is(expected));
	}
}
