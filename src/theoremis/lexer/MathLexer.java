package theoremis.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Splits LaTeX-flavoured math notation into tokens. Whitespace, spacing
 * commands such as {@code \,} and unrecognised characters are dropped, so
 * tokenizing never fails. The result always ends with an EOF token.
 */
public class MathLexer {

	private static final Pattern NUMBER = Pattern.compile("[0-9]+(\\.[0-9]+)?");
	private static final Pattern COMMAND = Pattern.compile("\\\\([a-zA-Z]+|.)?", Pattern.DOTALL);
	private static final String IDENT_START = "a-zA-Zα-ωΑ-Ωℕℤℝℂ";
	private static final Pattern IDENT = Pattern.compile("[" + IDENT_START + "][" + IDENT_START + "0-9'_]*");

	// already-Unicode relations and connectives; the parser matches them by value
	private static final String UNICODE_SYMBOLS = "≤≥≡∀∃∈∉⊆∧∨¬→↔";

	private static final Set<String> SPACING_COMMANDS = new HashSet<>();
	private static final Map<Character, MathTokenType> SINGLE_CHARS = new HashMap<>();

	static {
		Collections.addAll(SPACING_COMMANDS, "\\,", "\\;","\\:", "\\!", "\\ ", "\\quad", "\\qquad", "\\\\");

		SINGLE_CHARS.put('{', MathTokenType.LBRACE);
		SINGLE_CHARS.put('}', MathTokenType.RBRACE);
		SINGLE_CHARS.put('(', MathTokenType.LPAREN);
		SINGLE_CHARS.put(')', MathTokenType.RPAREN);
		SINGLE_CHARS.put('[', MathTokenType.LBRACKET);
		SINGLE_CHARS.put(']', MathTokenType.RBRACKET);
		SINGLE_CHARS.put('+', MathTokenType.PLUS);
		SINGLE_CHARS.put('-', MathTokenType.MINUS);
		SINGLE_CHARS.put('*', MathTokenType.STAR);
		SINGLE_CHARS.put('/', MathTokenType.SLASH);
		SINGLE_CHARS.put('^', MathTokenType.CARET);
		SINGLE_CHARS.put('_', MathTokenType.UNDERSCORE);
		SINGLE_CHARS.put('=', MathTokenType.EQUALS);
		SINGLE_CHARS.put('<', MathTokenType.LT);
		SINGLE_CHARS.put('>', MathTokenType.GT);
		SINGLE_CHARS.put(',', MathTokenType.COMMA);
		SINGLE_CHARS.put('|', MathTokenType.PIPE);
		SINGLE_CHARS.put('&', MathTokenType.AMPERSAND);
	}

	private MathLexer() {}

	public static List<MathToken> tokenize(CharSequence input) {
		MathLexicalContext ctx = new MathLexicalContext(input);
		List<MathToken> tokens = new ArrayList<>();
		while (!ctx.isEOF()) {
			int start = ctx.getIndex();
			char c = ctx.peek();
			if (Character.isWhitespace(c)) {
				ctx.skip();
				continue;
			}
			Optional<MatchResult> number = ctx.matchPattern(NUMBER);
			if (number.isPresent()) {
				tokens.add(new MathToken(MathTokenType.NUMBER, number.get().group(), start));
				continue;
			}
			Optional<MatchResult> command = ctx.matchPattern(COMMAND);
			if (command.isPresent()) {
				String value = command.get().group();
				if (!SPACING_COMMANDS.contains(value)) {
					tokens.add(new MathToken(MathTokenType.COMMAND, value, start));
				}
				continue;
			}
			Optional<MatchResult> ident = ctx.matchPattern(IDENT);
			if (ident.isPresent()) {
				tokens.add(new MathToken(MathTokenType.IDENT, ident.get().group(), start));
				continue;
			}
			ctx.skip();
			if (SINGLE_CHARS.containsKey(c)) {
				tokens.add(new MathToken(SINGLE_CHARS.get(c), String.valueOf(c), start));
			} else if (UNICODE_SYMBOLS.indexOf(c) != -1) {
				tokens.add(new MathToken(MathTokenType.IDENT, String.valueOf(c), start));
			}
		}
		tokens.add(new MathToken(MathTokenType.EOF, "", ctx.getIndex()));
		return tokens;
	}
}
