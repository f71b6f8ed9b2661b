package theoremis.lexer;

import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A cursor over the characters of one input, advanced by matching patterns at
 * the current offset.
 */
public class MathLexicalContext {

	private final CharSequence chars;
	private int index = 0;

	public MathLexicalContext(CharSequence chars) {
		this.chars = chars;
	}

	/**
	 * Attempts to match {@code pattern} at the current offset, consuming the match on success.
	 */
	public Optional<MatchResult> matchPattern(Pattern pattern) {
		Matcher m = pattern.matcher(chars);
		m.region(index, chars.length());
		if (m.lookingAt()) {
			index = m.end();
			return Optional.of(m.toMatchResult());
		}
		return Optional.empty();
	}

	public char peek() {
		return chars.charAt(index);
	}

	public void skip() {
		index++;
	}

	public int getIndex() {
		return index;
	}

	public boolean isEOF() {
		return index >= chars.length();
	}
}
