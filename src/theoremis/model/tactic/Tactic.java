package theoremis.model.tactic;

import theoremis.formatters.IndentingWriter;
import theoremis.formatters.TacticFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A step of a proof script.
 */
public abstract class Tactic {

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	@Override
	public String toString() {
		StringWriter out = new StringWriter();
		try {
			accept(new TacticFormattingVisitor(new IndentingWriter(out)));
		} catch (IOException e) {
			throw new RuntimeException("You should never get an IO error from a StringWriter", e);
		}
		return out.toString();
	}

	public abstract <T, E extends Throwable> T accept(TacticVisitor<T, E> v) throws E;
}
