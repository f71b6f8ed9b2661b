package theoremis.model.term;

import theoremis.formatters.IndentingWriter;
import theoremis.formatters.TermFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

/**
 * The base class of every λΠω term. Terms are immutable values: every
 * operation of the kernel builds new terms instead of modifying existing ones.
 *
 * equals and hashCode are exact structural comparisons. For equality up to
 * renaming of bound variables see {@link theoremis.kernel.TermEquality}.
 */
public abstract class Term {

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	@Override
	public String toString() {
		StringWriter out = new StringWriter();
		try {
			accept(new TermFormattingVisitor(new IndentingWriter(out)));
		} catch (IOException e) {
			throw new RuntimeException("You should never get an IO error from a StringWriter", e);
		}
		return out.toString();
	}

	public abstract <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E;
}
