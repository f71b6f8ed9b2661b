package theoremis.model.term;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Measures how deeply a term nests without recursing, so it is safe on terms
 * too deep for the recursive visitors.
 */
public final class TermHeight {

	private TermHeight() {}

	private static final class Entry {
		final Term term;
		final int height;

		Entry(Term term, int height) {
			this.term = term;
			this.height = height;
		}
	}

	/**
	 * @return whether any path from the root passes through more than
	 *         {@code limit} terms; a leaf has height 1
	 */
	public static boolean exceeds(Term term, int limit) {
		SubtermsVisitor subterms = new SubtermsVisitor();
		Deque<Entry> pending = new ArrayDeque<>();
		pending.push(new Entry(term, 1));
		while (!pending.isEmpty()) {
			Entry entry = pending.pop();
			if (entry.height > limit) {
				return true;
			}
			for (Term child : entry.term.accept(subterms)) {
				pending.push(new Entry(child, entry.height + 1));
			}
		}
		return false;
	}
}
