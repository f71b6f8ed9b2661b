package theoremis.formatters;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

public class FormattingTools {

	private FormattingTools() {}

	public interface Formatter<T> {
		void format(T item) throws IOException;
	}

	public static <T> void writeSeparated(Writer out, String separator, List<T> items, Formatter<T> formatter)
			throws IOException {
		boolean first = true;
		for (T item : items) {
			if (!first) {
				out.write(separator);
			}
			first = false;
			formatter.format(item);
		}
	}

	public static <T> void writeCommaSeparated(Writer out, List<T> items, Formatter<T> formatter) throws IOException {
		writeSeparated(out, ", ", items, formatter);
	}
}
