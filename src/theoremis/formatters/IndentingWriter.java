package theoremis.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A Writer that prefixes every line after a newline with the current indentation.
 * Lines are always separated by '\n' so that rendered terms do not depend on the
 * platform.
 */
public class IndentingWriter extends Writer {
	public static final int DEFAULT_INDENT = 2;

	private final Writer out;
	private final int defaultIndent;
	private int indent = 0;
	private boolean atLineStart = false;

	/**
	 * Undoes an indentation step when closed, for use in try-with-resources.
	 */
	public static class Indent implements AutoCloseable {
		private final IndentingWriter writer;
		private final int spaces;

		private Indent(IndentingWriter writer, int spaces) {
			this.writer = writer;
			this.spaces = spaces;
		}

		@Override
		public void close() {
			writer.unindent(spaces);
		}
	}

	public IndentingWriter(Writer out) {
		this(out, DEFAULT_INDENT);
	}

	public IndentingWriter(Writer out, int defaultIndent) {
		this.out = out;
		this.defaultIndent = defaultIndent;
	}

	public Indent indent() {
		return indent(defaultIndent);
	}

	public Indent indent(int spaces) {
		indent += spaces;
		return new Indent(this, spaces);
	}

	private void unindent(int spaces) {
		if (spaces > indent) {
			throw new IllegalStateException("can't unindent below 0");
		}
		indent -= spaces;
	}

	public void newLine() throws IOException {
		write('\n');
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		for (int i = offset; i < offset + len; i++) {
			char c = chars[i];
			if (atLineStart && c != '\n') {
				for (int j = 0; j < indent; j++) {
					out.write(' ');
				}
				atLineStart = false;
			}
			out.write(c);
			if (c == '\n') {
				atLineStart = true;
			}
		}
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	@Override
	public void close() throws IOException {
		out.close();
	}
}
