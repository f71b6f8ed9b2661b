package theoremis.formatters;

import theoremis.Unreachable;
import theoremis.model.decl.IRModule;
import theoremis.model.term.Axiom;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders a whole module: a comment header naming the module and its axiom
 * bundle, the imports, then each declaration separated by a blank line.
 */
public class ModuleFormatter {

	private ModuleFormatter() {}

	public static void format(IRModule module, IndentingWriter out) throws IOException {
		out.write("-- Module: ");
		out.write(module.getName());
		out.newLine();
		out.write("-- Axiom Bundle: ");
		out.write(module.getAxiomBundle().getName());
		out.newLine();
		out.write("-- Axioms: ");
		List<Axiom> axioms = new ArrayList<>(module.getAxiomBundle().getAxioms());
		if (axioms.isEmpty()) {
			out.write("(none)");
		} else {
			FormattingTools.writeCommaSeparated(out, axioms, a -> out.write(a.name()));
		}
		out.newLine();
		if (!module.getImports().isEmpty()) {
			for (String imported : module.getImports()) {
				out.newLine();
				out.write("import ");
				out.write(imported);
			}
			out.newLine();
		}
		out.newLine();
		FormattingTools.writeSeparated(out, "\n\n", module.getDeclarations(),
				d -> d.accept(new DeclarationFormattingVisitor(out)));
		out.newLine();
	}

	public static String format(IRModule module) {
		StringWriter w = new StringWriter();
		try {
			format(module, new IndentingWriter(w));
		} catch (IOException e) {
			throw new Unreachable("IO error from a StringWriter", e);
		}
		return w.toString();
	}
}
