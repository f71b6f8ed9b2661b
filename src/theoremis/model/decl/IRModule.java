package theoremis.model.decl;

import theoremis.model.term.AxiomBundle;

import java.util.Collections;
import java.util.List;

/**
 * A collection of declarations checked and emitted together under one axiom bundle.
 */
public class IRModule {
	private final String name;
	private final List<Declaration> declarations;
	private final AxiomBundle axiomBundle;
	private final List<String> imports;

	public IRModule(String name, List<Declaration> declarations, AxiomBundle axiomBundle, List<String> imports) {
		this.name = name;
		this.declarations = Collections.unmodifiableList(declarations);
		this.axiomBundle = axiomBundle;
		this.imports = Collections.unmodifiableList(imports);
	}

	public String getName() {
		return name;
	}

	public List<Declaration> getDeclarations() {
		return declarations;
	}

	public AxiomBundle getAxiomBundle() {
		return axiomBundle;
	}

	public List<String> getImports() {
		return imports;
	}
}
