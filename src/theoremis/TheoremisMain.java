package theoremis;

import org.apache.commons.io.FileUtils;
import theoremis.errors.IssueContext;
import theoremis.errors.TopLevelIssueContext;
import theoremis.formatters.ModuleFormatter;
import theoremis.json.ModuleJsonReader;
import theoremis.json.TermJsonWriter;
import theoremis.kernel.Kernel;
import theoremis.model.decl.IRModule;
import theoremis.model.term.Term;
import theoremis.parser.MathExprParser;
import theoremis.parser.ParseResult;
import theoremis.typecheck.Diagnostic;
import theoremis.typecheck.InferenceRecorder;
import theoremis.typecheck.StandardContext;
import theoremis.typecheck.TypeCheckResult;
import theoremis.typecheck.TypeChecker;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public class TheoremisMain {
	private static final String COMMAND_LINE = "command line";

	private static final Logger logger = Logger.getLogger(TheoremisMain.class.getName());

	private final String[] cmdArgs;
	private final PrintStream out;
	private final PrintStream err;

	public TheoremisMain(String[] args, PrintStream out, PrintStream err) {
		this.cmdArgs = args;
		this.out = out;
		this.err = err;
	}

	public static void main(String[] args) {
		if (new TheoremisMain(args, System.out, System.err).run()) {
			logger.info("Finished");
		} else {
			logger.info("Terminated with errors");
			System.exit(1);
		}
	}

	private static TheoremisOptions parseOptions(IssueContext ctx, String[] args) {
		TheoremisOptions opts = new TheoremisOptions(args);
		try {
			if (!opts.parse()) {
				return opts;
			}
		} catch (TheoremisOptionException e) {
			ctx.whileReading(COMMAND_LINE).error(new MalformedInputIssue("options", e.getMsg()));
		}
		// applies to every logger in the project
		Logger projectLogger = Logger.getLogger("theoremis");
		Level level;
		if (opts.logLvlQuiet) {
			level = Level.WARNING;
		} else if (opts.logLvlVerbose) {
			level = Level.FINE;
		} else {
			level = Level.INFO;
		}
		projectLogger.setLevel(level);
		for (Handler handler : Logger.getLogger("").getHandlers()) {
			handler.setLevel(level);
		}
		return opts;
	}

	// Top-level workhorse method.
	public boolean run() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();

		TheoremisOptions opts = parseOptions(ctx, cmdArgs);
		if (ctx.hasErrors()) {
			err.println(ctx.format());
			opts.printHelp();
			return false;
		}
		if (opts.version) {
			out.println("Theoremis version " + TheoremisOptions.VERSION);
			return true;
		}
		if (opts.help) {
			opts.printHelp();
			return true;
		}

		Kernel kernel = new Kernel(opts.config.getMaxTermDepth());
		boolean ok = opts.moduleFilePath != null
				? checkModule(ctx, opts, kernel)
				: checkExpression(ctx, opts, kernel);
		if (ctx.hasErrors()) {
			err.println(ctx.format());
			return false;
		}
		return ok;
	}

	private Optional<String> readFile(IssueContext ctx, String path) {
		logger.info("Opening source file \"" + path + "\"");
		try {
			return Optional.of(FileUtils.readFileToString(new File(path), StandardCharsets.UTF_8));
		} catch (IOException e) {
			ctx.error(new IOErrorIssue(e));
			return Optional.empty();
		}
	}

	private boolean checkExpression(TopLevelIssueContext ctx, TheoremisOptions opts, Kernel kernel) {
		String source = opts.expressionFilePath != null ? opts.expressionFilePath : COMMAND_LINE;
		IssueContext inputCtx = ctx.whileReading(source);
		String input;
		if (opts.expressionFilePath != null) {
			Optional<String> contents = readFile(inputCtx, opts.expressionFilePath);
			if (!contents.isPresent()) {
				return false;
			}
			input = contents.get().trim();
		} else {
			input = opts.expression;
		}

		logger.info("Parsing expression");
		ParseResult result = MathExprParser.parse(input, opts.config.getMaxParseDepth(),
				opts.config.getMaxTermDepth());
		inputCtx.errors(result.getIssues());
		Term term = result.getTerm();
		if (opts.json) {
			out.println(TermJsonWriter.write(term).toString(2));
		} else {
			out.println(term);
		}

		logger.info("Inferring type under axiom bundle " + opts.bundle.getName());
		InferenceRecorder recorder = new InferenceRecorder();
		Optional<Term> type = new TypeChecker(kernel).inferType(StandardContext.create(opts.bundle), term, recorder);
		out.println("type: " + type.map(Term::toString).orElse("(unknown)"));
		for (Diagnostic diagnostic : recorder.getDiagnostics()) {
			out.println(diagnostic);
		}
		return !result.hasIssues() && !recorder.hasErrors();
	}

	private boolean checkModule(TopLevelIssueContext ctx, TheoremisOptions opts, Kernel kernel) {
		IssueContext inputCtx = ctx.whileReading(opts.moduleFilePath);
		Optional<String> contents = readFile(inputCtx, opts.moduleFilePath);
		if (!contents.isPresent()) {
			return false;
		}

		logger.info("Reading IR module");
		Optional<IRModule> module = new ModuleJsonReader(opts.config.getBundles(), opts.config.getMaxTermDepth())
				.read(contents.get());
		if (!module.isPresent()) {
			inputCtx.error(new MalformedInputIssue("IR module",
					"expected an object with a name, an axiom bundle and a list of declarations"));
			return false;
		}

		logger.info("Type checking module " + module.get().getName());
		TypeCheckResult result = new TypeChecker(kernel).typeCheck(module.get());
		out.print(ModuleFormatter.format(module.get()));
		out.println();
		out.println(result.format());
		return result.isValid();
	}
}
