package theoremis;

import org.plumelib.options.Option;
import org.plumelib.options.Options;
import theoremis.model.term.AxiomBundle;

public class TheoremisOptions {
	public static final String VERSION = "0.3.0";

	@Option(value = "Version", aliases = {"-version"})
	public boolean version = false;

	@Option(value = "-h Print usage information", aliases = {"-help"})
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution", aliases = {"-quiet"})
	public boolean logLvlQuiet = false;

	/**
	 * Be verbose, print kernel and type checker detail. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution", aliases = {"-verbose"})
	public boolean logLvlVerbose = false;

	@Option(value = "-j Print the parsed term as JSON", aliases = {"-json"})
	public boolean json = false;

	@Option(value = "-m Type check an IR module stored as JSON", aliases = {"-module"})
	public String moduleFilePath;

	@Option(value = "-f Read the expression from a file", aliases = {"-file"})
	public String expressionFilePath;

	@Option(value = "-b Axiom bundle to check against", aliases = {"-bundle"})
	public String bundleName;

	@Option(value = "-c path to the configuration file, if any")
	public String configFilePath;

	public String expression;

	// resolved by parse()
	public TheoremisConfig config;
	public AxiomBundle bundle;

	private Options plumeOptions;
	private String[] remainingArgs;

	public void printHelp() {
		plumeOptions.printUsage();
	}

	public TheoremisOptions(String[] args) {
		plumeOptions = new Options("theoremis [options] expression", this);
		remainingArgs = plumeOptions.parseOrUsage(args);
	}

	/**
	 * @return whether the caller should go on, false after -version or -h
	 */
	public boolean parse() throws TheoremisOptionException {
		if (version || help) {
			return false;
		}

		boolean fromFile = moduleFilePath != null || expressionFilePath != null;
		if (moduleFilePath != null && expressionFilePath != null) {
			throw new TheoremisOptionException("-m and -f cannot be combined");
		}
		if (fromFile && remainingArgs.length != 0) {
			throw new TheoremisOptionException("unexpected argument '" + remainingArgs[0] + "'");
		}
		if (!fromFile) {
			if (remainingArgs.length != 1) {
				throw new TheoremisOptionException("expected exactly one expression, got " + remainingArgs.length);
			}
			expression = remainingArgs[0];
		}

		config = configFilePath == null || configFilePath.isEmpty()
				? TheoremisConfig.defaults()
				: TheoremisConfig.read(configFilePath);
		bundle = config.resolveBundle(bundleName != null ? bundleName : config.getAxiomBundle());
		return true;
	}
}
