package euclid;

import org.plumelib.options.Option;
import org.plumelib.options.Options;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public class EuclidOptions {
	public static final String VERSION = "0.1.0";

	/** Stands for standard input in the list of proof files. */
	public static final String STDIN = "-";

	@Option(value = "Print the version and exit", aliases = {"-version"})
	public boolean version = false;

	@Option(value = "-h Print usage information", aliases = {"-help"})
	public boolean help = false;

	@Option(value = "-q Only log warnings and errors", aliases = {"-quiet"})
	public boolean quiet = false;

	/**
	 * Log every clause as it is checked. Sets the log level to FINE.
	 */
	@Option(value = "-v Log every clause as it is checked", aliases = {"-verbose"})
	public boolean verbose = false;

	@Option(value = "-j Print each verdict as a JSON object", aliases = {"-json"})
	public boolean json = false;

	@Option(value = "-c Show the offending source line under each error", aliases = {"-context"})
	public boolean context = false;

	private List<String> inputPaths = Collections.emptyList();

	private final Options plumeOptions;

	public EuclidOptions() {
		plumeOptions = new Options("euclid [options] [proof-file ...]", this);
	}

	public void printHelp() {
		plumeOptions.printUsage();
	}

	/**
	 * @throws EuclidOptionException if the arguments are not understood
	 */
	public void parse(String[] args) throws EuclidOptionException {
		// a bare "-" names standard input; keep it away from the option parser
		List<String> optionArgs = new ArrayList<>();
		int stdinPosition = -1;
		int positional = 0;
		for (String arg : args) {
			if (arg.equals(STDIN)) {
				if (stdinPosition < 0) {
					stdinPosition = positional;
				}
			} else {
				if (!arg.startsWith("-")) {
					++positional;
				}
				optionArgs.add(arg);
			}
		}

		String[] remainingArgs;
		try {
			remainingArgs = plumeOptions.parse(optionArgs.toArray(new String[0]));
		} catch (Options.ArgException e) {
			throw new EuclidOptionException(e.getMessage());
		}

		if (quiet && verbose) {
			throw new EuclidOptionException("--quiet and --verbose cannot be used together");
		}

		inputPaths = new ArrayList<>(Arrays.asList(remainingArgs));
		if (stdinPosition >= 0) {
			inputPaths.add(Math.min(stdinPosition, inputPaths.size()), STDIN);
		}
		if (inputPaths.isEmpty()) {
			inputPaths = Collections.singletonList(STDIN);
		}
	}

	/**
	 * @return the proof files to check, in order; {@link #STDIN} for standard input
	 */
	public List<String> getInputPaths() {
		return inputPaths;
	}

	/**
	 * Sets the level of the given logger, which should be the parent of every
	 * logger in the checker, from the -q and -v flags.
	 */
	public void configureLogging(Logger logger) {
		logger.setUseParentHandlers(logger.getHandlers().length == 0);
		if (quiet) {
			logger.setLevel(Level.WARNING);
		} else if (verbose) {
			logger.setLevel(Level.FINE);
			// the default console handler drops anything below INFO
			if (logger.getHandlers().length == 0) {
				Handler handler = new ConsoleHandler();
				handler.setLevel(Level.FINE);
				logger.addHandler(handler);
			}
			logger.setUseParentHandlers(false);
		} else {
			logger.setLevel(Level.INFO);
		}
	}
}
