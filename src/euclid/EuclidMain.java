package euclid;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.json.JSONObject;
import euclid.util.SourceLocation;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Command line front end: reads each proof named on the command line (or
 * standard input), checks it and reports the verdict.
 *
 * Every input is checked even when an earlier one could not be read or was
 * rejected; only an internal error stops the run. Exit codes: {@link #EXIT_OK}
 * when every proof was accepted, {@link #EXIT_USAGE} for bad arguments or any
 * unreadable input, {@link #EXIT_REJECTED} when some proof was rejected and
 * {@link #EXIT_INTERNAL} when the checker itself failed.
 */
public class EuclidMain {
	public static final int EXIT_OK = 0;
	public static final int EXIT_USAGE = 1;
	public static final int EXIT_REJECTED = 2;
	public static final int EXIT_INTERNAL = 3;

	static final String ACCEPTED_MESSAGE = "No errors were detected in the proof.";

	// parent of every logger in the checker
	private static final Logger logger = Logger.getLogger("euclid");

	private final String[] cmdArgs;
	private final InputStream in;
	private final PrintStream out;
	private final PrintStream err;

	public EuclidMain(String[] args) {
		this(args, System.in, System.out, System.err);
	}

	EuclidMain(String[] args, InputStream in, PrintStream out, PrintStream err) {
		this.cmdArgs = args;
		this.in = in;
		this.out = out;
		this.err = err;
	}

	public static void main(String[] args) {
		System.exit(new EuclidMain(args).run());
	}

	// Top-level workhorse method.
	public int run() {
		EuclidOptions opts = new EuclidOptions();
		try {
			opts.parse(cmdArgs);
		} catch (EuclidOptionException e) {
			err.println("Error: " + e.getMsg());
			opts.printHelp();
			return EXIT_USAGE;
		}
		if (opts.help) {
			opts.printHelp();
			return EXIT_OK;
		}
		if (opts.version) {
			out.println("euclid version " + EuclidOptions.VERSION);
			return EXIT_OK;
		}
		opts.configureLogging(logger);

		int exitCode = EXIT_OK;
		int rejected = 0;
		int unreadable = 0;
		for (String path : opts.getInputPaths()) {
			String source = path.equals(EuclidOptions.STDIN) ? "<stdin>" : path;
			final String text;
			try {
				logger.fine(() -> "Reading proof from " + source);
				text = readSource(path);
			} catch (IOException e) {
				logger.severe(() -> "could not read " + source + ": " + e.getMessage());
				err.println("Error: could not read " + source + ": " + e.getMessage());
				++unreadable;
				continue;
			}

			final Verdict verdict;
			try {
				verdict = ProofChecker.check(text);
			} catch (InternalCheckerError | Unreachable e) {
				logger.severe(() -> "internal error while checking " + source + ": " + e.getMessage());
				err.println("Error: " + e.getMessage());
				return EXIT_INTERNAL;
			}

			if (opts.json) {
				out.println(toJSON(source, verdict).toString());
			} else {
				present(opts, source, text, verdict);
			}
			if (!verdict.isAccepted()) {
				++rejected;
				exitCode = EXIT_REJECTED;
			}
		}
		if (opts.getInputPaths().size() > 1) {
			int checked = opts.getInputPaths().size();
			final int rejectedCount = rejected;
			final int unreadableCount = unreadable;
			logger.info(() -> "Checked " + checked + " proof(s), " + rejectedCount + " rejected, " +
					unreadableCount + " unreadable");
		}
		// input that could not be read outranks a rejection
		if (unreadable > 0) {
			return EXIT_USAGE;
		}
		return exitCode;
	}

	private String readSource(String path) throws IOException {
		if (path.equals(EuclidOptions.STDIN)) {
			return IOUtils.toString(in, StandardCharsets.UTF_8);
		}
		return FileUtils.readFileToString(new File(path), StandardCharsets.UTF_8);
	}

	private void present(EuclidOptions opts, String source, String text, Verdict verdict) {
		boolean many = opts.getInputPaths().size() > 1;
		if (verdict.isAccepted()) {
			out.println((many ? source + ": " : "") + ACCEPTED_MESSAGE);
			return;
		}
		StringBuilder message = new StringBuilder("Error: ");
		if (many) {
			message.append(source).append(": ");
		}
		message.append(verdict.getMessage().orElse("the proof was rejected"));
		Optional<SourceLocation> location = verdict.getLocation();
		location.ifPresent(loc -> message.append(" ").append(loc.prettyString()));
		err.println(message);
		if (opts.context && location.isPresent()) {
			err.println(location.get().contextString(text));
		}
	}

	static JSONObject toJSON(String source, Verdict verdict) {
		JSONObject result = new JSONObject();
		result.put("source", source);
		result.put("accepted", verdict.isAccepted());
		verdict.getMessage().ifPresent(message -> result.put("message", message));
		verdict.getLocation().ifPresent(location -> {
			result.put("line", location.getStartLine());
			result.put("column", location.getStartColumn());
		});
		return result;
	}
}
