package euclid;

import java.util.logging.Logger;

import euclid.check.ProofValidator;
import euclid.errors.ParsingIssue;
import euclid.errors.TopLevelIssueContext;
import euclid.lexer.ProofLexerException;
import euclid.model.Proof;
import euclid.parser.ParseFailureException;
import euclid.parser.ProofParser;

/**
 * Reads and validates a proof in one go. Holds no state, so any number of
 * proofs may be checked concurrently.
 */
public class ProofChecker {
	private static final Logger logger = Logger.getLogger(ProofChecker.class.getName());

	private ProofChecker() {}

	public static Verdict check(String text) {
		final Proof proof;
		try {
			logger.fine("Parsing proof");
			proof = ProofParser.readProof(text);
		} catch (ProofLexerException | ParseFailureException e) {
			logger.fine(() -> "Parsing failed: " + e.getMessage());
			return Verdict.rejected(new ParsingIssue(e));
		}

		logger.fine("Validating proof");
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		ProofValidator.perform(ctx, proof);
		if (ctx.hasErrors()) {
			return Verdict.rejected(ctx.getFirstIssue());
		}
		return Verdict.accepted();
	}
}
