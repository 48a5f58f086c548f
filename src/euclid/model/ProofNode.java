package euclid.model;

import euclid.formatters.ProofNodeFormattingVisitor;
import euclid.util.SourceLocatable;
import euclid.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;

/**
 *
 * The base class for any proof AST node. Every node knows where in the proof
 * source it was written, but locations never take part in equality: two nodes
 * are equal when they have the same shape and the same names and literals.
 *
 */
public abstract class ProofNode extends SourceLocatable {
	private final SourceLocation location;

	public ProofNode(SourceLocation location) {
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	@Override
	public String toString() {
		StringWriter out = new StringWriter();
		try {
			accept(new ProofNodeFormattingVisitor(out));
		} catch (IOException e) {
			throw new RuntimeException("You should never get an IO error from a StringWriter", e);
		}
		return out.toString();
	}

	public abstract <T, E extends Throwable> T accept(ProofNodeVisitor<T, E> v) throws E;

}
