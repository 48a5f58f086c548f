package euclid.util;

/**
 * A common abstract base for tokens and AST nodes, anything that needs to be
 * traced back to where it was written in the proof source.
 */
public abstract class SourceLocatable {

	public abstract SourceLocation getLocation();

}
