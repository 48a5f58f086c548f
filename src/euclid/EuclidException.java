package euclid;

import euclid.util.SourceLocation;

/**
 * A Euclid exception consisting of a prefix (the kind of error), a message and
 * the location in the proof source it refers to, if any.
 */
public abstract class EuclidException extends RuntimeException {
	private final String msg;
	private final String prefix;
	private final SourceLocation location;

	public EuclidException(String prefix, String msg) {
		this(prefix, msg, SourceLocation.unknown());
	}

	public EuclidException(String prefix, String msg, SourceLocation location) {
		super(prefix + ": " + msg + (location.isUnknown() ? "" : " " + location.prettyString()));
		this.prefix = prefix;
		this.msg = msg;
		this.location = location;
	}

	public String getMsg() {
		return msg;
	}

	public String getPrefix() {
		return prefix;
	}

	public SourceLocation getLocation() {
		return location;
	}
}
