package euclid.lexer;

import euclid.util.SourceLocatable;
import euclid.util.SourceLocation;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * A single token of proof source. Two tokens are equal when their types and
 * values are, wherever they occur in the source.
 */
public class ProofToken extends SourceLocatable {

	private final String text;
	private final ProofTokenType type;
	private final SourceLocation location;

	public ProofToken(String text, ProofTokenType type, SourceLocation location) {
		this.text = text;
		this.type = type;
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	/**
	 * @return the text this token was scanned from, exactly as written
	 */
	public String getText() {
		return text;
	}

	public ProofTokenType getType() {
		return type;
	}

	/**
	 * @return for NUMBER tokens the literal value, a {@link BigInteger} for integral
	 * literals and a {@link BigDecimal} for literals containing a decimal point;
	 * the token text for everything else
	 */
	public Object getValue() {
		if (type != ProofTokenType.NUMBER) {
			return text;
		}
		if (text.indexOf('.') != -1) {
			return new BigDecimal(text);
		}
		return new BigInteger(text);
	}

	@Override
	public String toString() {
		return "ProofToken [text=" + text + ", type=" + type + ", location=" + location + "]";
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, getValue());
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ProofToken other = (ProofToken) obj;
		return type == other.type && Objects.equals(getValue(), other.getValue());
	}

}
