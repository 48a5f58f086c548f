package euclid.model;

import java.math.BigDecimal;
import java.math.BigInteger;

import euclid.util.SourceLocation;

/**
 * A numeric literal. The value is kept as it was written: a {@link BigInteger}
 * for integral literals, a {@link BigDecimal} otherwise. Literals are equal when
 * they denote the same number, so "2" equals "2.0".
 */
public class NumberTerm extends Term {

	private final Number value;
	private final BigDecimal normalized;

	public NumberTerm(SourceLocation location, Number value) {
		super(location);
		this.value = value;
		this.normalized = new BigDecimal(value.toString()).stripTrailingZeros();
	}

	public Number getValue() {
		return value;
	}

	public BigDecimal getDecimalValue() {
		return normalized;
	}

	public boolean isIntegral() {
		return normalized.signum() == 0 || normalized.scale() <= 0;
	}

	/**
	 * @throws ArithmeticException if the literal has a fractional part
	 */
	public BigInteger getIntegerValue() {
		return normalized.toBigIntegerExact();
	}

	@Override
	public <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return normalized.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		NumberTerm other = (NumberTerm) obj;
		return normalized.equals(other.normalized);
	}
}
