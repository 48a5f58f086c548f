package euclid.model;

/**
 * The rule a formula clause cites after "BY".
 */
public enum Justification {
	DEFINITION,
	SUBSTITUTION,
}
