package euclid;

public class EuclidOptionException extends EuclidException {

	private static final long serialVersionUID = 3218841207452196753L;
	private static final String prefix = "Option Error";

	public EuclidOptionException(String msg) {
		super(prefix, msg);
	}

}
