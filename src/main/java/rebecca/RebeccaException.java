package rebecca;

/**
 * Base class of all errors raised by the Rebecca frontend.
 */
public class RebeccaException extends RuntimeException {

	public RebeccaException(String message) {
		super(message);
	}

	public RebeccaException(String message, Throwable cause) {
		super(message, cause);
	}
}
