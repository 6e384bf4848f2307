package rebecca.lexer;

import rebecca.RebeccaException;

/**
 * Malformed source code.
 */
public class LexerError extends RebeccaException {

	public final Location location;

	public LexerError(Location location, String message) {
		super(String.format("%s at %s", message, location));
		this.location = location;
	}

	public static LexerError malformedNumber(String word, Location location){
		return new LexerError(location, String.format("Malformed number \"%s\"", word));
	}
}
