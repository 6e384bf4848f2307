package rebecca.lexer;

import java.util.List;

/**
 * A simple interface for a pull lexer.
 */
public interface Lexer {

	/**
	 * Get the current token (calls next() if no token has been read before).
	 */
	Token cur();

	/**
	 * Read another token and return it, returns the EOF token over and over again at the end of the input.
	 */
	Token next();

	/**
	 * Ignores tokens of the passed type in subsequent readings, the end of input token (EOF) can't be ignored.
	 */
	void ignore(TokenType type);

	/**
	 * Reads all remaining tokens, the last one is the EOF token.
	 */
	List<Token> tokenize();
}
