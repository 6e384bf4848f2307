package rebecca.ast;

import rebecca.RebeccaException;

/**
 * Violation of the structural contract of the AST engine.
 *
 * Signals a programming error in the code driving the tree construction, the tree can't be used afterwards.
 */
public class AstError extends RebeccaException {

	public AstError(String message) {
		super(message);
	}

	public AstError(String format, Object... args) {
		super(String.format(format, args));
	}
}
