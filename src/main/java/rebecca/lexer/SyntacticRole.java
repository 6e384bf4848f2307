package rebecca.lexer;

/**
 * Grammatical function of a token, only used to colorize the AST graphs.
 */
public enum SyntacticRole {
	NONE,
	RULE_NAME,
	RULE_NAME_REFERENCE,
	VAR_NAME,
	VAR_NAME_REFERENCE
}
