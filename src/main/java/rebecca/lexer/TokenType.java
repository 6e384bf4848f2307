package rebecca.lexer;

/**
 * Logically different token types.
 *
 * For example '|' and '||' are different tokens with different meanings.
 */
public enum TokenType {

	UNKNOWN(null),
	LEFT_PARENTHESIS("("),
	RIGHT_PARENTHESIS(")"),
	LEFT_BRACKET("["),
	RIGHT_BRACKET("]"),
	LEFT_BRACE("{"),
	RIGHT_BRACE("}"),
	COLON(":"),
	SEMICOLON(";"),
	DOT("."),
	COMMA(","),
	DOUBLE_QUOTE("\""),
	SINGLE_QUOTE("'"),
	STAR("*"),
	SLASH("/"),
	BACK_SLASH("\\"),
	PERCENT("%"),
	HASHTAG("#"),
	PLUS("+"),
	PLUSPLUS("++"),
	MINUS("-"),
	LL("<<"),
	GG(">>"),
	PIPE("|"),
	PIPEPIPE("||"),
	CARET("^"),
	TILDE("~"),
	QUESTION("?"),
	EXCLAMATION("!"),
	EQ("="),
	L("<"),
	G(">"),
	LEQ("<="),
	GEQ(">="),
	EQEQ("=="),
	EXCLAMATION_EQ("!="),
	COMP("<=>"),
	BREAK("break"),
	CONTINUE("continue"),
	CLASS("class"),
	STRUCT("struct"),
	ELSE("_else"),
	FALSE("false"),
	CYCLE("cycle"),
	IF("if"),
	LOAD("load"),
	NULL("null"),
	RETURN("return"),
	STATIC("static"),
	THIS("this"),
	TRUE("true"),
	PRIVATE("private"),
	PUBLIC("public"),
	UNDERLINE("_"),
	/** any name of a variable, function, class, ... */
	NAME(null),
	/** any integer number, e.g. 123 */
	NUMBER(null),
	/** end of input */
	EOF("EOF");

	private final String lexeme;

	TokenType(String lexeme) {
		this.lexeme = lexeme;
	}

	/**
	 * Fixed spelling of this token in the source code, {@code null} for names, numbers and unknown tokens.
	 */
	public String lexeme(){
		return lexeme;
	}

	/**
	 * Canonical textual rendering of this type, used as the text of synthesized tokens
	 */
	public String canonicalName(){
		return name();
	}
}
