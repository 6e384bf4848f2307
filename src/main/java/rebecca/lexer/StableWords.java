package rebecca.lexer;

import java.util.*;

/**
 * Fixed lexemes of the language: keywords and operators.
 */
public final class StableWords {

	/**
	 * Symbols that split words in the source code
	 */
	public static final String SPLIT_SYMBOLS = "()[]{}:;.,*/\\%#+-<>|^~?!=\"'";

	public static final String WHITESPACE = " \n\t\r";

	public static final String DIGITS = "0123456789";

	/**
	 * Keyword to token type
	 */
	public static final Map<String, TokenType> KEYWORDS;

	/**
	 * Operator to token type, contains only operators built out of split symbols
	 */
	public static final Map<String, TokenType> OPERATORS;

	/**
	 * Length of the longest operator
	 */
	public static final int MAX_OPERATOR_LENGTH;

	static {
		Map<String, TokenType> keywords = new HashMap<>();
		Map<String, TokenType> operators = new HashMap<>();
		for (TokenType type : TokenType.values()){
			String lexeme = type.lexeme();
			if (lexeme == null || type == TokenType.EOF){
				continue;
			}
			if (isSplitSymbol(lexeme.charAt(0))){
				operators.put(lexeme, type);
			} else {
				keywords.put(lexeme, type);
			}
		}
		keywords.put("ret", TokenType.RETURN);
		KEYWORDS = Collections.unmodifiableMap(keywords);
		OPERATORS = Collections.unmodifiableMap(operators);
		MAX_OPERATOR_LENGTH = operators.keySet().stream().mapToInt(String::length).max().orElse(1);
	}

	private StableWords(){
	}

	public static boolean isSplitSymbol(char c){
		return SPLIT_SYMBOLS.indexOf(c) != -1;
	}

	public static boolean isWhitespace(char c){
		return WHITESPACE.indexOf(c) != -1;
	}

	public static boolean isDigit(char c){
		return DIGITS.indexOf(c) != -1;
	}
}
