package rebecca.lexer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import rebecca.RebeccaException;

/**
 * Lexer for Rebecca source code.
 *
 * Whitespace and split symbols separate words. Runs of split symbols are matched greedily against
 * the known operators, words are either keywords, numbers or names.
 */
public class RebeccaLexer extends BaseLexer {

	private final String input;
	private int pos = 0;
	private Location location = Location.START;

	public RebeccaLexer(String input, TokenType... ignoredTypes){
		super(ignoredTypes);
		this.input = input;
	}

	public static RebeccaLexer fromFile(Path file, TokenType... ignoredTypes){
		try {
			return new RebeccaLexer(new String(Files.readAllBytes(file), StandardCharsets.UTF_8), ignoredTypes);
		} catch (IOException e) {
			throw new RebeccaException("Can't read source file " + file, e);
		}
	}

	@Override
	protected Token parseNextToken() {
		skipWhitespace();
		if (pos >= input.length()){
			return new Token(TokenType.EOF, TokenType.EOF.lexeme(), location);
		}
		if (StableWords.isSplitSymbol(input.charAt(pos))){
			return parseOperator();
		}
		return parseWord();
	}

	private void skipWhitespace(){
		while (pos < input.length() && StableWords.isWhitespace(input.charAt(pos))){
			advance();
		}
	}

	private char advance(){
		char c = input.charAt(pos++);
		location = location.after(c);
		return c;
	}

	/**
	 * Longest operator starting at the current position, falls back to a single split symbol.
	 */
	private Token parseOperator(){
		Location start = location;
		int maxLength = Math.min(StableWords.MAX_OPERATOR_LENGTH, input.length() - pos);
		for (int length = maxLength; length > 0; length--){
			String symbols = input.substring(pos, pos + length);
			TokenType type = StableWords.OPERATORS.get(symbols);
			if (type != null){
				for (int i = 0; i < length; i++){
					advance();
				}
				return new Token(type, symbols, start);
			}
		}
		return new Token(TokenType.UNKNOWN, Character.toString(advance()), start);
	}

	private Token parseWord(){
		Location start = location;
		StringBuilder builder = new StringBuilder();
		while (pos < input.length() && !StableWords.isWhitespace(input.charAt(pos))
				&& !StableWords.isSplitSymbol(input.charAt(pos))){
			builder.append(advance());
		}
		String word = builder.toString();
		TokenType keyword = StableWords.KEYWORDS.get(word);
		if (keyword != null){
			return new Token(keyword, word, start);
		}
		if (StableWords.isDigit(word.charAt(0))){
			return parseNumber(word, start);
		}
		return new Token(TokenType.NAME, word, start);
	}

	private Token parseNumber(String word, Location start){
		for (char c : word.toCharArray()){
			if (!StableWords.isDigit(c)){
				throw LexerError.malformedNumber(word, start);
			}
		}
		try {
			return new Token(TokenType.NUMBER, word, Integer.parseInt(word), SyntacticRole.NONE, start);
		} catch (NumberFormatException ex){
			throw LexerError.malformedNumber(word, start);
		}
	}
}
