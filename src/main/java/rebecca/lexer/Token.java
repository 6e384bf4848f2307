package rebecca.lexer;

import java.util.Optional;

/**
 * A lexical unit, immutable.
 */
public class Token {

	/**
	 * Type of the token.
	 */
	public final TokenType type;

	/**
	 * Matched text or the canonical name of the type for synthesized tokens.
	 */
	public final String text;

	/**
	 * Static value (if it exists), e.g. the value of a number.
	 */
	private final Integer value;

	public final SyntacticRole role;

	/**
	 * Location in the source code, {@code null} for synthesized tokens
	 */
	public final Location location;

	public Token(TokenType type, String text, Integer value, SyntacticRole role, Location location){
		this.type = type;
		this.text = text;
		this.value = value;
		this.role = role == null ? SyntacticRole.NONE : role;
		this.location = location;
	}

	public Token(TokenType type, String text, Location location){
		this(type, text, null, SyntacticRole.NONE, location);
	}

	/**
	 * Creates a token without source location whose text is the canonical name of the type.
	 */
	public static Token synthesize(TokenType type, SyntacticRole role){
		return new Token(type, type.canonicalName(), null, role, null);
	}

	public Optional<Integer> getValue(){
		return Optional.ofNullable(value);
	}

	public Token withRole(SyntacticRole role){
		return new Token(type, text, value, role, location);
	}

	public boolean hasText(){
		return text != null && !text.isEmpty();
	}

	public boolean isType(TokenType type){
		return this.type == type;
	}

	/**
	 * Is the text of this token the canonical name of its type?
	 */
	public boolean hasCanonicalText(){
		return type.canonicalName().equals(text);
	}

	@Override
	public String toString() {
		return type + (location == null ? "" : location.toString()) + "(" + text + ")";
	}

	public String toSimpleString(){
		return type.canonicalName();
	}
}
