package rebecca.lexer;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

public abstract class BaseLexer implements Lexer {

	protected static final Logger LOG = Logger.getLogger("Lexer");

	private Token curToken = null;
	private final Set<TokenType> ignoredTypes = EnumSet.noneOf(TokenType.class);

	public BaseLexer(TokenType... ignoredTypes){
		for (TokenType type : ignoredTypes){
			ignore(type);
		}
	}

	@Override
	public Token cur() {
		if (curToken == null){
			return next();
		}
		return curToken;
	}

	protected abstract Token parseNextToken();

	@Override
	public Token next() {
		if (curToken != null && curToken.isType(TokenType.EOF)){
			return curToken;
		}
		while (ignoredTypes.contains((curToken = parseNextToken()).type));
		if (LOG.isLoggable(Level.FINEST)){
			LOG.finest("Lexed " + curToken);
		}
		return curToken;
	}

	@Override
	public void ignore(TokenType type) {
		if (type == TokenType.EOF){
			throw new IllegalArgumentException("The end of input token can't be ignored");
		}
		ignoredTypes.add(type);
	}

	@Override
	public List<Token> tokenize() {
		List<Token> tokens = new ArrayList<>();
		Token token = cur();
		tokens.add(token);
		while (!token.isType(TokenType.EOF)){
			token = next();
			tokens.add(token);
		}
		return tokens;
	}
}
