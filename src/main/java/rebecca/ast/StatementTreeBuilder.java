package rebecca.ast;

import java.util.*;

import rebecca.lexer.SyntacticRole;
import rebecca.lexer.Token;
import rebecca.lexer.TokenType;

/**
 * Builds a shallow AST out of a token sequence without knowing the grammar of the language:
 * <pre>
 * (UNKNOWN
 *     (SEMICOLON (= a b + c))
 *     (SEMICOLON (: rule x y))
 *     EOF)
 * </pre>
 * Every statement (terminated by ';') is represented by a synthesized SEMICOLON node, a leading name
 * followed by '=' (variable definition) or ':' (rule definition) becomes the child of that operator.
 * Later occurrences of defined names are tagged as references.
 */
public class StatementTreeBuilder {

	private final List<Token> tokens;
	private final Tree tree = new Tree(TokenType.UNKNOWN);
	private final Set<String> ruleNames = new HashSet<>();
	private final Set<String> varNames = new HashSet<>();

	private boolean inStatement = false;
	private boolean atLeaf = false;
	private int statementLeaves = 0;

	public StatementTreeBuilder(List<Token> tokens) {
		this.tokens = tokens;
	}

	public static Tree build(List<Token> tokens){
		return new StatementTreeBuilder(tokens).build();
	}

	public Tree build(){
		for (int i = 0; i < tokens.size(); i++){
			Token token = tokens.get(i);
			if (token.isType(TokenType.EQ) || token.isType(TokenType.COLON)){
				if (atLeaf && statementLeaves == 1){
					tree.insertParent(tree.createNode(token));
					atLeaf = false;
					continue;
				}
			}
			if (atLeaf){
				tree.parent();
				atLeaf = false;
			}
			if (token.isType(TokenType.EOF)){
				ascendToRoot();
				tree.addChild(tree.createNode(token));
				tree.parent();
				break;
			}
			if (token.isType(TokenType.SEMICOLON)){
				ascendToRoot();
				continue;
			}
			if (!inStatement){
				tree.addChild(tree.createNodeByType(TokenType.SEMICOLON));
				inStatement = true;
				statementLeaves = 0;
			}
			tree.addChild(tree.createNode(token.withRole(role(i))));
			atLeaf = true;
			statementLeaves++;
		}
		return tree;
	}

	private void ascendToRoot(){
		while (tree.current() != tree.root()){
			tree.parent();
		}
		inStatement = false;
	}

	private SyntacticRole role(int index){
		Token token = tokens.get(index);
		if (!token.isType(TokenType.NAME)){
			return SyntacticRole.NONE;
		}
		if (statementLeaves == 0 && index + 1 < tokens.size()){
			Token next = tokens.get(index + 1);
			if (next.isType(TokenType.EQ)){
				varNames.add(token.text);
				return SyntacticRole.VAR_NAME;
			}
			if (next.isType(TokenType.COLON)){
				ruleNames.add(token.text);
				return SyntacticRole.RULE_NAME;
			}
		}
		if (ruleNames.contains(token.text)){
			return SyntacticRole.RULE_NAME_REFERENCE;
		}
		if (varNames.contains(token.text)){
			return SyntacticRole.VAR_NAME_REFERENCE;
		}
		return SyntacticRole.NONE;
	}
}
