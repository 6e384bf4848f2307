package rebecca.ast;

import org.junit.jupiter.api.Test;

import rebecca.lexer.RebeccaLexer;
import rebecca.lexer.SyntacticRole;

import static org.junit.jupiter.api.Assertions.*;

public class StatementTreeBuilderTest {

	static Tree build(String input){
		return StatementTreeBuilder.build(new RebeccaLexer(input).tokenize());
	}

	@Test
	public void testEmptyInput(){
		assertEquals("(UNKNOWN EOF)", build("").toString());
	}

	@Test
	public void testDefinitionsGetOperatorParents(){
		Tree tree = build("a = b + 1; rule : a x;");
		assertEquals("(UNKNOWN (SEMICOLON (= a b + 1)) (SEMICOLON (: rule a x)) EOF)", tree.toString());
		assertSame(tree.root(), tree.current());
		TreeTest.assertSymmetric(tree.root());
	}

	@Test
	public void testUnterminatedStatement(){
		assertEquals("(UNKNOWN (SEMICOLON if x) EOF)", build("if x").toString());
	}

	@Test
	public void testRoles(){
		Tree tree = build("v = 1; r : v r;");
		Node definition = tree.root().getChild(0).getChild(0);
		assertEquals(SyntacticRole.VAR_NAME, definition.getChild(0).token.role);
		assertEquals(SyntacticRole.NONE, definition.getChild(1).token.role);
		Node rule = tree.root().getChild(1).getChild(0);
		assertEquals(SyntacticRole.RULE_NAME, rule.getChild(0).token.role);
		assertEquals(SyntacticRole.VAR_NAME_REFERENCE, rule.getChild(1).token.role);
		assertEquals(SyntacticRole.RULE_NAME_REFERENCE, rule.getChild(2).token.role);
	}

	@Test
	public void testOperatorInsideStatementStaysLeaf(){
		assertEquals("(UNKNOWN (SEMICOLON x y = z) EOF)", build("x y = z;").toString());
	}
}
