package rebecca.dot;

import rebecca.lexer.SyntacticRole;
import rebecca.lexer.TokenType;

/**
 * Visual classification of AST nodes in the graphviz output.
 */
public final class NodeStyles {

	public enum BorderShape {
		NONE("none"),
		RECTANGLE("rectangle"),
		DIAMOND("diamond");

		/** graphviz name of the shape */
		public final String dotName;

		BorderShape(String dotName) {
			this.dotName = dotName;
		}
	}

	public enum NodeColor {
		BLACK("black"),
		YELLOW("yellow"),
		CYAN("cyan"),
		RED("red"),
		GREEN("green");

		/** graphviz name of the color */
		public final String dotName;

		NodeColor(String dotName) {
			this.dotName = dotName;
		}
	}

	private NodeStyles(){
	}

	/**
	 * Separators and the end of input are drawn without border, names as rectangles
	 */
	public static BorderShape borderShape(TokenType type){
		switch (type) {
			case COLON:
			case SEMICOLON:
			case DOUBLE_QUOTE:
			case SINGLE_QUOTE:
			case EOF:
			case EQ:
				return BorderShape.NONE;
			case NAME:
				return BorderShape.RECTANGLE;
			default:
				return BorderShape.DIAMOND;
		}
	}

	public static NodeColor color(SyntacticRole role){
		switch (role) {
			case VAR_NAME:
				return NodeColor.YELLOW;
			case RULE_NAME:
				return NodeColor.CYAN;
			case RULE_NAME_REFERENCE:
				return NodeColor.RED;
			case VAR_NAME_REFERENCE:
				return NodeColor.GREEN;
			default:
				return NodeColor.BLACK;
		}
	}
}
