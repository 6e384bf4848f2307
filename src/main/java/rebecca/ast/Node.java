package rebecca.ast;

import java.util.*;

import rebecca.lexer.Token;
import rebecca.lexer.TokenType;

/**
 * Node of the AST, owns a copy of its token and its children.
 *
 * Nodes are created by a {@link Tree} and only changed by its builder operations.
 */
public class Node {

	private static long idCounter = 0;

	/**
	 * Unique among all nodes created in this run
	 */
	public final long id;

	public final Token token;

	private final List<Node> children = new ArrayList<>();

	/**
	 * Non owning back reference, {@code null} for the root
	 */
	private Node parent = null;

	Node(Token token) {
		this.token = token.withRole(token.role);
		this.id = idCounter++;
	}

	public TokenType type(){
		return token.type;
	}

	public String text(){
		return token.text;
	}

	/**
	 * Unmodifiable view on the children, in insertion order
	 */
	public List<Node> children(){
		return Collections.unmodifiableList(children);
	}

	public boolean hasChildren(){
		return !children.isEmpty();
	}

	public int childCount(){
		return children.size();
	}

	public Node getChild(int index){
		if (index < 0 || index >= children.size()){
			throw new AstError("Child index %d out of range [0, %d) for node n%d", index, children.size(), id);
		}
		return children.get(index);
	}

	public Node getLastChild(){
		return getChild(children.size() - 1);
	}

	public Node parent(){
		return parent;
	}

	public boolean isRoot(){
		return parent == null;
	}

	/**
	 * Is this node the passed node or one of its ancestors?
	 */
	boolean isAncestorOf(Node node){
		for (Node cur = node; cur != null; cur = cur.parent){
			if (cur == this){
				return true;
			}
		}
		return false;
	}

	void appendChild(Node child){
		children.add(child);
		child.parent = this;
	}

	/**
	 * Replaces the most recently appended child, the replaced child is detached.
	 */
	void replaceLastChild(Node child){
		Node replaced = children.set(children.size() - 1, child);
		replaced.parent = null;
		child.parent = this;
	}

	/**
	 * Removes all children and returns them detached.
	 */
	List<Node> detachChildren(){
		List<Node> ret = new ArrayList<>(children);
		children.clear();
		for (Node child : ret){
			child.parent = null;
		}
		return ret;
	}

	@Override
	public String toString() {
		if (!hasChildren()){
			return token.text;
		}
		StringBuilder builder = new StringBuilder();
		builder.append("(").append(token.text);
		for (Node child : children){
			builder.append(" ").append(child);
		}
		builder.append(")");
		return builder.toString();
	}

	public String toPrettyString(){
		return toPrettyString("", "\t");
	}

	public String toPrettyString(String indent, String incr){
		if (!hasChildren()){
			return indent + token.text;
		}
		StringBuilder builder = new StringBuilder();
		builder.append(indent).append("(").append(token.text);
		for (Node child : children){
			builder.append("\n").append(child.toPrettyString(indent + incr, incr));
		}
		builder.append(")");
		return builder.toString();
	}
}
