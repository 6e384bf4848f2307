package rebecca.ast;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import rebecca.lexer.SyntacticRole;
import rebecca.lexer.Token;
import rebecca.lexer.TokenType;

/**
 * AST that is built incrementally by a parser.
 *
 * The tree keeps a cursor (the current node) that marks where the next structural edit applies.
 * Every operation checks its preconditions and throws an {@link AstError} if they are violated,
 * the tree must not be used after such an error.
 * Not thread safe.
 */
public class Tree {

	public static final Logger LOG = Logger.getLogger("Tree");

	private Node root = null;

	/**
	 * Non owning cursor, {@code null} only as long as the tree is empty
	 */
	private Node current = null;

	/**
	 * Number of nodes created by this tree
	 */
	private int size = 0;

	/**
	 * Creates an empty tree
	 */
	public Tree(){
	}

	/**
	 * Creates a tree with a synthesized root node of the passed type
	 */
	public Tree(TokenType rootType){
		addChild(createNodeByType(rootType));
	}

	/**
	 * Creates a node backed by a copy of the passed token.
	 */
	public Node createNode(Token token){
		if (token == null){
			throw new AstError("Can't create a node without a token");
		}
		if (token.type == null || !token.hasText()){
			throw new AstError("Can't create a node for token %s without type or text", token);
		}
		Node node = new Node(token);
		size++;
		return node;
	}

	/**
	 * Creates a structural marker node whose text is the canonical name of the passed type.
	 */
	public Node createNodeByType(TokenType type, SyntacticRole role){
		if (type == null){
			throw new AstError("Can't create a node without a token type");
		}
		return createNode(Token.synthesize(type, role));
	}

	public Node createNodeByType(TokenType type){
		return createNodeByType(type, SyntacticRole.NONE);
	}

	/**
	 * Appends the passed node to the children of the current node and makes it the current node.
	 * The first node added to an empty tree becomes its root.
	 * Only detached nodes (without parent) can be added.
	 *
	 * @return the new current node
	 */
	public Node addChild(Node child){
		if (child == null){
			throw new AstError("Can't add null as a child");
		}
		if (!child.token.hasText()){
			throw new AstError("Can't add node n%d without text", child.id);
		}
		if (child.parent() != null){
			throw new AstError("Can't add node n%d, it is already a child of n%d", child.id, child.parent().id);
		}
		if (current == null){
			root = child;
			current = child;
			log("root n%d", child.id);
			return current;
		}
		if (child.isAncestorOf(current)){
			throw new AstError("Adding n%d to n%d would create a cycle", child.id, current.id);
		}
		current.appendChild(child);
		log("add n%d to n%d", child.id, current.id);
		current = child;
		return current;
	}

	/**
	 * Moves the cursor to the parent of the current node.
	 */
	public Node parent(){
		if (current == null){
			throw new AstError("Can't ascend in an empty tree");
		}
		if (current.isRoot()){
			throw new AstError("Can't ascend beyond the root n%d", current.id);
		}
		current = current.parent();
		return current;
	}

	/**
	 * Inserts the passed node as the new parent of the current node, the current node becomes its
	 * only new child (keeping its own subtree) and the passed node becomes the current node.
	 *
	 * Only the last child of a node can get a new parent: the passed node replaces the last child slot
	 * of the old parent. Calling it with a current node that isn't the last child of its parent is an error.
	 */
	public void insertParent(Node node){
		if (current == null){
			throw new AstError("Can't insert a parent into an empty tree");
		}
		if (node == null){
			throw new AstError("Can't insert null as a parent");
		}
		if (!node.token.hasText()){
			throw new AstError("Can't insert node n%d without text", node.id);
		}
		if (node.isAncestorOf(current)){
			throw new AstError("Node n%d is already an ancestor of n%d", node.id, current.id);
		}
		if (node.parent() != null){
			throw new AstError("Can't insert node n%d, it is already a child of n%d", node.id, node.parent().id);
		}
		Node oldCurrent = current;
		Node oldParent = oldCurrent.parent();
		if (oldParent != null){
			if (oldParent.getLastChild() != oldCurrent){
				throw new AstError("Can't insert a parent for n%d, it isn't the last child of n%d",
						oldCurrent.id, oldParent.id);
			}
			oldParent.replaceLastChild(node);
		}
		current = node;
		addChild(oldCurrent);
		parent();
		if (oldCurrent == root){
			root = node;
		}
		log("insert n%d as parent of n%d", node.id, oldCurrent.id);
	}

	/**
	 * Moves all children of the current node of the passed tree (in order) to the current node of this tree.
	 * The current node of the other tree becomes the current node of this tree afterwards, the other tree
	 * should be considered as merged into this tree.
	 */
	public void appendTree(Tree other){
		if (other == null){
			throw new AstError("Can't append null");
		}
		if (current == null || other.current == null){
			throw new AstError("Can't append empty trees");
		}
		Node donor = other.current;
		for (Node child : donor.children()){
			if (child.isAncestorOf(current)){
				throw new AstError("Moving n%d to n%d would create a cycle", child.id, current.id);
			}
		}
		List<Node> moved = donor.detachChildren();
		for (Node child : moved){
			addChild(child);
			parent();
		}
		other.current = current;
		log("move %d children of n%d to n%d", moved.size(), donor.id, current.id);
	}

	public Node root(){
		return root;
	}

	public Node current(){
		return current;
	}

	public int size(){
		return size;
	}

	public boolean isEmpty(){
		return root == null;
	}

	private void log(String format, Object... args){
		if (LOG.isLoggable(Level.FINER)){
			LOG.finer(String.format(format, args));
		}
	}

	@Override
	public String toString() {
		return root == null ? "()" : root.toString();
	}

	public String toPrettyString(){
		return root == null ? "()" : root.toPrettyString();
	}
}
