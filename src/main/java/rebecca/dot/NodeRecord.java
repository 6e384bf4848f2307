package rebecca.dot;

import java.util.Objects;
import java.util.Optional;

import rebecca.ast.Node;

/**
 * Graphviz node statement for a single AST node.
 */
public class NodeRecord {

	public final long id;
	public final NodeStyles.BorderShape shape;
	public final NodeStyles.NodeColor color;
	public final String label;

	/**
	 * Canonical type name, only present if it differs from the label
	 */
	private final String secondaryLabel;

	public NodeRecord(long id, NodeStyles.BorderShape shape, NodeStyles.NodeColor color, String label, String secondaryLabel) {
		this.id = id;
		this.shape = shape;
		this.color = color;
		this.label = label;
		this.secondaryLabel = secondaryLabel;
	}

	public static NodeRecord of(Node node){
		return new NodeRecord(node.id,
				NodeStyles.borderShape(node.type()),
				NodeStyles.color(node.token.role),
				node.text(),
				node.token.hasCanonicalText() ? null : node.type().canonicalName());
	}

	public Optional<String> getSecondaryLabel() {
		return Optional.ofNullable(secondaryLabel);
	}

	public String toGraphvizString(){
		StringBuilder builder = new StringBuilder();
		builder.append(TreeExporter.nodeName(id))
				.append(" [shape=").append(shape.dotName)
				.append(", color=").append(color.dotName)
				.append(", label=\"").append(TreeExporter.escape(label)).append("\"");
		if (secondaryLabel != null){
			builder.append(", xlabel=\"").append(TreeExporter.escape(secondaryLabel)).append("\"");
		}
		return builder.append("];").toString();
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof NodeRecord)){
			return false;
		}
		NodeRecord other = (NodeRecord) o;
		return id == other.id && shape == other.shape && color == other.color
				&& label.equals(other.label) && Objects.equals(secondaryLabel, other.secondaryLabel);
	}

	@Override
	public int hashCode() {
		return Objects.hash(id, shape, color, label, secondaryLabel);
	}

	@Override
	public String toString() {
		return toGraphvizString();
	}
}
