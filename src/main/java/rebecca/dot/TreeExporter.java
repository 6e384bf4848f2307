package rebecca.dot;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import rebecca.Config;
import rebecca.RebeccaException;
import rebecca.ast.AstError;
import rebecca.ast.Node;
import rebecca.ast.Tree;

/**
 * Exports ASTs as graphviz digraphs.
 *
 * The document first lists all nodes and then all edges, both in pre-order.
 * The exporter never changes the tree.
 */
public class TreeExporter {

	private static final Logger LOG = Logger.getLogger("TreeExporter");

	private final int dpi;
	private final GraphRenderer renderer;

	public TreeExporter(int dpi, GraphRenderer renderer) {
		this.dpi = dpi;
		this.renderer = renderer;
	}

	/**
	 * Uses the configured dpi and graphviz-java for rendering
	 */
	public TreeExporter() {
		this(Config.getGraphDpi(), new GraphvizRenderer());
	}

	public List<NodeRecord> nodeRecords(Tree tree){
		List<NodeRecord> records = new ArrayList<>();
		collectNodes(rootOf(tree), records);
		return records;
	}

	private void collectNodes(Node node, List<NodeRecord> records){
		records.add(NodeRecord.of(node));
		for (Node child : node.children()){
			collectNodes(child, records);
		}
	}

	public List<EdgeRecord> edgeRecords(Tree tree){
		List<EdgeRecord> records = new ArrayList<>();
		collectEdges(rootOf(tree), records);
		return records;
	}

	private void collectEdges(Node node, List<EdgeRecord> records){
		for (Node child : node.children()){
			records.add(new EdgeRecord(node.id, child.id));
		}
		for (Node child : node.children()){
			collectEdges(child, records);
		}
	}

	private static Node rootOf(Tree tree){
		if (tree == null || tree.isEmpty()){
			throw new AstError("Can't export an empty tree");
		}
		return tree.root();
	}

	public String toGraphvizString(Tree tree){
		StringBuilder builder = new StringBuilder();
		builder.append("digraph G {\n");
		builder.append("\tgraph [dpi=").append(dpi).append("];\n\n");
		for (NodeRecord record : nodeRecords(tree)){
			builder.append("\t").append(record.toGraphvizString()).append("\n");
		}
		builder.append("\n");
		for (EdgeRecord record : edgeRecords(tree)){
			builder.append("\t").append(record.toGraphvizString()).append("\n");
		}
		builder.append("}\n");
		return builder.toString();
	}

	public void toGraphvizFile(Tree tree, Path file){
		write(toGraphvizString(tree), file);
	}

	private static void write(String document, Path file){
		try {
			Files.write(file, document.getBytes(StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new RebeccaException("Can't write graphviz file " + file, e);
		}
		LOG.fine("Wrote graphviz file " + file);
	}

	/**
	 * Writes the graphviz file and renders it into the image file.
	 */
	public void toImage(Tree tree, Path dotFile, Path imageFile){
		String document = toGraphvizString(tree);
		write(document, dotFile);
		try {
			renderer.render(document, imageFile);
		} catch (IOException e) {
			throw new RebeccaException("Can't render " + dotFile + " into " + imageFile, e);
		}
		LOG.fine("Rendered " + imageFile);
	}

	static String nodeName(long id){
		return "n" + id;
	}

	/**
	 * Escapes the passed text for usage in a quoted graphviz string
	 */
	static String escape(String text){
		return text.replace("\\", "\\\\").replace("\"", "\\\"");
	}
}
