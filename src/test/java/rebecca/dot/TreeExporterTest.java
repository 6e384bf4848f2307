package rebecca.dot;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import rebecca.RebeccaException;
import rebecca.ast.AstError;
import rebecca.ast.Node;
import rebecca.ast.Tree;
import rebecca.lexer.Location;
import rebecca.lexer.SyntacticRole;
import rebecca.lexer.Token;
import rebecca.lexer.TokenType;

import static org.junit.jupiter.api.Assertions.*;

public class TreeExporterTest {

	private final TreeExporter exporter = new TreeExporter(50, GraphRenderer.NONE);

	/**
	 * (PLUS a b)
	 */
	static Tree plusTree(){
		Tree tree = new Tree(TokenType.PLUS);
		tree.addChild(tree.createNode(new Token(TokenType.NAME, "a", Location.START)));
		tree.parent();
		tree.addChild(tree.createNode(new Token(TokenType.NAME, "b", Location.START)));
		tree.parent();
		return tree;
	}

	@Test
	public void testPlusScenario(){
		Tree tree = plusTree();
		Node plus = tree.root();
		Node a = plus.getChild(0);
		Node b = plus.getChild(1);

		List<EdgeRecord> edges = exporter.edgeRecords(tree);
		assertEquals(2, edges.stream().filter(e -> e.from == plus.id).count());
		assertEquals(0, edges.stream().filter(e -> e.from == a.id).count());
		assertEquals(0, edges.stream().filter(e -> e.from == b.id).count());
		assertEquals(List.of(new EdgeRecord(plus.id, a.id), new EdgeRecord(plus.id, b.id)), edges);

		List<NodeRecord> nodes = exporter.nodeRecords(tree);
		assertEquals(List.of(plus.id, a.id, b.id), nodes.stream().map(n -> n.id).collect(Collectors.toList()));
		assertEquals(NodeStyles.BorderShape.DIAMOND, nodes.get(0).shape);
		assertEquals(NodeStyles.BorderShape.RECTANGLE, nodes.get(1).shape);
		assertEquals(NodeStyles.BorderShape.RECTANGLE, nodes.get(2).shape);
	}

	@Test
	public void testSecondaryLabelOnlyForNonCanonicalText(){
		Tree tree = plusTree();
		List<NodeRecord> nodes = exporter.nodeRecords(tree);
		assertEquals("PLUS", nodes.get(0).label);
		assertEquals(Optional.empty(), nodes.get(0).getSecondaryLabel());
		assertEquals("a", nodes.get(1).label);
		assertEquals(Optional.of("NAME"), nodes.get(1).getSecondaryLabel());
	}

	@Test
	public void testRoleColors(){
		Tree tree = new Tree();
		tree.addChild(tree.createNodeByType(TokenType.COLON));
		tree.addChild(tree.createNode(new Token(TokenType.NAME, "rule", null, SyntacticRole.RULE_NAME, Location.START)));
		NodeRecord rule = exporter.nodeRecords(tree).get(1);
		assertEquals(NodeStyles.NodeColor.CYAN, rule.color);
		assertEquals(NodeStyles.BorderShape.NONE, exporter.nodeRecords(tree).get(0).shape);
	}

	@Test
	public void testPreOrder(){
		Tree tree = new Tree(TokenType.CLASS);
		Node x = tree.addChild(tree.createNodeByType(TokenType.LEFT_BRACE));
		Node y = tree.addChild(tree.createNodeByType(TokenType.IF));
		tree.parent();
		tree.parent();
		Node z = tree.addChild(tree.createNodeByType(TokenType.RIGHT_BRACE));
		Node root = tree.root();

		assertEquals(List.of(root.id, x.id, y.id, z.id),
				exporter.nodeRecords(tree).stream().map(n -> n.id).collect(Collectors.toList()));
		assertEquals(List.of(new EdgeRecord(root.id, x.id), new EdgeRecord(root.id, z.id), new EdgeRecord(x.id, y.id)),
				exporter.edgeRecords(tree));
	}

	@Test
	public void testDocument(){
		Tree tree = plusTree();
		Node plus = tree.root();
		long a = plus.getChild(0).id;
		long b = plus.getChild(1).id;
		String expected = "digraph G {\n" +
				"\tgraph [dpi=50];\n\n" +
				"\tn" + plus.id + " [shape=diamond, color=black, label=\"PLUS\"];\n" +
				"\tn" + a + " [shape=rectangle, color=black, label=\"a\", xlabel=\"NAME\"];\n" +
				"\tn" + b + " [shape=rectangle, color=black, label=\"b\", xlabel=\"NAME\"];\n" +
				"\n" +
				"\tn" + plus.id + " -> n" + a + "\n" +
				"\tn" + plus.id + " -> n" + b + "\n" +
				"}\n";
		assertEquals(expected, exporter.toGraphvizString(tree));
	}

	@Test
	public void testExportIsDeterministic(){
		Tree tree = plusTree();
		assertEquals(exporter.toGraphvizString(tree), exporter.toGraphvizString(tree));
		assertEquals(exporter.nodeRecords(tree), exporter.nodeRecords(tree));
		assertEquals(exporter.edgeRecords(tree), exporter.edgeRecords(tree));
	}

	@Test
	public void testLabelsAreEscaped(){
		Tree tree = new Tree();
		tree.addChild(tree.createNode(new Token(TokenType.DOUBLE_QUOTE, "\"", Location.START)));
		tree.addChild(tree.createNode(new Token(TokenType.BACK_SLASH, "\\", Location.START)));
		String document = exporter.toGraphvizString(tree);
		assertTrue(document.contains("label=\"\\\"\""), document);
		assertTrue(document.contains("label=\"\\\\\""), document);
	}

	@Test
	public void testEmptyTreeIsRejected(){
		assertThrows(AstError.class, () -> exporter.toGraphvizString(new Tree()));
	}

	@Test
	public void testToImageUsesRenderer(@TempDir Path dir) throws IOException {
		List<String> rendered = new ArrayList<>();
		List<Path> images = new ArrayList<>();
		TreeExporter recording = new TreeExporter(72, (document, imageFile) -> {
			rendered.add(document);
			images.add(imageFile);
		});
		Tree tree = plusTree();
		Path dotFile = dir.resolve("graph.dot");
		Path imageFile = dir.resolve("graph.png");
		recording.toImage(tree, dotFile, imageFile);

		String written = new String(Files.readAllBytes(dotFile), StandardCharsets.UTF_8);
		assertTrue(written.contains("graph [dpi=72];"));
		assertEquals(List.of(written), rendered);
		assertEquals(List.of(imageFile), images);
	}

	@Test
	public void testRenderErrorsAreWrapped(@TempDir Path dir){
		TreeExporter failing = new TreeExporter(50, (document, imageFile) -> {
			throw new IOException("no dot");
		});
		assertThrows(RebeccaException.class,
				() -> failing.toImage(plusTree(), dir.resolve("graph.dot"), dir.resolve("graph.png")));
	}

	@Test
	public void testUnwritableDotFile(@TempDir Path dir){
		assertThrows(RebeccaException.class,
				() -> exporter.toGraphvizFile(plusTree(), dir.resolve("missing").resolve("graph.dot")));
	}

	@Test
	public void testImageFormats(){
		assertEquals(guru.nidi.graphviz.engine.Format.SVG_STANDALONE, GraphvizRenderer.formatForFile(Path.of("a.SVG")));
		assertEquals(guru.nidi.graphviz.engine.Format.PNG, GraphvizRenderer.formatForFile(Path.of("a.png")));
		assertEquals(guru.nidi.graphviz.engine.Format.PNG, GraphvizRenderer.formatForFile(Path.of("a")));
	}
}
