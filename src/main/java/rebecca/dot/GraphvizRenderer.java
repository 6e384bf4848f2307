package rebecca.dot;

import java.io.IOException;
import java.nio.file.Path;

import guru.nidi.graphviz.engine.Engine;
import guru.nidi.graphviz.engine.Format;
import guru.nidi.graphviz.engine.Graphviz;

/**
 * Renders graphviz documents with the dot layout engine, the image format is chosen by the file extension
 * (png, svg or plain text, png for unknown extensions).
 */
public class GraphvizRenderer implements GraphRenderer {

	@Override
	public void render(String dotDocument, Path imageFile) throws IOException {
		Graphviz.fromString(dotDocument).engine(Engine.DOT)
				.render(formatForFile(imageFile)).toFile(imageFile.toFile());
	}

	static Format formatForFile(Path imageFile){
		String name = imageFile.getFileName().toString().toLowerCase();
		if (name.endsWith(".svg")){
			return Format.SVG_STANDALONE;
		}
		if (name.endsWith(".txt")){
			return Format.PLAIN;
		}
		return Format.PNG;
	}
}
