package rebecca.dot;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Renders a graphviz document into an image file.
 */
public interface GraphRenderer {

	void render(String dotDocument, Path imageFile) throws IOException;

	/**
	 * Renderer that doesn't produce any image
	 */
	GraphRenderer NONE = (dotDocument, imageFile) -> {};
}
