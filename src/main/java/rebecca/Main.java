package rebecca;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

import rebecca.ast.StatementTreeBuilder;
import rebecca.ast.Tree;
import rebecca.dot.GraphRenderer;
import rebecca.dot.GraphvizRenderer;
import rebecca.dot.TreeExporter;
import rebecca.lexer.RebeccaLexer;
import rebecca.lexer.Token;

/**
 * Tokenizes a Rebecca source file and logs the tokens, optionally exports the statement tree.
 *
 * Usage: {@code rebecca.Main <file> [--dot]}
 */
public class Main {

	private static final Logger LOG = Logger.getLogger("Main");

	public static void main(String[] args) {
		if (args.length == 0 || args.length > 2 || (args.length == 2 && !args[1].equals("--dot"))){
			System.err.println("Usage: rebecca.Main <file> [--dot]");
			System.exit(2);
		}
		try {
			setupLogging();
			run(Paths.get(args[0]), args.length == 2);
		} catch (RebeccaException ex){
			LOG.log(Level.SEVERE, ex.getMessage(), ex);
			System.err.println(ex.getMessage());
			System.exit(1);
		}
	}

	public static List<Token> run(Path sourceFile, boolean exportTree){
		LOG.info("Start of tokenizer work");
		List<Token> tokens = RebeccaLexer.fromFile(sourceFile).tokenize();
		LOG.info("Output of tokenizer:");
		for (int i = 0; i < tokens.size(); i++){
			Token token = tokens.get(i);
			LOG.info(String.format("t(%d)|%s -- %s", i, token.text, token.toSimpleString()));
		}
		if (exportTree){
			Tree tree = StatementTreeBuilder.build(tokens);
			GraphRenderer renderer = Config.renderImage() ? new GraphvizRenderer() : GraphRenderer.NONE;
			new TreeExporter(Config.getGraphDpi(), renderer).toImage(tree, Config.getDotFile(), Config.getImageFile());
			LOG.info("Exported AST with " + tree.size() + " nodes to " + Config.getDotFile());
		}
		return tokens;
	}

	private static void setupLogging(){
		Logger rootLogger = Logger.getLogger("");
		rootLogger.setLevel(Config.getLogLevel());
		try {
			FileHandler handler = new FileHandler(Config.getLogFile().toString());
			handler.setFormatter(new SimpleFormatter());
			handler.setLevel(Config.getLogLevel());
			rootLogger.addHandler(handler);
		} catch (IOException e) {
			LOG.log(Level.WARNING, "Can't open log file " + Config.getLogFile(), e);
		}
	}
}
