package rebecca;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Global settings, overridable via {@code key = value} lines in {@value #configFile}.
 */
public class Config {

	private static final Logger LOG = Logger.getLogger("Config");

	public static final String configFile = "rebecca.ini";

	private static final Map<String, String> defaults = new HashMap<String, String>(){{
		put("graphDpi", "50");
		put("dotFile", "graph.dot");
		put("imageFile", "graph.png");
		put("renderImage", "yes");
		put("logFile", "logfile.txt");
		put("logLevel", "INFO");
	}};

	private static final Map<String, String> config = new HashMap<>(defaults);

	/** Dpi of the rendered AST images */
	public static int getGraphDpi(){
		try {
			return Integer.parseInt(config.get("graphDpi"));
		} catch (NumberFormatException e) {
			throw invalidValue("graphDpi", e);
		}
	}

	public static Path getDotFile(){
		return Paths.get(config.get("dotFile"));
	}

	public static Path getImageFile(){
		return Paths.get(config.get("imageFile"));
	}

	/** Render the dot file into an image after exporting it? */
	public static boolean renderImage(){
		return config.get("renderImage").equals("yes");
	}

	public static Path getLogFile(){
		return Paths.get(config.get("logFile"));
	}

	public static Level getLogLevel(){
		try {
			return Level.parse(config.get("logLevel"));
		} catch (IllegalArgumentException e) {
			throw invalidValue("logLevel", e);
		}
	}

	private static RebeccaException invalidValue(String key, Exception cause){
		return new RebeccaException(String.format("Invalid value \"%s\" for config key \"%s\"", config.get(key), key), cause);
	}

	public static String get(String key){
		return config.get(key);
	}

	/**
	 * Resets all keys to their defaults and applies the settings of the passed file (if it exists).
	 */
	public static void loadConfig(Path file){
		config.clear();
		config.putAll(defaults);
		if (!Files.exists(file)){
			return;
		}
		try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			String line;
			while ((line = reader.readLine()) != null){
				if (line.contains(" = ")){
					String[] parts = line.split(" = ", 2);
					String key = parts[0].trim();
					if (config.containsKey(key)){
						config.put(key, parts[1].trim());
					} else {
						LOG.warning("Unknown config key \"" + key + "\"");
					}
				}
			}
		} catch (IOException e) {
			throw new RebeccaException("Can't read config file " + file, e);
		}
	}

	static {
		loadConfig(Paths.get(configFile));
	}
}
