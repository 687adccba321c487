package gramlab;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Global settings, read from a <code>gramlab.ini</code> on the class path and from a
 * <code>gramlab.ini</code> in the working directory (the latter wins).
 *
 * Each setting is a line of the form <code>key = value</code>.
 */
public class Config {

	public static final String configFile = "gramlab.ini";

	public static final Logger LOG = Logger.getLogger("Config");

	private static final Map<String, String> config = new HashMap<String, String>(){{
		put("logLevel", "INFO");
		put("maxSteps", "10000");
	}};

	/**
	 * Level of the gramlab loggers
	 */
	public static Level logLevel(){
		try {
			return Level.parse(config.get("logLevel"));
		} catch (IllegalArgumentException e) {
			LOG.warning("Invalid log level \"" + config.get("logLevel") + "\", using INFO");
			return Level.INFO;
		}
	}

	/**
	 * Maximum number of descriptions explored by a search before giving up
	 */
	public static int maxSteps(){
		try {
			return Integer.parseInt(config.get("maxSteps"));
		} catch (NumberFormatException e) {
			throw new GramlabException("Invalid maxSteps value \"" + config.get("maxSteps") + "\"", e);
		}
	}

	/**
	 * Parse the lines of a config file and put the known keys into the passed map.
	 */
	static void load(BufferedReader reader, Map<String, String> target) throws IOException {
		String line;
		while ((line = reader.readLine()) != null){
			if (line.contains(" = ")){
				String[] parts = line.split(" = ", 2);
				String key = parts[0].trim();
				if (target.containsKey(key)){
					target.put(key, parts[1].trim());
				} else {
					LOG.warning("Unknown config key \"" + key + "\"");
				}
			}
		}
	}

	private static void loadConfig(){
		try (InputStream stream = Config.class.getClassLoader().getResourceAsStream(configFile)) {
			if (stream != null){
				load(new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8)), config);
			}
			File file = new File(configFile);
			if (file.exists()){
				try (BufferedReader reader = new BufferedReader(new FileReader(file, StandardCharsets.UTF_8))) {
					load(reader, config);
				}
			}
		} catch (IOException e) {
			LOG.log(Level.WARNING, "Can't read " + configFile + ", using the defaults", e);
		}
	}

	static {
		loadConfig();
	}
}
