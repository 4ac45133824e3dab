package cfgprep;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Global settings, read from an ini like file with {@code key = value} lines.
 *
 * The file is {@code cfgprep.ini} in the working directory, or the file named by the system property
 * {@code cfgprep.config}. Missing keys keep their defaults.
 */
public class Config {

	private static final Logger LOG = Logger.getLogger(Config.class.getName());

	public static final String configFile = "cfgprep.ini";

	public static final String configFileProperty = "cfgprep.config";

	private static final Map<String, String> defaults = new HashMap<String, String>(){{
		put("maxRecognitionSteps", "0");
		put("generatorDepth", "12");
		put("logLevel", "INFO");
	}};

	private static final Map<String, String> config = new HashMap<>(defaults);

	/**
	 * Maximum number of search steps per recognized word, 0 means unlimited.
	 */
	public static long maxRecognitionSteps(){
		return Long.parseLong(get("maxRecognitionSteps"));
	}

	/**
	 * Expansion depth after which the sentence generator only uses shortest derivations.
	 */
	public static int generatorDepth(){
		return Integer.parseInt(get("generatorDepth"));
	}

	public static Level logLevel(){
		return Level.parse(get("logLevel"));
	}

	public static synchronized String get(String key){
		if (!config.containsKey(key)){
			throw new IllegalArgumentException("Unknown config key \"" + key + "\"");
		}
		return config.get(key);
	}

	/**
	 * Overrides a config value for the rest of the run.
	 */
	public static synchronized void set(String key, String value){
		if (!defaults.containsKey(key)){
			throw new IllegalArgumentException("Unknown config key \"" + key + "\"");
		}
		config.put(key, value);
	}

	/**
	 * Restores all defaults and reloads the config file.
	 */
	public static synchronized void reset(){
		config.clear();
		config.putAll(defaults);
		loadConfig();
	}

	static synchronized void loadConfig(File file) throws IOException {
		try (BufferedReader reader = new BufferedReader(new FileReader(file))) {
			String line;
			while ((line = reader.readLine()) != null){
				if (line.contains("=") && !line.trim().startsWith("#")){
					String[] parts = line.split("=", 2);
					String key = parts[0].trim();
					if (defaults.containsKey(key)){
						config.put(key, parts[1].trim());
					} else {
						LOG.warning("Unknown config key \"" + key + "\" in " + file);
					}
				}
			}
		}
	}

	private static void loadConfig(){
		File file = new File(System.getProperty(configFileProperty, configFile));
		if (!file.exists()){
			return;
		}
		try {
			loadConfig(file);
		} catch (IOException e) {
			throw new GrammarException("Can't read config file " + file, e);
		}
	}

	static {
		loadConfig();
	}
}
