package org.javai.aetherra.config;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.aetherra.parse.ParseMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads {@link CompilerOptions} from YAML.
 * <p>
 * Recognised keys:
 * <pre>
 * parse-mode: lenient          # or strict
 * retain-comments: false
 * max-nesting-depth: 64
 * default-goal-priority: medium
 * </pre>
 * Missing keys keep the value of {@link CompilerOptions#defaults()}; unknown keys are logged and ignored.
 */
public class CompilerOptionsLoader {

	private static final Logger logger = LoggerFactory.getLogger(CompilerOptionsLoader.class);

	public static final String DEFAULT_RESOURCE = "META-INF/aetherra-compiler.yml";

	private static final String PARSE_MODE = "parse-mode";
	private static final String RETAIN_COMMENTS = "retain-comments";
	private static final String MAX_NESTING_DEPTH = "max-nesting-depth";
	private static final String DEFAULT_GOAL_PRIORITY = "default-goal-priority";
	private static final Set<String> KNOWN_KEYS = Set.of(PARSE_MODE, RETAIN_COMMENTS, MAX_NESTING_DEPTH, DEFAULT_GOAL_PRIORITY);

	private final Yaml yaml = new Yaml();

	/**
	 * Load options from {@link #DEFAULT_RESOURCE} on the given class loader, or the defaults if it is absent.
	 */
	public CompilerOptions loadDefault(ClassLoader loader) {
		Objects.requireNonNull(loader, "loader must not be null");
		if (loader.getResource(DEFAULT_RESOURCE) == null) {
			logger.debug("No {} on the classpath; using built-in defaults", DEFAULT_RESOURCE);
			return CompilerOptions.defaults();
		}
		return loadResource(DEFAULT_RESOURCE, loader);
	}

	/**
	 * Load options from a classpath resource.
	 *
	 * @throws IllegalArgumentException if the resource cannot be found
	 * @throws IllegalStateException if the resource cannot be read or holds invalid values
	 */
	public CompilerOptions loadResource(String resourcePath, ClassLoader loader) {
		Objects.requireNonNull(resourcePath, "resourcePath must not be null");
		Objects.requireNonNull(loader, "loader must not be null");
		try (InputStream is = loader.getResourceAsStream(resourcePath)) {
			if (is == null) {
				throw new IllegalArgumentException("Resource not found: " + resourcePath);
			}
			CompilerOptions options = build(yaml.load(is));
			logger.info("Loaded compiler options from {}: {}", resourcePath, options);
			return options;
		} catch (IllegalArgumentException | IllegalStateException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to load compiler options from resource: " + resourcePath, e);
		}
	}

	/**
	 * Load options from a YAML file.
	 */
	public CompilerOptions load(Path path) {
		Objects.requireNonNull(path, "path must not be null");
		try (Reader reader = Files.newBufferedReader(path)) {
			return load(reader);
		} catch (IllegalStateException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to load compiler options from path: " + path, e);
		}
	}

	public CompilerOptions load(Reader reader) {
		Objects.requireNonNull(reader, "reader must not be null");
		return build(yaml.load(reader));
	}

	public CompilerOptions loadString(String yamlContent) {
		Objects.requireNonNull(yamlContent, "yamlContent must not be null");
		return build(yaml.load(yamlContent));
	}

	private CompilerOptions build(Object loaded) {
		CompilerOptions options = CompilerOptions.defaults();
		if (loaded == null) {
			return options;
		}
		if (!(loaded instanceof Map<?, ?> data)) {
			throw new IllegalStateException("Compiler options must be a YAML mapping, found: "
					+ loaded.getClass().getSimpleName());
		}

		for (Map.Entry<?, ?> entry : data.entrySet()) {
			String key = String.valueOf(entry.getKey());
			Object value = entry.getValue();
			if (!KNOWN_KEYS.contains(key)) {
				logger.warn("Ignoring unknown compiler option '{}'", key);
				continue;
			}
			if (value == null) {
				continue;
			}
			options = switch (key) {
				case PARSE_MODE -> options.withParseMode(parseMode(value));
				case RETAIN_COMMENTS -> options.withRetainComments(bool(key, value));
				case MAX_NESTING_DEPTH -> options.withMaxNestingDepth(positiveInt(key, value));
				case DEFAULT_GOAL_PRIORITY -> options.withDefaultGoalPriority(String.valueOf(value));
				default -> options;
			};
		}
		return options;
	}

	private ParseMode parseMode(Object value) {
		String text = String.valueOf(value).trim().toUpperCase(Locale.ROOT);
		try {
			return ParseMode.valueOf(text);
		} catch (IllegalArgumentException e) {
			throw new IllegalStateException("Invalid value for '" + PARSE_MODE + "': " + value
					+ " (expected lenient or strict)", e);
		}
	}

	private boolean bool(String key, Object value) {
		if (value instanceof Boolean b) {
			return b;
		}
		throw new IllegalStateException("Invalid value for '" + key + "': " + value + " (expected true or false)");
	}

	private int positiveInt(String key, Object value) {
		if (value instanceof Integer i && i > 0) {
			return i;
		}
		throw new IllegalStateException("Invalid value for '" + key + "': " + value + " (expected a positive integer)");
	}
}
