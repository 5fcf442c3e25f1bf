package org.javai.aetherra.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.Level;
import org.javai.aetherra.parse.ParseMode;
import org.javai.aetherra.testsupport.LogCapture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompilerOptionsLoaderTest {

	private final CompilerOptionsLoader loader = new CompilerOptionsLoader();

	private ClassLoader classLoader() {
		return getClass().getClassLoader();
	}

	@Test
	void loadsAllKnownKeys() {
		CompilerOptions options = loader.loadString("""
				parse-mode: STRICT
				retain-comments: true
				max-nesting-depth: 3
				default-goal-priority: low
				""");

		assertThat(options).isEqualTo(new CompilerOptions(ParseMode.STRICT, true, 3, "low"));
	}

	@Test
	void missingKeysKeepDefaults() {
		assertThat(loader.loadString("retain-comments: true"))
				.isEqualTo(CompilerOptions.defaults().withRetainComments(true));
		assertThat(loader.loadString("")).isEqualTo(CompilerOptions.defaults());
	}

	@Test
	void unknownKeysAreLoggedAndIgnored() {
		try (LogCapture capture = LogCapture.of(CompilerOptionsLoader.class, Level.WARN)) {
			CompilerOptions options = loader.loadString("parse-mode: strict\noptimise: yes");

			assertThat(options.parseMode()).isEqualTo(ParseMode.STRICT);
			assertThat(capture.messagesAt(Level.WARN)).containsExactly("Ignoring unknown compiler option 'optimise'");
		}
	}

	@Test
	void invalidValuesNameTheKey() {
		assertThatThrownBy(() -> loader.loadString("parse-mode: relaxed"))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("'parse-mode'")
				.hasMessageContaining("relaxed");
		assertThatThrownBy(() -> loader.loadString("retain-comments: sometimes"))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("'retain-comments'");
		assertThatThrownBy(() -> loader.loadString("max-nesting-depth: 0"))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("'max-nesting-depth'");
	}

	@Test
	void loadsClasspathResource() {
		CompilerOptions options = loader.loadResource("config/strict-compiler.yml", classLoader());

		assertThat(options).isEqualTo(new CompilerOptions(ParseMode.STRICT, true, 8, "medium"));
	}

	@Test
	void missingResourceIsRejected() {
		assertThatThrownBy(() -> loader.loadResource("config/absent.yml", classLoader()))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Resource not found: config/absent.yml");
	}

	@Test
	void resourceMustHoldAMapping() {
		assertThatThrownBy(() -> loader.loadResource("config/not-a-mapping.yml", classLoader()))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("must be a YAML mapping");
	}

	@Test
	void loadDefaultReadsBundledResource() {
		assertThat(loader.loadDefault(classLoader())).isEqualTo(CompilerOptions.defaults());
	}

	@Test
	void loadsFile(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("compiler.yml");
		Files.writeString(file, "max-nesting-depth: 12\n");

		assertThat(loader.load(file)).isEqualTo(CompilerOptions.defaults().withMaxNestingDepth(12));
	}

	@Test
	void missingFileIsRejected(@TempDir Path dir) {
		assertThatThrownBy(() -> loader.load(dir.resolve("absent.yml")))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("absent.yml");
	}

	@Test
	void optionsValidateTheirValues() {
		assertThatThrownBy(() -> CompilerOptions.defaults().withMaxNestingDepth(0))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("maxNestingDepth must be at least 1, was 0");
		assertThat(CompilerOptions.defaults().withDefaultGoalPriority("  ").defaultGoalPriority()).isNull();
		assertThat(CompilerOptions.strict().parseMode()).isEqualTo(ParseMode.STRICT);
	}
}
