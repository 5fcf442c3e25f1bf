package org.javai.aetherra.config;

import java.util.Objects;
import org.javai.aetherra.parse.ParseMode;

/**
 * Options for a compile invocation.
 *
 * @param parseMode error recovery policy of the parser
 * @param retainComments keep {@code #} comments as comment nodes
 * @param maxNestingDepth deepest block nesting accepted before the parser reports an error
 * @param defaultGoalPriority priority given to goals that declare none; {@code null} leaves it absent
 */
public record CompilerOptions(
		ParseMode parseMode,
		boolean retainComments,
		int maxNestingDepth,
		String defaultGoalPriority
) {

	public static final int DEFAULT_MAX_NESTING_DEPTH = 64;

	public CompilerOptions {
		Objects.requireNonNull(parseMode, "parseMode must not be null");
		if (maxNestingDepth < 1) {
			throw new IllegalArgumentException("maxNestingDepth must be at least 1, was " + maxNestingDepth);
		}
		if (defaultGoalPriority != null && defaultGoalPriority.isBlank()) {
			defaultGoalPriority = null;
		}
	}

	public static CompilerOptions defaults() {
		return new CompilerOptions(ParseMode.LENIENT, false, DEFAULT_MAX_NESTING_DEPTH, null);
	}

	public static CompilerOptions strict() {
		return defaults().withParseMode(ParseMode.STRICT);
	}

	public CompilerOptions withParseMode(ParseMode mode) {
		return new CompilerOptions(mode, retainComments, maxNestingDepth, defaultGoalPriority);
	}

	public CompilerOptions withRetainComments(boolean retain) {
		return new CompilerOptions(parseMode, retain, maxNestingDepth, defaultGoalPriority);
	}

	public CompilerOptions withMaxNestingDepth(int depth) {
		return new CompilerOptions(parseMode, retainComments, depth, defaultGoalPriority);
	}

	public CompilerOptions withDefaultGoalPriority(String priority) {
		return new CompilerOptions(parseMode, retainComments, maxNestingDepth, priority);
	}
}
