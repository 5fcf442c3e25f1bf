package org.javai.aetherra.parse;

/**
 * Error recovery policy of the parser.
 */
public enum ParseMode {

	/**
	 * Record the error, skip to the next statement boundary and keep parsing.
	 */
	LENIENT,

	/**
	 * Abort at the first syntax error.
	 */
	STRICT
}
