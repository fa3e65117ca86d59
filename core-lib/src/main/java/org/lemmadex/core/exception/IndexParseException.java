package org.lemmadex.core.exception;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when a persisted index line carries a document id that is not a decimal integer.
 */
public class IndexParseException extends IOException {
	private final Path file;
	private final int lineNumber;

	public IndexParseException(Path file, int lineNumber, String line, Throwable cause) {
		super("Invalid index line " + lineNumber + " in " + file + ": '" + line + "'", cause);
		this.file = file;
		this.lineNumber = lineNumber;
	}

	public Path getFile() {
		return file;
	}

	public int getLineNumber() {
		return lineNumber;
	}
}
