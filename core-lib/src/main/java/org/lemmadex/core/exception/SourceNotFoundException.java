package org.lemmadex.core.exception;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Indicates that a required input artifact (the lemma source directory or the persisted index) is missing.
 */
public class SourceNotFoundException extends IOException {
	private final Path location;

	public SourceNotFoundException(Path location, String message) {
		super(message);
		this.location = location;
	}

	public Path getLocation() {
		return location;
	}
}
