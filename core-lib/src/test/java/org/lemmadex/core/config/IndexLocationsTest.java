package org.lemmadex.core.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class IndexLocationsTest {

	private static Properties baseProperties() {
		Properties p = new Properties();
		p.setProperty("index.lemma.source.dir", "tokenized_pages");
		p.setProperty("index.file", "inverted_index.txt");
		p.setProperty("index.registry.file", "index.txt");
		return p;
	}

	@Test
	public void testRelativePathsResolveAgainstDataVolume() {
		Properties p = baseProperties();
		p.setProperty("DATA_VOLUME_PATH", "/data");

		IndexLocations locations = IndexLocations.from(p);

		assertEquals(Path.of("/data/tokenized_pages"), locations.lemmaSourceDir());
		assertEquals(Path.of("/data/inverted_index.txt"), locations.indexFile());
		assertEquals(Path.of("/data/index.txt"), locations.registryFile());
	}

	@Test
	public void testAbsolutePathIsKept() {
		Properties p = baseProperties();
		p.setProperty("DATA_VOLUME_PATH", "/data");
		p.setProperty("index.file", "/srv/index/inverted_index.txt");

		assertEquals(Path.of("/srv/index/inverted_index.txt"), IndexLocations.from(p).indexFile());
	}

	@Test
	public void testMissingKeyFailsFast() {
		Properties p = baseProperties();
		p.remove("index.file");

		IllegalStateException e = assertThrows(IllegalStateException.class, () -> IndexLocations.from(p));
		assertTrue(e.getMessage().contains("index.file"));
	}

	@Test
	public void testInvalidIntegerNamesKey() {
		Properties p = new Properties();
		p.setProperty("server.port", "eighty");

		IllegalStateException e = assertThrows(IllegalStateException.class,
				() -> PropertiesSupport.requireInt(p, "server.port"));
		assertTrue(e.getMessage().contains("server.port"));
		assertEquals(42, PropertiesSupport.optionalInt(new Properties(), "server.port", 42));
	}
}
