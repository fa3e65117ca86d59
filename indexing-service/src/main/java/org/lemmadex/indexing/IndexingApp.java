package org.lemmadex.indexing;

import org.lemmadex.indexing.bootstrap.IndexingBootstrap;

public class IndexingApp {
	public static void main(String[] args) {
		IndexingBootstrap.run(args);
	}
}
