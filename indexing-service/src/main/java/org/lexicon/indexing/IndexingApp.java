package org.lexicon.indexing;

import org.lexicon.indexing.bootstrap.IndexingBootstrap;

public class IndexingApp {
	public static void main(String[] args) {
		IndexingBootstrap.run();
	}
}
