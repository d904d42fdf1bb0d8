package org.lexicon.indexing.store;

public record TermCount(String term, long count) {}
