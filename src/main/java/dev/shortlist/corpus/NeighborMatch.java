package dev.shortlist.corpus;

/**
 * A single nearest-neighbour hit returned by a {@link DocumentStore}.
 *
 * @param key stable identity of the matched passage
 * @param content the matched passage text
 * @param distance embedding distance to the query (smaller is closer)
 */
public record NeighborMatch(String key, String content, double distance) {}
