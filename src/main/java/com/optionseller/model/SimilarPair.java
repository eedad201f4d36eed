package com.optionseller.model;

/**
 * A call and a put whose prices are close to each other, keyed by how far apart
 * their strikes are.
 */
public record SimilarPair(double strikeDistance, QuotedStrike call, QuotedStrike put) {
}
