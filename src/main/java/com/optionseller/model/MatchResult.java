package com.optionseller.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a strike match. Either both legs are present, or neither is and the
 * near-match list may carry candidates for the operator to look at.
 */
public final class MatchResult {

    private static final MatchResult NO_MATCH = new MatchResult(null, null, List.of());

    private final QuotedStrike call;
    private final QuotedStrike put;
    private final List<SimilarPair> nearMatches;

    private MatchResult(QuotedStrike call, QuotedStrike put, List<SimilarPair> nearMatches) {
        this.call = call;
        this.put = put;
        this.nearMatches = List.copyOf(nearMatches);
    }

    public static MatchResult matched(QuotedStrike call, QuotedStrike put) {
        if (call == null || put == null) {
            throw new IllegalArgumentException("A match needs both a call and a put leg");
        }
        return new MatchResult(call, put, List.of());
    }

    public static MatchResult noMatch() {
        return NO_MATCH;
    }

    public static MatchResult noMatch(List<SimilarPair> nearMatches) {
        return new MatchResult(null, null, nearMatches);
    }

    public boolean isMatched() {
        return call != null;
    }

    public Optional<QuotedStrike> getCall() {
        return Optional.ofNullable(call);
    }

    public Optional<QuotedStrike> getPut() {
        return Optional.ofNullable(put);
    }

    public List<SimilarPair> getNearMatches() {
        return nearMatches;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MatchResult other)) {
            return false;
        }
        return Objects.equals(call, other.call)
                && Objects.equals(put, other.put)
                && nearMatches.equals(other.nearMatches);
    }

    @Override
    public int hashCode() {
        return Objects.hash(call, put, nearMatches);
    }

    @Override
    public String toString() {
        return isMatched()
                ? "MatchResult{call=" + call + ", put=" + put + "}"
                : "MatchResult{noMatch, nearMatches=" + nearMatches.size() + "}";
    }
}
