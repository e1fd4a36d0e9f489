package io.devguard.model;

/**
 * A production-readiness rule match found while scanning raw source text.
 *
 * @param ruleId   id of the matching rule
 * @param path     file the match was found in
 * @param line     1-based line of the match, 0 when the file itself is the match
 * @param excerpt  matched text, with secret-like values masked
 */
public record RiskMarker(String ruleId, String path, int line, String excerpt) {}
