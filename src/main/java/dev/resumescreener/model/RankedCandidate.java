package dev.resumescreener.model;

/**
 * A vector-index hit after hybrid re-ranking.
 *
 * @param hit          the raw hit
 * @param originalRank position in the index's result list, used to break ties
 * @param boostedScore similarity after the keyword boost
 * @param keywordHit   whether the skill name occurs literally in the chunk
 */
public record RankedCandidate(VectorHit hit, int originalRank, double boostedScore, boolean keywordHit) {
}
