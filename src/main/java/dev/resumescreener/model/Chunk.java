package dev.resumescreener.model;

/**
 * A fixed-size overlapping window of resume words.
 *
 * @param text                   the window's words joined by single spaces
 * @param sequenceIndex          position of the chunk in the document, starting at 0
 * @param startWord              index of the first word in the document's word sequence
 * @param wordCount              number of words in the window
 * @param overlapWithPredecessor words shared with the previous chunk, 0 for the first
 * @param jobContext             work-history entry associated with the chunk, or null
 */
public record Chunk(
        String text,
        int sequenceIndex,
        int startWord,
        int wordCount,
        int overlapWithPredecessor,
        WorkHistoryEntry jobContext) {

    public String vectorKey(String resumeId) {
        return resumeId + "_c" + sequenceIndex;
    }
}
