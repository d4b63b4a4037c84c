package dev.resumescreener.service;

import dev.resumescreener.config.ChunkingConfig;
import dev.resumescreener.model.Chunk;
import dev.resumescreener.model.WorkHistoryEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Splits resume text into overlapping word windows and tags each window with the
 * work-history entry it most likely describes.
 */
@Slf4j
@Service
public class ChunkingService {

    private final int chunkWords;
    private final int overlapWords;

    @Autowired
    public ChunkingService(ChunkingConfig config) {
        this(config.getChunkWords(), config.getOverlapWords());
    }

    public ChunkingService(int chunkWords, int overlapWords) {
        if (chunkWords <= 0) {
            throw new IllegalArgumentException("chunkWords must be positive, got " + chunkWords);
        }
        if (overlapWords < 0 || overlapWords >= chunkWords) {
            throw new IllegalArgumentException(
                    "overlapWords must be in [0, chunkWords), got " + overlapWords + " for chunkWords " + chunkWords);
        }
        this.chunkWords = chunkWords;
        this.overlapWords = overlapWords;
    }

    /**
     * Chunk the text.
     *
     * @param text        normalized resume text
     * @param workHistory candidate jobs for job-context association, in any order
     * @return chunks in document order; empty for blank text
     * @throws IllegalArgumentException if text is null
     */
    public List<Chunk> chunk(String text, List<WorkHistoryEntry> workHistory) {
        if (text == null) {
            throw new IllegalArgumentException("Resume text must not be null");
        }
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        List<WorkHistoryEntry> jobs = workHistory == null ? List.of() : workHistory;

        String[] words = trimmed.split("\\s+");
        int step = chunkWords - overlapWords;
        List<Chunk> chunks = new ArrayList<>();

        int previousEnd = 0;
        for (int start = 0; ; start += step) {
            int end = Math.min(start + chunkWords, words.length);
            String chunkText = String.join(" ", Arrays.copyOfRange(words, start, end));
            int overlap = chunks.isEmpty() ? 0 : previousEnd - start;
            chunks.add(new Chunk(chunkText, chunks.size(), start, end - start, overlap,
                    bestJobContext(chunkText, jobs)));
            previousEnd = end;
            if (end >= words.length) {
                break;
            }
        }

        log.debug("Chunked {} words into {} chunks", words.length, chunks.size());
        return chunks;
    }

    /**
     * Highest keyword-overlap entry; ties go to the most recent start, then to list order.
     * Null when no entry has any keyword in the chunk.
     */
    WorkHistoryEntry bestJobContext(String chunkText, List<WorkHistoryEntry> jobs) {
        String haystack = chunkText.toLowerCase(Locale.ROOT);
        WorkHistoryEntry best = null;
        int bestCount = 0;
        YearMonth bestStart = null;

        for (WorkHistoryEntry job : jobs) {
            if (job == null) {
                continue;
            }
            int count = keywordCount(haystack, job);
            if (count == 0) {
                continue;
            }
            YearMonth start = WorkPeriods.parseStart(job.getStartPeriod()).orElse(null);
            if (count > bestCount || (count == bestCount && isMoreRecent(start, bestStart))) {
                best = job;
                bestCount = count;
                bestStart = start;
            }
        }
        return best;
    }

    static int keywordCount(String haystack, WorkHistoryEntry job) {
        int count = occurrences(haystack, job.getCompany()) + occurrences(haystack, job.getTitle());
        for (String tech : job.getTechnologies()) {
            count += occurrences(haystack, tech);
        }
        return count;
    }

    static int occurrences(String haystack, String keyword) {
        if (keyword == null || keyword.isBlank()) {
            return 0;
        }
        String needle = keyword.trim().toLowerCase(Locale.ROOT);
        int count = 0;
        int from = haystack.indexOf(needle);
        while (from != -1) {
            count++;
            from = haystack.indexOf(needle, from + needle.length());
        }
        return count;
    }

    private static boolean isMoreRecent(YearMonth candidate, YearMonth current) {
        if (candidate == null) {
            return false;
        }
        return current == null || candidate.isAfter(current);
    }
}
