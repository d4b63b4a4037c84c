package dev.resumescreener.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for resume ingestion and scoring.
 */
@Component
public class ScreeningMetrics {

    private static final String TAG_PROMPT = "prompt_type";
    private final MeterRegistry registry;

    // Counters
    private final Counter resumesIngestedCounter;
    private final Counter ingestionFailuresCounter;
    private final Counter scoringRequestsCounter;
    private final Counter skillsDegradedCounter;
    private final Counter embeddingCallsCounter;
    private final Counter embeddingErrorsCounter;

    // Timers
    private final Timer ingestionTimer;
    private final Timer scoringTimer;
    private final ConcurrentHashMap<String, Timer> oracleTimers = new ConcurrentHashMap<>();

    // Gauges
    private final AtomicInteger lastOverallScore = new AtomicInteger(0);
    private final AtomicInteger lastChunkCount = new AtomicInteger(0);

    public ScreeningMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.resumesIngestedCounter = Counter.builder("resume_screener_resumes_ingested_total")
                .description("Total resumes ingested")
                .register(registry);

        this.ingestionFailuresCounter = Counter.builder("resume_screener_ingestion_failures_total")
                .description("Total resume ingestions that failed")
                .register(registry);

        this.scoringRequestsCounter = Counter.builder("resume_screener_scoring_requests_total")
                .description("Total completed scoring requests")
                .register(registry);

        this.skillsDegradedCounter = Counter.builder("resume_screener_skills_degraded_total")
                .description("Skills scored as unmatched because evidence was unavailable")
                .register(registry);

        this.embeddingCallsCounter = Counter.builder("resume_screener_embedding_calls_total")
                .description("Total embedding calls")
                .register(registry);

        this.embeddingErrorsCounter = Counter.builder("resume_screener_embedding_errors_total")
                .description("Total failed embedding calls")
                .register(registry);

        this.ingestionTimer = Timer.builder("resume_screener_ingestion_duration")
                .description("Time to ingest one resume")
                .register(registry);

        this.scoringTimer = Timer.builder("resume_screener_scoring_duration")
                .description("Time to score one resume against one job")
                .register(registry);

        Gauge.builder("resume_screener_last_overall_score", lastOverallScore, AtomicInteger::get)
                .description("Overall score of the last scoring request")
                .register(registry);

        Gauge.builder("resume_screener_last_chunk_count", lastChunkCount, AtomicInteger::get)
                .description("Chunks produced by the last ingestion")
                .register(registry);
    }

    /**
     * Get or create the latency timer for one prompt type.
     */
    public Timer getOracleTimer(String promptType) {
        return oracleTimers.computeIfAbsent(promptType, type ->
                Timer.builder("resume_screener_oracle_call_duration")
                        .description("Oracle call latency, including retries")
                        .tag(TAG_PROMPT, type)
                        .register(registry)
        );
    }

    public void recordOracleCall(String promptType) {
        Counter.builder("resume_screener_oracle_calls_total")
                .tag(TAG_PROMPT, promptType)
                .register(registry)
                .increment();
    }

    public void recordOracleRetry(String promptType) {
        Counter.builder("resume_screener_oracle_retries_total")
                .tag(TAG_PROMPT, promptType)
                .register(registry)
                .increment();
    }

    public void recordOracleError(String promptType, String errorType) {
        Counter.builder("resume_screener_oracle_errors_total")
                .tag(TAG_PROMPT, promptType)
                .tag("error", errorType)
                .register(registry)
                .increment();
    }

    public void recordOracleCacheHit(String promptType) {
        Counter.builder("resume_screener_oracle_cache_hits_total")
                .tag(TAG_PROMPT, promptType)
                .register(registry)
                .increment();
    }

    public void recordEmbeddingCall() {
        embeddingCallsCounter.increment();
    }

    public void recordEmbeddingError() {
        embeddingErrorsCounter.increment();
    }

    public void recordResumeIngested(int chunkCount, long durationMs) {
        resumesIngestedCounter.increment();
        lastChunkCount.set(chunkCount);
        ingestionTimer.record(Duration.ofMillis(durationMs));
    }

    public void recordIngestionFailure() {
        ingestionFailuresCounter.increment();
    }

    public void recordScoringCompleted(int overallScore, long durationMs) {
        scoringRequestsCounter.increment();
        lastOverallScore.set(overallScore);
        scoringTimer.record(Duration.ofMillis(durationMs));
    }

    public void recordSkillDegraded() {
        skillsDegradedCounter.increment();
    }
}
