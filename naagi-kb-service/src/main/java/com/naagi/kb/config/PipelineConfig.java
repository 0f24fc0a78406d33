package com.naagi.kb.config;

import com.naagi.kb.chunk.ChunkRunner;
import com.naagi.kb.chunk.ChunkingParams;
import com.naagi.kb.core.event.EmitFailureChannel;
import com.naagi.kb.core.event.EventSink;
import com.naagi.kb.core.event.EventSinkFactory;
import com.naagi.kb.core.event.NdjsonEventSink;
import com.naagi.kb.core.event.SafeEventSink;
import com.naagi.kb.core.run.RunLayout;
import com.naagi.kb.core.token.TokenCounter;
import com.naagi.kb.core.token.TokenCounters;
import com.naagi.kb.embed.llm.EmbeddingsClient;
import com.naagi.kb.embed.load.EmbedDispatcher;
import com.naagi.kb.embed.load.EmbedPipeline;
import com.naagi.kb.embed.preflight.PreflightChecker;
import com.naagi.kb.embed.preflight.PreflightSettings;
import com.naagi.kb.embed.retry.RetryPolicy;
import com.naagi.kb.embed.store.EmbeddingStore;
import com.naagi.kb.service.RecordingEmbedRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Chunking and ingestion components, built from {@link KbProperties}.
 */
@Configuration
@Slf4j
public class PipelineConfig {

    @Bean
    public RunLayout runLayout(KbProperties props) {
        Path root = Path.of(props.getRunsRoot()).toAbsolutePath().normalize();
        log.info("Run artifacts under {}", root);
        return new RunLayout(root);
    }

    @Bean
    public EmitFailureChannel emitFailureChannel() {
        return new EmitFailureChannel();
    }

    @Bean
    public EventSinkFactory eventSinkFactory(KbProperties props, RunLayout layout, EmitFailureChannel failures) {
        if (!props.getEvents().isEnabled()) {
            log.info("Structured event log disabled");
            return runId -> EventSink.NOOP;
        }
        return runId -> new SafeEventSink(new NdjsonEventSink(layout.eventsFile(runId)), failures);
    }

    @Bean
    public TokenCounter tokenCounter(KbProperties props) {
        TokenCounter counter = TokenCounters.create(props.getChunking().getTokenizer());
        log.info("Using tokenizer {}", counter.name());
        return counter;
    }

    @Bean
    public ChunkingParams chunkingParams(KbProperties props) {
        KbProperties.ChunkingConfig c = props.getChunking();
        ChunkingParams params = new ChunkingParams(c.getHardMaxTokens(), c.getOverlapTokens(), c.getSoftMinTokens(),
                c.getHardMinTokens(), c.isPreferHeadings(), c.isOrphanHeadingMerge(), c.isSmallTailMerge(),
                c.getMinCoverage());
        params.validate();
        return params;
    }

    @Bean
    public ChunkRunner chunkRunner(RunLayout layout, TokenCounter tokenCounter, ChunkingParams params,
                                   EventSinkFactory sinks) {
        return new ChunkRunner(layout, tokenCounter, params, sinks);
    }

    @Bean
    public RetryPolicy retryPolicy(KbProperties props) {
        KbProperties.RetryConfig r = props.getEmbed().getRetry();
        return new RetryPolicy(r.getMaxAttempts(), r.getInitialBackoff(), r.getMultiplier(), r.getMaxBackoff(),
                r.getJitterRatio());
    }

    @Bean
    public PreflightSettings preflightSettings(KbProperties props, EmbeddingsClient client) {
        KbProperties.EmbedConfig e = props.getEmbed();
        return new PreflightSettings(client.provider(), client.model(), e.getDimension(), e.getMinEmbedDocs(),
                e.getMinQuality(), props.getChunking().getTokenizer(), e.getSmallChunkTokens());
    }

    @Bean
    public PreflightChecker preflightChecker(RunLayout layout, EventSinkFactory sinks) {
        return new PreflightChecker(layout, sinks);
    }

    @Bean
    public EmbedPipeline embedPipeline(KbProperties props, RunLayout layout, PreflightChecker preflight,
                                       PreflightSettings settings, EmbeddingsClient client, EmbeddingStore store,
                                       RetryPolicy retry, EventSinkFactory sinks) {
        log.info("Embedding with provider={} model={} dimension={} into {} store",
                client.provider(), client.model(), settings.dimension(), props.getStore().getType());
        return new EmbedPipeline(layout, preflight, settings, client, store, retry,
                props.getEmbed().getBatchSize(), sinks);
    }

    @Bean(destroyMethod = "shutdown")
    public EmbedDispatcher embedDispatcher(KbProperties props, RecordingEmbedRunner runner) {
        return new EmbedDispatcher(runner, props.getEmbed().getWorkers());
    }
}
