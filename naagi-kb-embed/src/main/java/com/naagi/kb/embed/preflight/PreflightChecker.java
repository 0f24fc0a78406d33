package com.naagi.kb.embed.preflight;

import com.naagi.kb.core.event.EventSink;
import com.naagi.kb.core.event.EventSinkFactory;
import com.naagi.kb.core.event.KbEvent;
import com.naagi.kb.core.io.ArtifactFormatException;
import com.naagi.kb.core.io.EnrichedDocumentReader;
import com.naagi.kb.core.io.NdjsonChunkSource;
import com.naagi.kb.core.io.NdjsonFiles;
import com.naagi.kb.core.model.Chunk;
import com.naagi.kb.core.model.Document;
import com.naagi.kb.core.run.RunLayout;
import com.naagi.kb.core.token.TokenCounters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Decides whether a run may be embedded. Only structural problems block a run;
 * the share of small chunks is reported but never gates.
 */
public class PreflightChecker {

    private static final Logger log = LoggerFactory.getLogger(PreflightChecker.class);

    private final RunLayout layout;
    private final EventSinkFactory sinks;

    public PreflightChecker(RunLayout layout, EventSinkFactory sinks) {
        this.layout = layout;
        this.sinks = sinks;
    }

    public PreflightReport check(String runId, PreflightSettings settings) {
        EventSink events = sinks.forRun(runId);
        events.emit(KbEvent.of("preflight.start", runId, Map.of("provider", String.valueOf(settings.provider()))));

        List<PreflightReason> reasons = new ArrayList<>();
        Path enriched = layout.enrichedFile(runId);
        Path chunksFile = layout.chunksFile(runId);
        boolean hasEnrich = RunLayout.hasContent(enriched);
        boolean hasChunks = RunLayout.hasContent(chunksFile);
        if (!hasEnrich) reasons.add(PreflightReason.MISSING_ENRICH);
        if (!hasChunks) reasons.add(PreflightReason.MISSING_CHUNKS);
        if (!TokenCounters.isAvailable(settings.tokenizer())) reasons.add(PreflightReason.TOKENIZER_MISSING);
        List<String> problems = settings.problems();
        if (!problems.isEmpty()) reasons.add(PreflightReason.CONFIG_INVALID);

        int totalDocs = 0;
        int embeddable = 0;
        int totalChunks = 0;
        double belowPct = 0.0;
        List<String> skipList = List.of();
        if (hasEnrich && hasChunks) {
            Path reading = enriched;
            try {
                Set<String> skip = new TreeSet<>();
                Set<String> docIds = new HashSet<>();
                for (Document d : EnrichedDocumentReader.readAll(enriched)) {
                    docIds.add(d.docId());
                    if (d.getQualityScoreOrDefault() < settings.minQuality()) skip.add(d.docId());
                }

                reading = chunksFile;
                Set<String> chunkedDocs = new HashSet<>();
                int small = 0;
                int chunkCount = 0;
                try (Stream<Chunk> chunks = new NdjsonChunkSource(chunksFile).chunks()) {
                    Iterator<Chunk> it = chunks.iterator();
                    while (it.hasNext()) {
                        Chunk c = it.next();
                        chunkCount++;
                        chunkedDocs.add(c.docId());
                        if (c.tokenCount() < settings.smallChunkTokens()) small++;
                    }
                }
                chunkedDocs.retainAll(docIds);
                chunkedDocs.removeAll(skip);
                totalDocs = docIds.size();
                totalChunks = chunkCount;
                embeddable = chunkedDocs.size();
                belowPct = totalChunks == 0 ? 0.0 : 100.0 * small / totalChunks;
                skipList = new ArrayList<>(skip);
                if (embeddable < settings.minEmbedDocs()) reasons.add(PreflightReason.EMBEDDABLE_DOCS_ZERO);
            } catch (ArtifactFormatException e) {
                // An unreadable artifact is as unusable as a missing one.
                log.warn("Preflight cannot read {} for run {}: {}", reading.getFileName(), runId, e.getMessage());
                reasons.add(reading.equals(enriched) ? PreflightReason.MISSING_ENRICH : PreflightReason.MISSING_CHUNKS);
            }
        }

        PreflightStatus status = reasons.isEmpty() ? PreflightStatus.READY : PreflightStatus.BLOCKED;
        PreflightReport report = new PreflightReport(runId, status, reasons, embeddable, totalDocs, totalChunks,
                belowPct, skipList, problems, settings.provider(), settings.model(), settings.dimension(), Instant.now());

        NdjsonFiles.writeJson(layout.preflightFile(runId), report);
        NdjsonFiles.writeJson(layout.skipListFile(runId), new SkipList(runId, settings.minQuality(), skipList));

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("status", status.name());
        fields.put("reasons", reasons.stream().map(Enum::name).toList());
        fields.put("embeddable_docs", embeddable);
        fields.put("below_threshold_pct", belowPct);
        events.emit(KbEvent.of("preflight.complete", runId, fields));

        if (status == PreflightStatus.BLOCKED) {
            log.warn("Preflight BLOCKED for run {}: {} {}", runId, reasons, problems);
        } else {
            log.info("Preflight READY for run {}: {} embeddable docs, {} skipped, {}% small chunks",
                    runId, embeddable, skipList.size(), String.format("%.1f", belowPct));
        }
        return report;
    }

    /**
     * Runs preflight for each run and splits them into ready and blocked.
     */
    public PlanReport plan(List<String> runIds, PreflightSettings settings) {
        List<String> ready = new ArrayList<>();
        Map<String, List<PreflightReason>> blocked = new LinkedHashMap<>();
        int docs = 0;
        int chunks = 0;
        for (String runId : runIds) {
            PreflightReport r = check(runId, settings);
            if (r.isReady()) {
                ready.add(runId);
                docs += r.embeddableDocs();
                chunks += r.totalChunks();
            } else {
                blocked.put(runId, r.reasons());
            }
        }
        return new PlanReport(ready, blocked, docs, chunks);
    }
}
