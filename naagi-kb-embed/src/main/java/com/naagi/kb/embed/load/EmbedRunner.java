package com.naagi.kb.embed.load;

import java.util.function.BooleanSupplier;

/**
 * Embeds one run to completion on the calling thread.
 */
@FunctionalInterface
public interface EmbedRunner {

    EmbedRunSummary run(String runId, BooleanSupplier stopRequested);
}
