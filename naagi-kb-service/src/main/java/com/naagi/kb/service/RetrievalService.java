package com.naagi.kb.service;

import com.naagi.kb.metrics.KbMetrics;
import com.naagi.kb.retrieval.HybridRetriever;
import com.naagi.kb.retrieval.RetrievalRequest;
import com.naagi.kb.retrieval.RetrievalResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RetrievalService {

    private final HybridRetriever retriever;
    private final KbMetrics metrics;

    public RetrievalResponse retrieve(RetrievalRequest request) {
        try {
            RetrievalResponse response = retriever.retrieve(request);
            metrics.recordRetrieval(response.durationMs(), response.hits().size());
            return response;
        } catch (RuntimeException e) {
            metrics.recordRetrievalError();
            throw e;
        }
    }
}
