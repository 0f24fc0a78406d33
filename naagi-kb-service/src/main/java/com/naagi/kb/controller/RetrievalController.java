package com.naagi.kb.controller;

import com.naagi.kb.embed.guard.DimensionMismatchException;
import com.naagi.kb.embed.llm.ProviderException;
import com.naagi.kb.retrieval.RetrievalRequest;
import com.naagi.kb.retrieval.RetrievalResponse;
import com.naagi.kb.service.RetrievalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/kb")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Retrieval", description = "Hybrid dense and lexical retrieval")
@CrossOrigin(origins = "*")
public class RetrievalController {

    private final RetrievalService retrievalService;

    @PostMapping("/retrieve")
    @Operation(summary = "Retrieve ranked chunks and packed contexts for a query")
    public ResponseEntity<?> retrieve(@RequestBody RetrievalRequest request) {
        log.info("Retrieval request: top_k={}, hybrid={}", request.topK(), request.hybridEnabled());
        try {
            RetrievalResponse response = retrievalService.retrieve(request);
            return ResponseEntity.ok(response);
        } catch (DimensionMismatchException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (ProviderException e) {
            log.error("Query embedding failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(Map.of("error", "Embedding provider failed: " + e.getMessage()));
        } catch (Exception e) {
            log.error("Retrieval failed", e);
            return ResponseEntity.internalServerError().body(Map.of("error", "Retrieval failed: " + e.getMessage()));
        }
    }
}
