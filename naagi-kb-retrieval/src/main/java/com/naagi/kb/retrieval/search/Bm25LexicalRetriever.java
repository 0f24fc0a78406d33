package com.naagi.kb.retrieval.search;

import com.naagi.kb.embed.store.InMemoryEmbeddingStore;
import com.naagi.kb.embed.store.StoredChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * BM25 leg over the chunks held by an {@link InMemoryEmbeddingStore}. The index follows the
 * store: new or changed chunks are (re)indexed and removed chunks dropped before each search.
 */
public class Bm25LexicalRetriever implements LexicalRetriever {

    private static final Logger log = LoggerFactory.getLogger(Bm25LexicalRetriever.class);

    private final InMemoryEmbeddingStore store;
    private final BM25Index index = new BM25Index();
    private final Map<String, String> indexedHashes = new HashMap<>();

    public Bm25LexicalRetriever(InMemoryEmbeddingStore store) {
        this.store = store;
    }

    @Override
    public List<Candidate> search(String query, int topK, CandidateFilter filter) {
        refresh();
        List<Candidate> out = new ArrayList<>();
        for (BM25Index.Scored s : index.search(query, topK, id -> {
            StoredChunk c = store.chunk(id);
            return c != null && filter.accepts(c.spaceKey(), c.title(), c.doctype());
        })) {
            StoredChunk c = store.chunk(s.chunkId());
            if (c != null) out.add(InMemoryDenseRetriever.toCandidate(c, s.score()));
        }
        return out;
    }

    synchronized void refresh() {
        Set<String> seen = new HashSet<>();
        int changed = 0;
        for (StoredChunk c : store.chunks()) {
            seen.add(c.chunkId());
            if (!c.contentSha256().equals(indexedHashes.get(c.chunkId()))) {
                index.index(c.chunkId(), c.docId(), c.text());
                indexedHashes.put(c.chunkId(), c.contentSha256());
                changed++;
            }
        }
        List<String> gone = indexedHashes.keySet().stream().filter(id -> !seen.contains(id)).toList();
        for (String id : gone) {
            index.remove(id);
            indexedHashes.remove(id);
        }
        if (changed > 0 || !gone.isEmpty()) {
            log.debug("BM25 index refreshed: {} indexed, {} removed, size {}", changed, gone.size(), index.size());
        }
    }
}
