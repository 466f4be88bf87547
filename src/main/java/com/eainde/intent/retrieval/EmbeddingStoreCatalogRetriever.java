package com.eainde.intent.retrieval;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingSearchResult;
import dev.langchain4j.store.embedding.EmbeddingStore;
import lombok.extern.log4j.Log4j2;

import java.util.List;

/**
 * {@link CatalogRetriever} backed by a LangChain4j {@link EmbeddingStore}.
 *
 * <p>The indexing pipeline stores one segment per catalog entry with metadata keys
 * {@code service_id}, {@code name} and {@code description}.</p>
 */
@Log4j2
public class EmbeddingStoreCatalogRetriever implements CatalogRetriever {

    static final String SERVICE_ID = "service_id";
    static final String NAME = "name";
    static final String DESCRIPTION = "description";

    private final EmbeddingModel embeddingModel;
    private final EmbeddingStore<TextSegment> embeddingStore;

    public EmbeddingStoreCatalogRetriever(EmbeddingModel embeddingModel, EmbeddingStore<TextSegment> embeddingStore) {
        this.embeddingModel = embeddingModel;
        this.embeddingStore = embeddingStore;
    }

    @Override
    public List<CatalogMatch> search(String query, int maxResults) {
        Embedding queryEmbedding = embeddingModel.embed(query).content();

        EmbeddingSearchRequest request = EmbeddingSearchRequest.builder()
                .queryEmbedding(queryEmbedding)
                .maxResults(maxResults)
                .build();
        EmbeddingSearchResult<TextSegment> result = embeddingStore.search(request);

        log.debug("Catalog search for '{}' returned {} matches", query, result.matches().size());
        return result.matches().stream()
                .map(EmbeddingStoreCatalogRetriever::toCatalogMatch)
                .toList();
    }

    private static CatalogMatch toCatalogMatch(EmbeddingMatch<TextSegment> match) {
        TextSegment segment = match.embedded();
        Metadata metadata = segment != null ? segment.metadata() : new Metadata();
        return new CatalogMatch(
                valueOr(metadata, SERVICE_ID, "unknown"),
                valueOr(metadata, NAME, "Unknown"),
                valueOr(metadata, DESCRIPTION, ""),
                match.score()
        );
    }

    private static String valueOr(Metadata metadata, String key, String fallback) {
        String value = metadata.getString(key);
        return value != null ? value : fallback;
    }
}
