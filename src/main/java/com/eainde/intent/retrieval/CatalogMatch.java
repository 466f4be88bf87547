package com.eainde.intent.retrieval;

/**
 * One ranked hit from the semantic catalog index.
 *
 * @param catalogId catalog id stored with the indexed segment
 * @param name      catalog name
 * @param description catalog description
 * @param score     similarity in [0, 1]
 */
public record CatalogMatch(String catalogId, String name, String description, double score) {}
