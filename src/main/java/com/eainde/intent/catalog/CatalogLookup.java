package com.eainde.intent.catalog;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Outcome of a {@link CatalogStore} lookup.
 */
public class CatalogLookup {

    public enum Kind {
        FOUND,
        NOT_FOUND,
        MALFORMED,
        IO_FAILURE
    }

    private final Kind kind;
    private final String key;
    private final JsonNode record;
    private final String detail;

    private CatalogLookup(Kind kind, String key, JsonNode record, String detail) {
        this.kind = kind;
        this.key = key;
        this.record = record;
        this.detail = detail;
    }

    public static CatalogLookup found(String key, JsonNode record) {
        return new CatalogLookup(Kind.FOUND, key, record, null);
    }

    public static CatalogLookup notFound(String key) {
        return new CatalogLookup(Kind.NOT_FOUND, key, null, null);
    }

    public static CatalogLookup malformed(String key, String detail) {
        return new CatalogLookup(Kind.MALFORMED, key, null, detail);
    }

    public static CatalogLookup ioFailure(String key, String detail) {
        return new CatalogLookup(Kind.IO_FAILURE, key, null, detail);
    }

    public Kind getKind() {
        return kind;
    }

    public String getKey() {
        return key;
    }

    public boolean isFound() {
        return kind == Kind.FOUND;
    }

    public Optional<JsonNode> getRecord() {
        return Optional.ofNullable(record);
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return "CatalogLookup{" + kind + ", key='" + key + "'" + (detail != null ? ", detail='" + detail + "'" : "") + "}";
    }
}
