package com.eainde.intent.catalog;

/**
 * Resolves full catalog records (TMF633 service specifications) by id or name.
 */
public interface CatalogStore {

    /**
     * @param idOrName the catalog id returned by retrieval, or a service name
     * @return a lookup whose {@link CatalogLookup#getKind()} tells found, not found,
     *         malformed catalog content or I/O failure apart
     */
    CatalogLookup lookup(String idOrName);
}
