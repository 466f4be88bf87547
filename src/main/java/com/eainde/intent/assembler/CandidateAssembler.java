package com.eainde.intent.assembler;

import com.eainde.intent.catalog.CatalogLookup;
import com.eainde.intent.catalog.CatalogStore;
import com.eainde.intent.catalog.DependencyExtractor;
import com.eainde.intent.model.ServiceCandidate;
import com.eainde.intent.model.ServiceDependency;
import com.eainde.intent.model.ServiceIdentification;
import com.eainde.intent.retrieval.CatalogMatch;
import com.eainde.intent.retrieval.CatalogRetriever;
import lombok.extern.log4j.Log4j2;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Turns service identifications into ranked catalog candidates.
 *
 * <h3>Per identification:</h3>
 * <ol>
 *   <li>query = {@code name + " " + rationale}, asking retrieval for {@code 2 × topK} matches</li>
 *   <li>drop matches scoring strictly below {@code minScore}</li>
 *   <li>keep the first {@code topK} survivors, highest score first (ties keep retrieval order)</li>
 *   <li>resolve each survivor in the catalog store and attach its CFSS dependencies;
 *       an unresolved record yields an empty dependency list</li>
 * </ol>
 *
 * <p>Identifications are looked up concurrently on the given executor and gathered in
 * input order, so the result is the same as a sequential run.</p>
 */
@Log4j2
public class CandidateAssembler {

    public static final int DEFAULT_TOP_K = 3;
    public static final double DEFAULT_MIN_SCORE = 0.2;
    public static final double DEFAULT_LOOKUP_MIN_SCORE = 0.5;

    private final CatalogRetriever retriever;
    private final CatalogStore catalogStore;
    private final Executor executor;
    private final int topK;
    private final double minScore;
    private final double lookupMinScore;

    public CandidateAssembler(CatalogRetriever retriever,
                              CatalogStore catalogStore,
                              Executor executor,
                              int topK,
                              double minScore) {
        this(retriever, catalogStore, executor, topK, minScore, DEFAULT_LOOKUP_MIN_SCORE);
    }

    public CandidateAssembler(CatalogRetriever retriever,
                              CatalogStore catalogStore,
                              Executor executor,
                              int topK,
                              double minScore,
                              double lookupMinScore) {
        this.retriever = retriever;
        this.catalogStore = catalogStore;
        this.executor = executor;
        this.topK = topK;
        this.minScore = minScore;
        this.lookupMinScore = lookupMinScore;
    }

    /**
     * @return one entry per identification, in input order; an entry may be empty
     */
    public Map<String, List<ServiceCandidate>> assemble(List<ServiceIdentification> identifications) {
        log.info("Assembling candidates for {} identified services (topK={}, minScore={})",
                identifications.size(), topK, minScore);

        List<CompletableFuture<List<ServiceCandidate>>> lookups = identifications.stream()
                .map(identification -> CompletableFuture.supplyAsync(
                        () -> lookup(queryFor(identification), topK, minScore), executor))
                .toList();

        Map<String, List<ServiceCandidate>> candidatesByService = new LinkedHashMap<>();
        for (int i = 0; i < identifications.size(); i++) {
            String name = identifications.get(i).name();
            List<ServiceCandidate> candidates = join(lookups.get(i));
            candidatesByService.put(name, candidates);
            log.info("Service '{}' → {} candidate(s)", name, candidates.size());
        }
        return candidatesByService;
    }

    /**
     * Bare semantic lookup, also used outside the negotiation flow.
     */
    public List<ServiceCandidate> lookup(String query, int topK, double minScore) {
        List<CatalogMatch> matches = retriever.search(query, topK * 2);

        return matches.stream()
                .filter(match -> {
                    boolean keep = match.score() >= minScore;
                    if (!keep) {
                        log.debug("Dropping '{}' for query '{}': score {} < {}",
                                match.catalogId(), query, match.score(), minScore);
                    }
                    return keep;
                })
                .sorted(Comparator.comparingDouble(CatalogMatch::score).reversed())
                .limit(topK)
                .map(this::toCandidate)
                .toList();
    }

    public List<ServiceCandidate> lookup(String query) {
        return lookup(query, topK, lookupMinScore);
    }

    static String queryFor(ServiceIdentification identification) {
        return identification.name() + " " + identification.rationale();
    }

    private ServiceCandidate toCandidate(CatalogMatch match) {
        return new ServiceCandidate(
                match.catalogId(),
                match.name(),
                match.description(),
                round(match.score()),
                resolveDependencies(match.catalogId())
        );
    }

    private List<ServiceDependency> resolveDependencies(String catalogId) {
        CatalogLookup lookup = catalogStore.lookup(catalogId);
        if (lookup.isFound()) {
            return lookup.getRecord().map(DependencyExtractor::extract).orElse(List.of());
        }
        if (lookup.getKind() == CatalogLookup.Kind.NOT_FOUND) {
            log.warn("No catalog record for '{}', candidate carries no dependencies", catalogId);
        } else {
            log.warn("Catalog record for '{}' unavailable ({}: {}), candidate carries no dependencies",
                    catalogId, lookup.getKind(), lookup.getDetail());
        }
        return List.of();
    }

    // rounds the binary value, so a tie such as 0.0005 goes up
    private static double round(double score) {
        return Math.round(score * 1000) / 1000.0;
    }

    private static List<ServiceCandidate> join(CompletableFuture<List<ServiceCandidate>> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
