package com.eainde.intent.state;

import com.eainde.intent.model.ServiceCandidate;
import com.eainde.intent.model.ServiceIdentification;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The mutable record of one negotiation, threaded through every step.
 *
 * <p>The caller owns the instance between calls and transports it as JSON; every field
 * round-trips. Mutations made through this class keep {@code validated} and
 * {@code candidatesByService} keyed by identified names only. A snapshot rebuilt from the
 * wire is taken as-is, and inconsistencies are reported at synthesis time.</p>
 */
public class SessionState {

    public static final int DEFAULT_MAX_ITERATIONS = 5;

    private int iteration;
    private final int maxIterations;
    private final Map<String, ServiceIdentification> identified;
    private final Map<String, List<ServiceCandidate>> candidatesByService;
    private final Map<String, ServiceCandidate> validated;
    private final List<String> history;
    private String originalRequest;

    @JsonCreator
    public SessionState(@JsonProperty("iteration")           int iteration,
                        @JsonProperty("maxIterations")       Integer maxIterations,
                        @JsonProperty("identified")          Map<String, ServiceIdentification> identified,
                        @JsonProperty("candidatesByService") Map<String, List<ServiceCandidate>> candidatesByService,
                        @JsonProperty("validated")           Map<String, ServiceCandidate> validated,
                        @JsonProperty("history")             List<String> history,
                        @JsonProperty("originalRequest")     String originalRequest) {
        this.iteration = iteration;
        this.maxIterations = maxIterations != null ? maxIterations : DEFAULT_MAX_ITERATIONS;
        this.identified = identified != null ? new LinkedHashMap<>(identified) : new LinkedHashMap<>();
        this.candidatesByService = new LinkedHashMap<>();
        if (candidatesByService != null) {
            candidatesByService.forEach((name, candidates) ->
                    this.candidatesByService.put(name, candidates != null ? List.copyOf(candidates) : List.of()));
        }
        this.validated = validated != null ? new LinkedHashMap<>(validated) : new LinkedHashMap<>();
        this.history = history != null ? new ArrayList<>(history) : new ArrayList<>();
        this.originalRequest = originalRequest;
    }

    public static SessionState create() {
        return create(DEFAULT_MAX_ITERATIONS);
    }

    public static SessionState create(int maxIterations) {
        return new SessionState(0, maxIterations, null, null, null, null, null);
    }

    // -------------------------------------------------------------------------
    // Iteration
    // -------------------------------------------------------------------------

    /**
     * Moves to the next negotiation round.
     *
     * @return true when the configured maximum is now reached
     */
    public boolean advanceIteration() {
        iteration++;
        return isMaxIterationsReached();
    }

    @JsonIgnore
    public boolean isMaxIterationsReached() {
        return iteration >= maxIterations;
    }

    // -------------------------------------------------------------------------
    // Identified services
    // -------------------------------------------------------------------------

    /**
     * Inserts or overwrites each identification by name. Unrelated entries are kept.
     */
    public void upsertIdentifications(Collection<ServiceIdentification> identifications) {
        for (ServiceIdentification identification : identifications) {
            identified.put(identification.name(), identification);
        }
    }

    public boolean isIdentified(String name) {
        return identified.containsKey(name);
    }

    public Optional<ServiceIdentification> identification(String name) {
        return Optional.ofNullable(identified.get(name));
    }

    /**
     * All identifications ever produced, in first-seen order.
     */
    public List<ServiceIdentification> identifiedServices() {
        return List.copyOf(identified.values());
    }

    // -------------------------------------------------------------------------
    // Candidates
    // -------------------------------------------------------------------------

    public void replaceCandidates(String name, List<ServiceCandidate> candidates) {
        requireIdentified(name);
        candidatesByService.put(name, List.copyOf(candidates));
    }

    public List<ServiceCandidate> candidatesFor(String name) {
        return candidatesByService.getOrDefault(name, List.of());
    }

    // -------------------------------------------------------------------------
    // Validated services
    // -------------------------------------------------------------------------

    /**
     * Binds an identified service to the candidate the user accepted.
     *
     * @throws UnknownServiceException if {@code name} was never identified
     */
    public void validate(String name, ServiceCandidate candidate) {
        requireIdentified(name);
        validated.put(name, Objects.requireNonNull(candidate, "candidate"));
    }

    public boolean isValidated(String name) {
        return validated.containsKey(name);
    }

    public Set<String> validatedNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(validated.keySet()));
    }

    // -------------------------------------------------------------------------
    // History & request
    // -------------------------------------------------------------------------

    public void addToHistory(String entry) {
        history.add(entry);
    }

    /**
     * Records the request that opened the negotiation. Setting the same text again is a no-op.
     *
     * @throws IllegalStateException if a different request was already recorded
     */
    public void startedWith(String request) {
        if (originalRequest != null && !originalRequest.equals(request)) {
            throw new IllegalStateException("Original request is already set for this session");
        }
        originalRequest = request;
    }

    private void requireIdentified(String name) {
        if (!identified.containsKey(name)) {
            throw new UnknownServiceException(name);
        }
    }

    // -------------------------------------------------------------------------
    // Accessors (wire shape)
    // -------------------------------------------------------------------------

    public int getIteration() {
        return iteration;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public Map<String, ServiceIdentification> getIdentified() {
        return Collections.unmodifiableMap(identified);
    }

    public Map<String, List<ServiceCandidate>> getCandidatesByService() {
        return Collections.unmodifiableMap(candidatesByService);
    }

    public Map<String, ServiceCandidate> getValidated() {
        return Collections.unmodifiableMap(validated);
    }

    public List<String> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public String getOriginalRequest() {
        return originalRequest;
    }
}
