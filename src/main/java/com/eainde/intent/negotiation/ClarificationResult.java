package com.eainde.intent.negotiation;

import com.eainde.intent.model.ServiceCandidate;
import com.eainde.intent.model.ServiceIdentification;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one clarification round.
 *
 * <p>An empty proposal set and an exhausted iteration budget are ordinary outcomes,
 * reported here rather than thrown.</p>
 */
public class ClarificationResult {

    public enum Outcome {
        NEW_PROPOSALS,
        NO_NEW_PROPOSALS,
        MAX_ITERATIONS_REACHED
    }

    private final Outcome outcome;
    private final List<ServiceIdentification> proposals;
    private final Map<String, List<ServiceCandidate>> candidatesByService;

    private ClarificationResult(Outcome outcome,
                                List<ServiceIdentification> proposals,
                                Map<String, List<ServiceCandidate>> candidatesByService) {
        this.outcome = outcome;
        this.proposals = List.copyOf(proposals);
        this.candidatesByService = Collections.unmodifiableMap(new LinkedHashMap<>(candidatesByService));
    }

    public static ClarificationResult newProposals(List<ServiceIdentification> proposals,
                                                   Map<String, List<ServiceCandidate>> candidatesByService) {
        return new ClarificationResult(Outcome.NEW_PROPOSALS, proposals, candidatesByService);
    }

    public static ClarificationResult noNewProposals() {
        return new ClarificationResult(Outcome.NO_NEW_PROPOSALS, List.of(), Map.of());
    }

    public static ClarificationResult maxIterationsReached() {
        return new ClarificationResult(Outcome.MAX_ITERATIONS_REACHED, List.of(), Map.of());
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean hasNewProposals() {
        return outcome == Outcome.NEW_PROPOSALS;
    }

    /**
     * Identifications proposed this round, never containing an already validated name.
     */
    public List<ServiceIdentification> getProposals() {
        return proposals;
    }

    public Map<String, List<ServiceCandidate>> getCandidatesByService() {
        return candidatesByService;
    }

    @Override
    public String toString() {
        return "ClarificationResult{outcome=" + outcome + ", proposals=" + proposals.size() + "}";
    }
}
