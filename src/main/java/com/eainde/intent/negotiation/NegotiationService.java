package com.eainde.intent.negotiation;

import com.eainde.intent.assembler.CandidateAssembler;
import com.eainde.intent.model.RequestCategory;
import com.eainde.intent.model.ServiceCandidate;
import com.eainde.intent.model.ServiceIdentification;
import com.eainde.intent.model.ValidationDecision;
import com.eainde.intent.nlu.NluCollaborator;
import com.eainde.intent.state.SessionState;
import com.eainde.intent.synthesis.IntentSynthesizer;
import com.eainde.intent.synthesis.SynthesisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point for one negotiation step at a time.
 *
 * <p>Every call receives the caller's {@link SessionState}, mutates it and returns. Nothing is
 * kept between calls, so the state can be shipped back and forth as JSON.</p>
 *
 * A negotiation normally runs:
 *   1. classify the request, stop unless it is {@link RequestCategory#TELECOM}
 *   2. decompose it into identified services with ranked candidates
 *   3. apply the user's decision; if anything was refused, clarify and go back to 3
 *   4. synthesize the TMF921 intent from the validated services
 */
public class NegotiationService {

    private static final Logger log = LoggerFactory.getLogger(NegotiationService.class);

    static final String MDC_SESSION_ROUND = "sessionRound";

    private final NluCollaborator nluCollaborator;
    private final CandidateAssembler candidateAssembler;
    private final NegotiationMerger negotiationMerger;
    private final IntentSynthesizer intentSynthesizer;
    private final int maxIterations;

    public NegotiationService(NluCollaborator nluCollaborator,
                              CandidateAssembler candidateAssembler,
                              NegotiationMerger negotiationMerger,
                              IntentSynthesizer intentSynthesizer,
                              int maxIterations) {
        this.nluCollaborator = nluCollaborator;
        this.candidateAssembler = candidateAssembler;
        this.negotiationMerger = negotiationMerger;
        this.intentSynthesizer = intentSynthesizer;
        this.maxIterations = maxIterations;
    }

    public SessionState newSession() {
        return SessionState.create(maxIterations);
    }

    public RequestCategory classify(String text) {
        return nluCollaborator.classify(text);
    }

    /**
     * Opens the negotiation: identifies services in {@code text} and attaches their candidates.
     *
     * @return the identifications found, possibly empty
     */
    public List<ServiceIdentification> decompose(SessionState state, String text) {
        MDC.put(MDC_SESSION_ROUND, String.valueOf(state.getIteration()));
        try {
            state.startedWith(text);
            state.addToHistory("User: " + text);

            List<ServiceIdentification> identifications = nluCollaborator.decompose(text);
            if (identifications.isEmpty()) {
                log.warn("No service identified in request, the user should rephrase");
                return identifications;
            }
            state.upsertIdentifications(identifications);
            candidateAssembler.assemble(identifications).forEach(state::replaceCandidates);
            return identifications;
        } finally {
            MDC.remove(MDC_SESSION_ROUND);
        }
    }

    /**
     * Records the user's selections.
     *
     * <p>A selection naming a serviceId that is not among the service's candidates is skipped.</p>
     *
     * @return the refused service names, in decision order
     */
    public Set<String> applyDecision(SessionState state, ValidationDecision decision) {
        MDC.put(MDC_SESSION_ROUND, String.valueOf(state.getIteration()));
        try {
            for (Map.Entry<String, String> selection : decision.selected().entrySet()) {
                String name = selection.getKey();
                Optional<ServiceCandidate> chosen = state.candidatesFor(name).stream()
                        .filter(candidate -> candidate.serviceId().equals(selection.getValue()))
                        .findFirst();
                if (chosen.isEmpty()) {
                    log.warn("Selection '{}' → '{}' matches no proposed candidate, ignoring it",
                            name, selection.getValue());
                    continue;
                }
                state.validate(name, chosen.get());
                state.addToHistory("Validated: " + name + " -> " + chosen.get().serviceId());
            }

            Set<String> refused = new LinkedHashSet<>(decision.refused());
            if (!refused.isEmpty()) {
                state.addToHistory("Refused: " + String.join(", ", refused));
            }
            if (decision.comment() != null && !decision.comment().isBlank()) {
                state.addToHistory("User: " + decision.comment());
            }
            log.info("Decision {}: {} validated in total, {} refused",
                    decision.type(), state.getValidated().size(), refused.size());
            return refused;
        } finally {
            MDC.remove(MDC_SESSION_ROUND);
        }
    }

    /**
     * Runs one clarification round for the refused services.
     *
     * <p>Refused when the session has already used up its rounds. Otherwise the round counter
     * moves on, and new proposals (never a validated name) are merged into the session with
     * fresh candidates.</p>
     */
    public ClarificationResult clarify(SessionState state, Set<String> refused, String clarification) {
        if (state.isMaxIterationsReached()) {
            log.warn("Maximum of {} negotiation rounds reached, no further clarification",
                    state.getMaxIterations());
            return ClarificationResult.maxIterationsReached();
        }
        state.advanceIteration();

        MDC.put(MDC_SESSION_ROUND, String.valueOf(state.getIteration()));
        try {
            state.addToHistory("Clarification: " + clarification);
            ClarificationResult result = negotiationMerger.merge(
                    state.validatedNames(),
                    refused,
                    clarification,
                    state.getOriginalRequest(),
                    state.getHistory());

            if (result.hasNewProposals()) {
                state.upsertIdentifications(result.getProposals());
                result.getCandidatesByService().forEach(state::replaceCandidates);
            }
            log.info("Round {}/{} finished: {}", state.getIteration(), state.getMaxIterations(), result);
            return result;
        } finally {
            MDC.remove(MDC_SESSION_ROUND);
        }
    }

    public List<String> suggestAlternatives(SessionState state, Set<String> refused) {
        return nluCollaborator.suggestAlternatives(refused, state.validatedNames(), state.getHistory());
    }

    /**
     * Question to put to the user before a clarification round, about the refused services only.
     */
    public String askClarification(SessionState state, Set<String> refused) {
        return nluCollaborator.askClarification(refused, state.validatedNames(), state.getHistory());
    }

    public SynthesisResult synthesize(SessionState state) {
        MDC.put(MDC_SESSION_ROUND, String.valueOf(state.getIteration()));
        try {
            SynthesisResult result = intentSynthesizer.synthesize(state);
            if (!result.isComplete()) {
                log.warn("Intent synthesized with {} unresolved reference(s): {}",
                        result.unresolvedReferences().size(), result.unresolvedReferences());
            }
            return result;
        } finally {
            MDC.remove(MDC_SESSION_ROUND);
        }
    }
}
