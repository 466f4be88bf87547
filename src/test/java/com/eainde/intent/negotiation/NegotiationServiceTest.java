package com.eainde.intent.negotiation;

import com.eainde.intent.assembler.CandidateAssembler;
import com.eainde.intent.model.PropertyValue;
import com.eainde.intent.model.RequestCategory;
import com.eainde.intent.model.ServiceCandidate;
import com.eainde.intent.model.ServiceIdentification;
import com.eainde.intent.model.ValidationDecision;
import com.eainde.intent.nlu.NluCollaborator;
import com.eainde.intent.state.SessionState;
import com.eainde.intent.synthesis.ConstraintBuilder;
import com.eainde.intent.synthesis.IntentSynthesizer;
import com.eainde.intent.synthesis.SynthesisResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NegotiationServiceTest {

    private static final String REQUEST = "Drone fleet needs a slice under 5ms and cloud storage";

    private final ServiceIdentification slice = new ServiceIdentification("uRLLC-slice", "drones",
            Map.of("latency", new PropertyValue.UnitValue(5L, "ms", "5ms")));
    private final ServiceIdentification storage = ServiceIdentification.of("Cloud storage", "video archive");

    private final ServiceCandidate sliceCandidate = new ServiceCandidate("S1", "uRLLC slice", "", 0.9, List.of());
    private final ServiceCandidate storageCandidate = new ServiceCandidate("C1", "Cloud storage", "", 0.7, List.of());

    private NluCollaborator nluCollaborator;
    private CandidateAssembler candidateAssembler;
    private NegotiationService service;

    @BeforeEach
    void setUp() {
        nluCollaborator = mock(NluCollaborator.class);
        candidateAssembler = mock(CandidateAssembler.class);
        service = new NegotiationService(
                nluCollaborator,
                candidateAssembler,
                new NegotiationMerger(nluCollaborator, candidateAssembler),
                new IntentSynthesizer(new ObjectMapper(), new ConstraintBuilder()),
                2);
    }

    private SessionState decomposedSession() {
        when(nluCollaborator.decompose(REQUEST)).thenReturn(List.of(slice, storage));
        when(candidateAssembler.assemble(List.of(slice, storage))).thenReturn(Map.of(
                "uRLLC-slice", List.of(sliceCandidate),
                "Cloud storage", List.of(storageCandidate)));
        SessionState state = service.newSession();
        service.decompose(state, REQUEST);
        return state;
    }

    @Test
    void classify_shouldDelegateToCollaborator() {
        when(nluCollaborator.classify("bonjour")).thenReturn(RequestCategory.GREETING);

        assertThat(service.classify("bonjour")).isEqualTo(RequestCategory.GREETING);
    }

    @Nested
    @DisplayName("decompose")
    class Decompose {

        @Test
        @DisplayName("should record the request, identifications and candidates")
        void populatesSession() {
            SessionState state = decomposedSession();

            assertThat(state.getMaxIterations()).isEqualTo(2);
            assertThat(state.getOriginalRequest()).isEqualTo(REQUEST);
            assertThat(state.getIdentified()).containsOnlyKeys("uRLLC-slice", "Cloud storage");
            assertThat(state.candidatesFor("uRLLC-slice")).containsExactly(sliceCandidate);
            assertThat(state.getHistory()).containsExactly("User: " + REQUEST);
        }

        @Test
        @DisplayName("should leave the session without services when nothing is identified")
        void nothingIdentified() {
            when(nluCollaborator.decompose("weather?")).thenReturn(List.of());
            SessionState state = service.newSession();

            assertThat(service.decompose(state, "weather?")).isEmpty();
            assertThat(state.getIdentified()).isEmpty();
            verify(candidateAssembler, never()).assemble(any());
        }
    }

    @Nested
    @DisplayName("applyDecision")
    class ApplyDecision {

        @Test
        @DisplayName("should bind selections to the chosen candidates and return refusals")
        void partialDecision() {
            SessionState state = decomposedSession();

            Set<String> refused = service.applyDecision(state, ValidationDecision.partial(
                    Map.of("uRLLC-slice", "S1"), List.of("Cloud storage"), "storage must stay on site"));

            assertThat(refused).containsExactly("Cloud storage");
            assertThat(state.getValidated()).containsExactly(Map.entry("uRLLC-slice", sliceCandidate));
            assertThat(state.getHistory()).contains(
                    "Validated: uRLLC-slice -> S1",
                    "Refused: Cloud storage",
                    "User: storage must stay on site");
        }

        @Test
        @DisplayName("should skip a selection naming a candidate that was never proposed")
        void unknownChoice() {
            SessionState state = decomposedSession();

            service.applyDecision(state, ValidationDecision.accept(Map.of("uRLLC-slice", "NOPE")));

            assertThat(state.getValidated()).isEmpty();
        }
    }

    @Nested
    @DisplayName("clarify")
    class Clarify {

        @Test
        @DisplayName("should advance the round and merge new proposals into the session")
        void newProposals() {
            SessionState state = decomposedSession();
            service.applyDecision(state, ValidationDecision.partial(
                    Map.of("uRLLC-slice", "S1"), List.of("Cloud storage"), null));
            ServiceIdentification edgeStorage = ServiceIdentification.of("Edge storage", "on site");
            ServiceCandidate edgeCandidate = new ServiceCandidate("E1", "Edge storage", "", 0.8, List.of());
            when(nluCollaborator.clarify(any())).thenReturn(List.of(slice, edgeStorage));
            when(candidateAssembler.assemble(List.of(edgeStorage)))
                    .thenReturn(Map.of("Edge storage", List.of(edgeCandidate)));

            ClarificationResult result = service.clarify(state, Set.of("Cloud storage"), "on site");

            assertThat(result.hasNewProposals()).isTrue();
            assertThat(result.getProposals()).containsExactly(edgeStorage);
            assertThat(state.getIteration()).isEqualTo(1);
            assertThat(state.candidatesFor("Edge storage")).containsExactly(edgeCandidate);
            assertThat(state.getValidated()).containsOnlyKeys("uRLLC-slice");
            assertThat(state.identification("uRLLC-slice")).contains(slice);
        }

        @Test
        @DisplayName("should stop once the round ceiling is reached")
        void maxIterations() {
            SessionState state = decomposedSession();
            when(nluCollaborator.clarify(any())).thenReturn(List.of());

            assertThat(service.clarify(state, Set.of("Cloud storage"), "a").getOutcome())
                    .isEqualTo(ClarificationResult.Outcome.NO_NEW_PROPOSALS);
            assertThat(service.clarify(state, Set.of("Cloud storage"), "b").getOutcome())
                    .isEqualTo(ClarificationResult.Outcome.NO_NEW_PROPOSALS);
            assertThat(service.clarify(state, Set.of("Cloud storage"), "c").getOutcome())
                    .isEqualTo(ClarificationResult.Outcome.MAX_ITERATIONS_REACHED);
            assertThat(state.getIteration()).isEqualTo(2);
        }
    }

    @Test
    void suggestAlternatives_shouldPassValidatedNamesAndHistory() {
        SessionState state = decomposedSession();
        service.applyDecision(state, ValidationDecision.accept(Map.of("uRLLC-slice", "S1")));
        when(nluCollaborator.suggestAlternatives(Set.of("Cloud storage"), state.validatedNames(), state.getHistory()))
                .thenReturn(List.of("Edge storage"));

        assertThat(service.suggestAlternatives(state, Set.of("Cloud storage"))).containsExactly("Edge storage");
    }

    @Test
    void askClarification_shouldPassRefusedValidatedNamesAndHistory() {
        SessionState state = decomposedSession();
        service.applyDecision(state, ValidationDecision.accept(Map.of("uRLLC-slice", "S1")));
        when(nluCollaborator.askClarification(Set.of("Cloud storage"), state.validatedNames(), state.getHistory()))
                .thenReturn("What made the cloud storage unsuitable?");

        assertThat(service.askClarification(state, Set.of("Cloud storage")))
                .isEqualTo("What made the cloud storage unsuitable?");
    }

    @Test
    void synthesize_shouldBuildIntentFromValidatedServices() {
        SessionState state = decomposedSession();
        service.applyDecision(state, ValidationDecision.accept(Map.of("uRLLC-slice", "S1")));

        SynthesisResult result = service.synthesize(state);

        assertThat(result.hasExpectation().has("E_Delivery_S1")).isTrue();
        assertThat(result.hasExpectation().has("E_Property_latency_S1")).isTrue();
        assertThat(result.unresolvedReferences()).isEmpty();
    }
}
