package com.eainde.intent.negotiation;

import com.eainde.intent.assembler.CandidateAssembler;
import com.eainde.intent.model.ServiceIdentification;
import com.eainde.intent.nlu.ClarificationContext;
import com.eainde.intent.nlu.NluCollaborator;
import lombok.extern.log4j.Log4j2;

import java.util.List;
import java.util.Set;

/**
 * Reconciles a user's clarification with what was already accepted.
 *
 * <p>The NLU collaborator is asked to improve only the refused services, and is told which
 * ones are already validated. Its answer is not trusted on that point: any proposal that
 * carries a validated name is dropped here before candidates are assembled.</p>
 */
@Log4j2
public class NegotiationMerger {

    private final NluCollaborator nluCollaborator;
    private final CandidateAssembler candidateAssembler;

    public NegotiationMerger(NluCollaborator nluCollaborator, CandidateAssembler candidateAssembler) {
        this.nluCollaborator = nluCollaborator;
        this.candidateAssembler = candidateAssembler;
    }

    public ClarificationResult merge(Set<String> validated,
                                     Set<String> refused,
                                     String clarification,
                                     String originalRequest,
                                     List<String> history) {
        ClarificationContext context =
                new ClarificationContext(validated, refused, clarification, originalRequest, history);
        log.info("Clarifying {} refused service(s), keeping {} validated", refused.size(), validated.size());

        List<ServiceIdentification> proposed = nluCollaborator.clarify(context);
        List<ServiceIdentification> filtered = proposed.stream()
                .filter(identification -> {
                    boolean alreadyValidated = context.validated().contains(identification.name());
                    if (alreadyValidated) {
                        log.info("Dropping re-proposed validated service '{}'", identification.name());
                    }
                    return !alreadyValidated;
                })
                .toList();

        if (filtered.isEmpty()) {
            log.info("Clarification produced no new proposals ({} returned, all filtered)", proposed.size());
            return ClarificationResult.noNewProposals();
        }
        return ClarificationResult.newProposals(filtered, candidateAssembler.assemble(filtered));
    }
}
