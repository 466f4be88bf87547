package com.eainde.intent.nlu;

import com.eainde.intent.model.RequestCategory;
import com.eainde.intent.model.ServiceIdentification;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.log4j.Log4j2;

import java.util.Collection;
import java.util.List;

/**
 * {@link NluCollaborator} backed by LangChain4j AI services.
 *
 * <p>Agent replies that are not valid JSON are logged and degrade to an empty result;
 * the negotiation then sees "no proposals" instead of failing.</p>
 */
@Log4j2
public class LlmNluCollaborator implements NluCollaborator {

    static final int RECENT_HISTORY = 3;

    private final RequestClassificationAgent classificationAgent;
    private final ServiceDecompositionAgent decompositionAgent;
    private final AlternativeRecommendationAgent recommendationAgent;
    private final ClarificationQuestionAgent questionAgent;
    private final DecompositionParser parser;

    public LlmNluCollaborator(RequestClassificationAgent classificationAgent,
                              ServiceDecompositionAgent decompositionAgent,
                              AlternativeRecommendationAgent recommendationAgent,
                              ClarificationQuestionAgent questionAgent,
                              DecompositionParser parser) {
        this.classificationAgent = classificationAgent;
        this.decompositionAgent = decompositionAgent;
        this.recommendationAgent = recommendationAgent;
        this.questionAgent = questionAgent;
        this.parser = parser;
    }

    @Override
    public RequestCategory classify(String text) {
        String label = classificationAgent.classify(text);
        RequestCategory category = RequestCategory.fromLabel(label);
        log.info("Request classified as {} (label '{}')", category, label);
        return category;
    }

    @Override
    public List<ServiceIdentification> decompose(String text) {
        String reply = decompositionAgent.decompose(text);
        try {
            List<ServiceIdentification> identifications = parser.parse(reply);
            log.info("Decomposition identified {} service(s)", identifications.size());
            return identifications;
        } catch (JsonProcessingException e) {
            log.error("Decomposition agent returned unparsable JSON, treating as no services", e);
            return List.of();
        }
    }

    @Override
    public List<ServiceIdentification> clarify(ClarificationContext context) {
        return decompose(targetedRequest(context));
    }

    @Override
    public List<String> suggestAlternatives(Collection<String> refused,
                                            Collection<String> validated,
                                            List<String> history) {
        String reply = recommendationAgent.recommend(
                String.join(", ", validated),
                String.join(", ", refused),
                String.join("\n", history));
        try {
            return parser.parseNames(reply);
        } catch (JsonProcessingException e) {
            log.error("Recommendation agent returned unparsable JSON, no alternatives offered", e);
            return List.of();
        }
    }

    @Override
    public String askClarification(Collection<String> refused,
                                   Collection<String> validated,
                                   List<String> history) {
        List<String> recent = history.subList(Math.max(0, history.size() - RECENT_HISTORY), history.size());
        String question = questionAgent.ask(
                String.join(", ", validated),
                String.join(", ", refused),
                String.join("\n", recent));
        log.info("Clarification question asked about {} refused service(s)", refused.size());
        return question;
    }

    /**
     * Renders the clarification round as a decomposition request that targets only the
     * refused services.
     */
    static String targetedRequest(ClarificationContext context) {
        String validated = String.join(", ", context.validated());
        String refused = String.join(", ", context.refused());
        return """
                CONTEXT:
                The user has already VALIDATED these services (DO NOT propose them again):
                %s

                REFUSED services to improve:
                %s

                ORIGINAL REQUEST:
                %s

                USER CLARIFICATION:
                %s

                TASK:
                Propose ONLY alternative or improved services for the refused services.
                DO NOT propose the already validated services again: %s
                """.formatted(validated, refused, context.originalRequest(), context.clarification(), validated);
    }
}
