package com.eainde.intent.synthesis;

import com.eainde.intent.model.PropertyValue;
import com.eainde.intent.model.ServiceCandidate;
import com.eainde.intent.model.ServiceDependency;
import com.eainde.intent.model.ServiceIdentification;
import com.eainde.intent.state.SessionState;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the TMF921 intent document from the validated services of a session.
 *
 * <h3>Expectations, in order:</h3>
 * <ol>
 *   <li>per validated service (insertion order): {@code E_Delivery_<id>}, then one
 *       {@code E_Delivery_dep_<depId>} per CFSS dependency</li>
 *   <li>per identification that has a validated entry: one {@code E_Property_<prop>_<id>}
 *       per property</li>
 * </ol>
 *
 * <p>Identifiers depend only on catalog ids and property names, so synthesizing the same
 * validated set twice yields the same document.</p>
 */
@Log4j2
public class IntentSynthesizer {

    static final String CONTEXT_ICM = "http://www.models.tmforum.org/tio/v1.0.0/IntentCommonModel#";
    static final String CONTEXT_CAT = "http://www.operator.com/Catalog#";
    static final String CONTEXT_EX = "http://www.example.com/intent#";
    static final String CONTEXT_CEM = "http://www.example.com/commonModel#";

    private static final int DESCRIPTION_LENGTH = 100;

    private final ObjectMapper objectMapper;
    private final ConstraintBuilder constraintBuilder;

    public IntentSynthesizer(ObjectMapper objectMapper, ConstraintBuilder constraintBuilder) {
        this.objectMapper = objectMapper;
        this.constraintBuilder = constraintBuilder;
    }

    public SynthesisResult synthesize(SessionState state) {
        Map<String, ServiceCandidate> validated = state.getValidated();
        String intentName = "UserRequest_" + validated.size() + "_Services";
        List<UnresolvedReference> unresolved = new ArrayList<>();

        ObjectNode expectations = objectMapper.createObjectNode();
        validated.forEach((name, candidate) -> {
            if (!state.isIdentified(name)) {
                log.warn("Validated service '{}' has no identification, its properties are unknown", name);
                unresolved.add(new UnresolvedReference(name, UnresolvedReference.Kind.VALIDATED_WITHOUT_IDENTIFICATION));
            }
            addDeliveryExpectations(expectations, candidate);
        });

        int propertyCount = 0;
        for (ServiceIdentification identification : state.identifiedServices()) {
            ServiceCandidate candidate = validated.get(identification.name());
            if (candidate == null) {
                if (identification.hasProperties()) {
                    log.debug("Identified service '{}' was not validated, skipping its {} properties",
                            identification.name(), identification.properties().size());
                    unresolved.add(new UnresolvedReference(identification.name(),
                            UnresolvedReference.Kind.IDENTIFIED_WITHOUT_VALIDATION));
                }
                continue;
            }
            for (Map.Entry<String, PropertyValue> property : identification.properties().entrySet()) {
                expectations.set("E_Property_" + property.getKey() + "_" + candidate.serviceId(),
                        propertyExpectation(candidate, property.getKey(), property.getValue()));
                propertyCount++;
            }
        }

        log.info("Synthesized intent '{}': {} expectation(s), {} property constraint(s), {} unresolved",
                intentName, expectations.size(), propertyCount, unresolved.size());
        return new SynthesisResult(envelope(intentName, state, expectations), unresolved);
    }

    private void addDeliveryExpectations(ObjectNode expectations, ServiceCandidate candidate) {
        String target = "ex:T_" + candidate.serviceId();

        ObjectNode delivery = objectMapper.createObjectNode();
        delivery.put("@type", "icm:DeliveryExpectation");
        delivery.put("icm:target", target);
        delivery.put("icm:targetType", "cat:" + candidate.name());
        expectations.set("E_Delivery_" + candidate.serviceId(), delivery);

        for (ServiceDependency dependency : candidate.dependencies()) {
            ObjectNode dependencyDelivery = objectMapper.createObjectNode();
            dependencyDelivery.put("@type", "icm:DeliveryExpectation");
            dependencyDelivery.put("icm:target", "ex:T_dep_" + dependency.id());
            dependencyDelivery.put("icm:targetType", "cat:" + dependency.name());
            dependencyDelivery.put("icm:requiredBy", target);
            expectations.set("E_Delivery_dep_" + dependency.id(), dependencyDelivery);
        }
    }

    private ObjectNode propertyExpectation(ServiceCandidate candidate, String propertyName, PropertyValue value) {
        ObjectNode expectation = objectMapper.createObjectNode();
        expectation.put("@type", "icm:PropertyExpectation");
        expectation.put("icm:target", "ex:T_" + candidate.serviceId());
        expectation.set("icm:constraint", constraintBuilder.toIcm(propertyName, value));
        return expectation;
    }

    private ObjectNode envelope(String intentName, SessionState state, ObjectNode expectations) {
        ObjectNode context = objectMapper.createObjectNode();
        context.put("icm", CONTEXT_ICM);
        context.put("cat", CONTEXT_CAT);
        context.put("ex", CONTEXT_EX);
        context.put("cem", CONTEXT_CEM);

        ObjectNode intentNode = objectMapper.createObjectNode();
        intentNode.put("@type", "icm:Intent");
        intentNode.put("icm:intentOwner", "ex:AutomatedAgent");
        intentNode.set("icm:hasExpectation", expectations);

        ObjectNode expressionValue = objectMapper.createObjectNode();
        expressionValue.set("@context", context);
        expressionValue.set("ex:" + intentName, intentNode);

        ObjectNode expression = objectMapper.createObjectNode();
        expression.put("@type", "JsonLdExpression");
        expression.set("expressionValue", expressionValue);

        ObjectNode intent = objectMapper.createObjectNode();
        intent.put("name", intentName);
        intent.put("description", describe(state.getOriginalRequest()));
        intent.put("version", "1.0");
        intent.put("priority", "1");
        intent.put("isBundled", state.getValidated().size() > 1);
        intent.put("context", "User request automation");
        intent.putArray("characteristic");
        intent.set("expression", expression);
        return intent;
    }

    private static String describe(String originalRequest) {
        if (originalRequest == null) {
            return "";
        }
        return originalRequest.length() > DESCRIPTION_LENGTH
                ? originalRequest.substring(0, DESCRIPTION_LENGTH)
                : originalRequest;
    }
}
