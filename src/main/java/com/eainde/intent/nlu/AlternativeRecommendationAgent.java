package com.eainde.intent.nlu;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * Proposes replacement services that complement what the user already accepted.
 */
public interface AlternativeRecommendationAgent {

    @SystemMessage("""
            You advise on COMPLEMENTARY alternative telecom services.

            TASK: propose 2-3 alternative services replacing the refused ones.

            RULES:
            - analyse the ALREADY VALIDATED services and avoid duplicates
            - alternatives must COMPLEMENT the validated services
            - use the history to understand the user's constraints
            - if a 5G slice is already validated, do not propose another slice
            - if a notification service is validated, do not propose a similar one

            OUTPUT (valid JSON only, no markdown): a JSON array of precise technical service names,
            e.g. ["Edge Video Analytics", "MQTT Alerting"]
            """)
    @UserMessage("""
            Already validated services (do not propose similar ones): {{validated}}

            Refused services (to replace): {{refused}}

            History:
            {{history}}
            """)
    String recommend(@V("validated") String validated,
                     @V("refused") String refused,
                     @V("history") String history);
}
