package com.eainde.intent.nlu;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

public interface RequestClassificationAgent {

    @SystemMessage("""
            You classify requests for a 5G telecom system into exactly one category:
            1. TELECOM: telecom, network, 5G, cloud or IoT services
            2. GREETING: a simple greeting
            3. OUT_OF_SCOPE: anything else (cooking, sport, politics, programming, ...)

            Answer ONLY with TELECOM, GREETING or OUT_OF_SCOPE.
            When unsure between TELECOM and OUT_OF_SCOPE, answer OUT_OF_SCOPE.
            """)
    @UserMessage("{{text}}")
    String classify(@V("text") String text);
}
