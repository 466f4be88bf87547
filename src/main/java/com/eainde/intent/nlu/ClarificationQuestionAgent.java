package com.eainde.intent.nlu;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * Asks the user one follow-up question about the services they refused.
 */
public interface ClarificationQuestionAgent {

    @SystemMessage("""
            You help users clarify telecom service requests.

            TASK: ask ONE targeted question about the REFUSED services only.

            RULES:
            - focus ONLY on the refused services
            - DO NOT mention the services the user already validated
            - keep the question short and precise, about a single aspect
            - give concrete examples when they help
            - keep a professional tone

            The user has already validated some services. Your question must help understand
            why the refused ones were rejected, so that alternatives can be proposed.
            """)
    @UserMessage("""
            Already validated services (do not mention): {{validated}}

            Refused services (to clarify): {{refused}}

            History:
            {{history}}

            Ask ONE question about the refused services only, to understand why the user
            rejected them and to be able to propose alternatives.
            """)
    String ask(@V("validated") String validated,
               @V("refused") String refused,
               @V("history") String history);
}
