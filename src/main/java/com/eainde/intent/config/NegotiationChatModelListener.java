package com.eainde.intent.config;

import dev.langchain4j.model.chat.listener.ChatModelErrorContext;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.chat.listener.ChatModelRequestContext;
import dev.langchain4j.model.chat.listener.ChatModelResponseContext;
import dev.langchain4j.model.output.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs every NLU model call with its latency and token usage.
 */
public class NegotiationChatModelListener implements ChatModelListener {

    private static final Logger log = LoggerFactory.getLogger(NegotiationChatModelListener.class);

    static final String START_TIME = "startTime";

    @Override
    public void onRequest(ChatModelRequestContext requestContext) {
        log.debug("Sending {} message(s) to the model", requestContext.chatRequest().messages().size());
        requestContext.attributes().put(START_TIME, System.currentTimeMillis());
    }

    @Override
    public void onResponse(ChatModelResponseContext responseContext) {
        Object startTime = responseContext.attributes().get(START_TIME);
        long duration = startTime instanceof Long start ? System.currentTimeMillis() - start : -1;

        TokenUsage usage = responseContext.chatResponse().tokenUsage();
        if (usage == null) {
            log.info("Model responded in {}ms (no token usage reported)", duration);
            return;
        }
        log.info("Model responded in {}ms - tokens in: {}, out: {}, total: {}",
                duration,
                usage.inputTokenCount(),
                usage.outputTokenCount(),
                usage.totalTokenCount());
    }

    @Override
    public void onError(ChatModelErrorContext errorContext) {
        log.error("Model call failed", errorContext.error());
    }
}
