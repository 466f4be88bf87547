package com.eainde.intent.config;

import com.eainde.intent.assembler.CandidateAssembler;
import com.eainde.intent.state.SessionState;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings bound from the {@code intent.*} namespace.
 */
@Data
@ConfigurationProperties(prefix = "intent")
public class IntentProperties {

    private Negotiation negotiation = new Negotiation();
    private Assembler assembler = new Assembler();
    private Catalog catalog = new Catalog();
    private Retrieval retrieval = new Retrieval();
    private Model model = new Model();

    @Data
    public static class Negotiation {
        private int maxIterations = SessionState.DEFAULT_MAX_ITERATIONS;
    }

    @Data
    public static class Assembler {
        private int topK = CandidateAssembler.DEFAULT_TOP_K;
        private double minScore = CandidateAssembler.DEFAULT_MIN_SCORE;
        private double lookupMinScore = CandidateAssembler.DEFAULT_LOOKUP_MIN_SCORE;
        /** Threads used to query the catalog index concurrently. */
        private int parallelism = 4;
    }

    @Data
    public static class Catalog {
        /** Directory holding one JSON service specification per file. */
        private String directory = "catalog";
    }

    @Data
    public static class Retrieval {
        /** Serialized in-memory embedding store; an empty store is used when unset. */
        private String storeFile;
    }

    @Data
    public static class Model {
        private String apiKey;
        private String modelName = "gemini-2.0-flash";
        private Double temperature = 0.2;
        private Integer maxOutputTokens = 4096;
    }
}
