package com.eainde.intent.config;

import com.eainde.intent.assembler.CandidateAssembler;
import com.eainde.intent.catalog.CatalogStore;
import com.eainde.intent.catalog.FileSystemCatalogStore;
import com.eainde.intent.model.PropertyValues;
import com.eainde.intent.negotiation.NegotiationMerger;
import com.eainde.intent.negotiation.NegotiationService;
import com.eainde.intent.nlu.AlternativeRecommendationAgent;
import com.eainde.intent.nlu.ClarificationQuestionAgent;
import com.eainde.intent.nlu.DecompositionParser;
import com.eainde.intent.nlu.LlmNluCollaborator;
import com.eainde.intent.nlu.NluCollaborator;
import com.eainde.intent.nlu.RequestClassificationAgent;
import com.eainde.intent.nlu.ServiceDecompositionAgent;
import com.eainde.intent.retrieval.CatalogRetriever;
import com.eainde.intent.retrieval.EmbeddingStoreCatalogRetriever;
import com.eainde.intent.synthesis.ConstraintBuilder;
import com.eainde.intent.synthesis.IntentSynthesizer;
import com.eainde.intent.thread.MdcAwareExecutor;
import com.fasterxml.jackson.databind.Module;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.service.AiServices;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.List;

/**
 * Wires the negotiation core to its LangChain4j collaborators.
 *
 * <pre>
 *   NegotiationService
 *     ├── NluCollaborator ──── Gemini (classify / decompose / recommend agents)
 *     ├── CandidateAssembler
 *     │     ├── CatalogRetriever ── all-MiniLM-L6-v2 + in-memory embedding store
 *     │     └── CatalogStore ────── JSON files under intent.catalog.directory
 *     ├── NegotiationMerger
 *     └── IntentSynthesizer ─── ConstraintBuilder
 * </pre>
 */
@Configuration
@EnableConfigurationProperties(IntentProperties.class)
public class NegotiationConfig {

    private static final Logger log = LoggerFactory.getLogger(NegotiationConfig.class);

    // =========================================================================
    //  Models
    // =========================================================================

    @Bean
    public ChatModel nluChatModel(IntentProperties properties) {
        IntentProperties.Model model = properties.getModel();
        log.info("Using Gemini model '{}' (temperature={})", model.getModelName(), model.getTemperature());
        return GoogleAiGeminiChatModel.builder()
                .apiKey(model.getApiKey())
                .modelName(model.getModelName())
                .temperature(model.getTemperature())
                .maxOutputTokens(model.getMaxOutputTokens())
                .listeners(List.of(new NegotiationChatModelListener()))
                .build();
    }

    @Bean
    public EmbeddingModel embeddingModel() {
        return new AllMiniLmL6V2EmbeddingModel();
    }

    @Bean
    public EmbeddingStore<TextSegment> catalogEmbeddingStore(IntentProperties properties) {
        String storeFile = properties.getRetrieval().getStoreFile();
        if (storeFile == null || storeFile.isBlank()) {
            log.warn("No intent.retrieval.store-file configured, catalog search starts empty");
            return new InMemoryEmbeddingStore<>();
        }
        log.info("Loading catalog embeddings from {}", storeFile);
        return InMemoryEmbeddingStore.fromFile(Path.of(storeFile));
    }

    // =========================================================================
    //  NLU agents
    // =========================================================================

    @Bean
    public RequestClassificationAgent requestClassificationAgent(ChatModel nluChatModel) {
        return AiServices.create(RequestClassificationAgent.class, nluChatModel);
    }

    @Bean
    public ServiceDecompositionAgent serviceDecompositionAgent(ChatModel nluChatModel) {
        return AiServices.create(ServiceDecompositionAgent.class, nluChatModel);
    }

    @Bean
    public AlternativeRecommendationAgent alternativeRecommendationAgent(ChatModel nluChatModel) {
        return AiServices.create(AlternativeRecommendationAgent.class, nluChatModel);
    }

    @Bean
    public ClarificationQuestionAgent clarificationQuestionAgent(ChatModel nluChatModel) {
        return AiServices.create(ClarificationQuestionAgent.class, nluChatModel);
    }

    @Bean
    public NluCollaborator nluCollaborator(RequestClassificationAgent classificationAgent,
                                           ServiceDecompositionAgent decompositionAgent,
                                           AlternativeRecommendationAgent recommendationAgent,
                                           ClarificationQuestionAgent questionAgent,
                                           ObjectMapper objectMapper) {
        return new LlmNluCollaborator(classificationAgent, decompositionAgent, recommendationAgent,
                questionAgent, new DecompositionParser(objectMapper));
    }

    // =========================================================================
    //  Catalog
    // =========================================================================

    @Bean(destroyMethod = "shutdown")
    public MdcAwareExecutor catalogRetrievalExecutor(IntentProperties properties) {
        return new MdcAwareExecutor(properties.getAssembler().getParallelism());
    }

    @Bean
    public CatalogStore catalogStore(IntentProperties properties, ObjectMapper objectMapper) {
        return new FileSystemCatalogStore(Path.of(properties.getCatalog().getDirectory()), objectMapper);
    }

    @Bean
    public CatalogRetriever catalogRetriever(EmbeddingModel embeddingModel,
                                             EmbeddingStore<TextSegment> catalogEmbeddingStore) {
        return new EmbeddingStoreCatalogRetriever(embeddingModel, catalogEmbeddingStore);
    }

    @Bean
    public CandidateAssembler candidateAssembler(CatalogRetriever catalogRetriever,
                                                 CatalogStore catalogStore,
                                                 MdcAwareExecutor catalogRetrievalExecutor,
                                                 IntentProperties properties) {
        IntentProperties.Assembler assembler = properties.getAssembler();
        return new CandidateAssembler(catalogRetriever, catalogStore, catalogRetrievalExecutor,
                assembler.getTopK(), assembler.getMinScore(), assembler.getLookupMinScore());
    }

    // =========================================================================
    //  Negotiation & synthesis
    // =========================================================================

    @Bean
    public NegotiationMerger negotiationMerger(NluCollaborator nluCollaborator,
                                               CandidateAssembler candidateAssembler) {
        return new NegotiationMerger(nluCollaborator, candidateAssembler);
    }

    @Bean
    public IntentSynthesizer intentSynthesizer(ObjectMapper objectMapper) {
        return new IntentSynthesizer(objectMapper, new ConstraintBuilder());
    }

    @Bean
    public NegotiationService negotiationService(NluCollaborator nluCollaborator,
                                                 CandidateAssembler candidateAssembler,
                                                 NegotiationMerger negotiationMerger,
                                                 IntentSynthesizer intentSynthesizer,
                                                 IntentProperties properties) {
        return new NegotiationService(nluCollaborator, candidateAssembler, negotiationMerger,
                intentSynthesizer, properties.getNegotiation().getMaxIterations());
    }

    /**
     * Registered with Spring Boot's {@link ObjectMapper} so session snapshots carry property values.
     */
    @Bean
    public Module propertyValueModule() {
        return PropertyValues.jacksonModule();
    }
}
