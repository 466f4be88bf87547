package com.eainde.intent.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class IntentPropertiesTest {

    private IntentProperties bind(Map<String, String> values) {
        Binder binder = new Binder(new MapConfigurationPropertySource(values));
        return binder.bindOrCreate("intent", IntentProperties.class);
    }

    @Test
    void bind_shouldKeepDefaultsWhenNothingIsSet() {
        IntentProperties properties = bind(Map.of());

        assertThat(properties.getNegotiation().getMaxIterations()).isEqualTo(5);
        assertThat(properties.getAssembler().getTopK()).isEqualTo(3);
        assertThat(properties.getAssembler().getMinScore()).isEqualTo(0.2);
        assertThat(properties.getAssembler().getLookupMinScore()).isEqualTo(0.5);
        assertThat(properties.getRetrieval().getStoreFile()).isNull();
    }

    @Test
    void bind_shouldReadKebabCaseKeys() {
        IntentProperties properties = bind(Map.of(
                "intent.negotiation.max-iterations", "3",
                "intent.assembler.top-k", "5",
                "intent.assembler.min-score", "0.35",
                "intent.catalog.directory", "/data/catalog",
                "intent.retrieval.store-file", "/data/catalog-embeddings.json",
                "intent.model.model-name", "gemini-1.5-pro",
                "intent.model.max-output-tokens", "2048"));

        assertThat(properties.getNegotiation().getMaxIterations()).isEqualTo(3);
        assertThat(properties.getAssembler().getTopK()).isEqualTo(5);
        assertThat(properties.getAssembler().getMinScore()).isEqualTo(0.35);
        assertThat(properties.getCatalog().getDirectory()).isEqualTo("/data/catalog");
        assertThat(properties.getRetrieval().getStoreFile()).isEqualTo("/data/catalog-embeddings.json");
        assertThat(properties.getModel().getModelName()).isEqualTo("gemini-1.5-pro");
        assertThat(properties.getModel().getMaxOutputTokens()).isEqualTo(2048);
    }
}
