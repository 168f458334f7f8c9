package br.edu.ifba.kgraph.core;

import br.edu.ifba.kgraph.IngestionFixtures;
import br.edu.ifba.kgraph.graph.GraphScriptApplier;
import jakarta.enterprise.inject.Instance;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ConfigurationValidator.
 *
 * Tests validation logic without requiring Quarkus CDI context.
 */
class ConfigurationValidatorTest {

    @SuppressWarnings("unchecked")
    private ConfigurationValidator validator(IngestionConfig config, boolean ambiguous, boolean unsatisfied) {
        Instance<GraphScriptApplier> appliers = mock(Instance.class);
        when(appliers.isAmbiguous()).thenReturn(ambiguous);
        when(appliers.isUnsatisfied()).thenReturn(unsatisfied);

        ConfigurationValidator validator = new ConfigurationValidator();
        validator.config = config;
        validator.classifier = IngestionFixtures.classifier();
        validator.appliers = appliers;
        return validator;
    }

    @Test
    @DisplayName("Default configuration should pass")
    void testDefaultsValid() {
        assertDoesNotThrow(() -> validator(IngestionFixtures.config(), false, true).onStart(null));
    }

    @Test
    @DisplayName("Invalid values should fail the start")
    void testInvalidValues() {
        IngestionConfig config = IngestionFixtures.config(Map.of("kgraph.classification.top-k", "0"));

        assertThrows(IllegalArgumentException.class, () -> validator(config, false, true).onStart(null));
    }

    @Test
    @DisplayName("Several appliers should fail the start when applying is enabled")
    void testAmbiguousAppliers() {
        IngestionConfig config = IngestionFixtures.config(Map.of("kgraph.artifact.apply", "true"));

        assertThrows(IllegalStateException.class, () -> validator(config, true, false).onStart(null));
    }

    @Test
    @DisplayName("A missing applier should only be reported")
    void testMissingApplier() {
        IngestionConfig config = IngestionFixtures.config(Map.of("kgraph.artifact.apply", "true"));

        assertDoesNotThrow(() -> validator(config, false, true).onStart(null));
    }

    @Test
    @DisplayName("Appliers should be ignored when applying is disabled")
    void testApplyDisabled() {
        assertDoesNotThrow(() -> validator(IngestionFixtures.config(), true, false).onStart(null));
    }
}
