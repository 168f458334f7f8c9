package br.edu.ifba.kgraph.core;

import br.edu.ifba.kgraph.classify.ClassifierFusion;
import br.edu.ifba.kgraph.graph.GraphScriptApplier;
import io.quarkus.runtime.Startup;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates ingestion configuration on application startup.
 *
 * <p>This component ensures that:</p>
 * <ul>
 *   <li>Every {@code kgraph.*} value is within range</li>
 *   <li>Both taxonomy tables load, so a bad resource fails the start instead of the first document</li>
 *   <li>At most one graph applier is deployed when applying is enabled</li>
 * </ul>
 */
@ApplicationScoped
@Startup
public class ConfigurationValidator {

    private static final Logger logger = LoggerFactory.getLogger(ConfigurationValidator.class);

    @Inject
    IngestionConfig config;

    @Inject
    ClassifierFusion classifier;

    @Inject
    Instance<GraphScriptApplier> appliers;

    /**
     * Validates configuration on startup.
     *
     * @param event the startup event
     * @throws IllegalArgumentException if a configuration value is invalid
     * @throws IllegalStateException if a taxonomy cannot be loaded or appliers are ambiguous
     */
    void onStart(@Observes StartupEvent event) {
        logger.info("Validating ingestion configuration...");

        config.validate();

        logger.info("Taxonomies ready: {} ({} categories), {} ({} categories)",
            classifier.getNdc().name(), classifier.getNdc().size(),
            classifier.getKindle().name(), classifier.getKindle().size());

        if (config.artifact().apply()) {
            if (appliers.isAmbiguous()) {
                throw new IllegalStateException(
                    "Multiple GraphScriptApplier implementations found. Deploy exactly one or set kgraph.artifact.apply=false");
            }
            if (appliers.isUnsatisfied()) {
                logger.warn("kgraph.artifact.apply=true but no GraphScriptApplier is deployed");
            }
        }

        logger.info("Configuration valid: mode={}, sentencesPerSegment={}, parallelism={}, outputDir={}",
            config.id().mode(), config.segment().sentencesPerSegment(),
            config.batch().parallelism(), config.artifact().outputDir());
    }
}
