package br.edu.ifba.kgraph.classify;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads taxonomy tables from JSON classpath resources.
 *
 * <pre>{@code
 * {
 *   "name": "NDC",
 *   "categories": [
 *     {"code": "900", "name": "文学", "keywords": ["文学", "小説"], "concepts": {"narrative_structure": 0.4}}
 *   ]
 * }
 * }</pre>
 */
@ApplicationScoped
public class TaxonomyLoader {

    private static final Logger logger = LoggerFactory.getLogger(TaxonomyLoader.class);

    private final ObjectMapper objectMapper;

    @Inject
    public TaxonomyLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Loads one taxonomy.
     *
     * @param resourcePath classpath location, with or without a leading slash
     * @return the parsed table
     * @throws IllegalStateException if the resource is missing or malformed
     */
    @NotNull
    public Taxonomy load(@NotNull String resourcePath) {
        String path = resourcePath.startsWith("/") ? resourcePath.substring(1) : resourcePath;
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = TaxonomyLoader.class.getClassLoader();
        }

        try (InputStream is = classLoader.getResourceAsStream(path)) {
            if (is == null) {
                throw new IllegalStateException("Taxonomy resource not found: " + resourcePath);
            }
            Taxonomy taxonomy = objectMapper.readValue(is, Taxonomy.class);
            logger.info("Loaded taxonomy '{}' with {} categories from {}", taxonomy.name(), taxonomy.size(), resourcePath);
            return taxonomy;
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed to load taxonomy: " + resourcePath, e);
        }
    }
}
