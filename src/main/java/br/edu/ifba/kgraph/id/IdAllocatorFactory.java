package br.edu.ifba.kgraph.id;

import br.edu.ifba.kgraph.core.IngestionConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.function.Supplier;

/**
 * Creates explicitly scoped {@link IdAllocator} instances from configuration.
 *
 * <p>There is no process-wide allocator. A batch run asks for a scope once and
 * draws one allocator per document from it:</p>
 * <ul>
 *   <li>{@code wall-clock}: every document of the batch shares one lock-guarded allocator</li>
 *   <li>{@code deterministic}: every document gets its own allocator with its own counter namespace</li>
 * </ul>
 */
@ApplicationScoped
public class IdAllocatorFactory {

    private static final Logger logger = LoggerFactory.getLogger(IdAllocatorFactory.class);

    private final IngestionConfig config;
    private final Clock clock;

    @Inject
    public IdAllocatorFactory(IngestionConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * Opens an allocation scope for one batch run.
     *
     * @return supplier to call once per document
     */
    public Supplier<IdAllocator> batchScope() {
        AllocationMode mode = config.id().mode();
        logger.debug("Opening identifier scope (mode={}, seed={})", mode, config.id().seed());
        if (mode == AllocationMode.WALL_CLOCK) {
            IdAllocator shared = newAllocator();
            return () -> shared;
        }
        return this::newAllocator;
    }

    /**
     * Creates a fresh allocator for a single document.
     */
    public IdAllocator newAllocator() {
        if (config.id().mode() == AllocationMode.DETERMINISTIC) {
            return IdAllocator.deterministic(config.id().seed(), config.id().prefixLength());
        }
        return IdAllocator.wallClock(clock, config.id().prefixLength(), config.id().maxPerMillisecond());
    }
}
