package org.mides.routeplanner.config;

import com.google.ortools.Loader;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;

/**
 * Loads the OR-Tools native libraries once. A platform without them keeps
 * running; sequencing then uses the heuristic fallback.
 */
@Component
@Scope("singleton")
public class BootstrapConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(BootstrapConfiguration.class);

    private volatile boolean solverAvailable;

    @PostConstruct
    public void init() {
        try {
            Loader.loadNativeLibraries();
            solverAvailable = true;
            logger.info("OR-Tools native libraries loaded");
        } catch (RuntimeException | LinkageError e) {
            solverAvailable = false;
            logger.warn("OR-Tools native libraries unavailable, sequencing will use the nearest neighbor fallback: {}",
                e.getMessage());
        }
    }

    public boolean isSolverAvailable() {
        return solverAvailable;
    }
}
