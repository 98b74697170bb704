package io.quantum.core.spi;

import io.quantum.core.model.SourceUnit;
import java.util.Optional;

/**
 * Locates components for {@code q:import} and component calls. The host decides where components
 * live; the runtime only asks by name.
 */
public interface ComponentResolver {

    /**
     * Resolves a component.
     *
     * @param name     component name as written in the source
     * @param fromPath optional explicit location from {@code q:import from="..."}, may be {@code null}
     * @return the parsed component, or empty if it cannot be found
     */
    Optional<SourceUnit> resolve(String name, String fromPath);
}
