package io.quantum.core.spi;

import java.util.Map;

/** Application log sink used by {@code q:log}. When none is configured, SLF4J is used. */
public interface LogService {

    void log(String level, String message, Map<String, Object> context);
}
