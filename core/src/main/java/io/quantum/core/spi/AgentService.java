package io.quantum.core.spi;

import java.util.List;
import java.util.Map;

/** Tool-using agent collaborator used by {@code q:agent}. */
public interface AgentService {

    AgentResult runAgent(String instruction, List<String> tools, String task, int maxIterations);

    /** Final answer plus the actions the agent took to reach it. */
    record AgentResult(String result, List<Map<String, Object>> actions, int iterations) {

        public AgentResult {
            actions = actions == null ? List.of() : List.copyOf(actions);
        }
    }
}
