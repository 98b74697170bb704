package io.quantum.core;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies that the core runtime carries no web-server or servlet dependencies. Hosts bring their
 * own HTTP stack; this test inspects the runtime classpath and fails if one leaks in.
 */
class CoreDependencyTest {

    /** Package roots that MUST NOT appear on the core classpath. */
    private static final List<String> FORBIDDEN_GROUPS = List.of(
            "jakarta.servlet",
            "javax.servlet",
            "io.javalin",
            "org.eclipse.jetty",
            "org.springframework",
            "io.undertow"
            );

    @Test
    void coreClasspathContainsNoServerDependencies() {
        String classpath = System.getProperty("java.class.path");
        assertThat(classpath).as("java.class.path should be set").isNotNull();

        for (String forbiddenGroup : FORBIDDEN_GROUPS) {
            String pathFragment = forbiddenGroup.replace('.', '/');
            assertThat(classpath)
                    .as("Core classpath must not contain server library: %s", forbiddenGroup)
                    .doesNotContain(pathFragment);
        }
    }
}
