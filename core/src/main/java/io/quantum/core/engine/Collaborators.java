package io.quantum.core.engine;

import io.quantum.core.spi.AgentService;
import io.quantum.core.spi.ComponentResolver;
import io.quantum.core.spi.DataSource;
import io.quantum.core.spi.FileService;
import io.quantum.core.spi.LlmService;
import io.quantum.core.spi.LogService;
import io.quantum.core.spi.MailService;
import io.quantum.core.spi.MessagingTransport;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * External services the executors delegate to. Every collaborator is optional; a node that needs
 * a missing one fails with {@link io.quantum.core.error.NodeExecutionException}.
 *
 * <p>Data sources are keyed by name; the entry under {@link #DEFAULT_DATASOURCE} serves queries
 * that name none.
 */
public final class Collaborators {

    public static final String DEFAULT_DATASOURCE = "default";

    private static final Collaborators NONE = builder().build();

    private final Map<String, DataSource> dataSources;
    private final MessagingTransport messaging;
    private final LlmService llm;
    private final AgentService agents;
    private final MailService mail;
    private final FileService files;
    private final LogService log;
    private final ComponentResolver resolver;

    private Collaborators(Builder b) {
        this.dataSources = Map.copyOf(b.dataSources);
        this.messaging = b.messaging;
        this.llm = b.llm;
        this.agents = b.agents;
        this.mail = b.mail;
        this.files = b.files;
        this.log = b.log;
        this.resolver = b.resolver;
    }

    public static Collaborators none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** The named data source, falling back to the default one when {@code name} is null. */
    public Optional<DataSource> dataSource(String name) {
        return Optional.ofNullable(dataSources.get(name != null ? name : DEFAULT_DATASOURCE));
    }

    public Optional<MessagingTransport> messaging() {
        return Optional.ofNullable(messaging);
    }

    public Optional<LlmService> llm() {
        return Optional.ofNullable(llm);
    }

    public Optional<AgentService> agents() {
        return Optional.ofNullable(agents);
    }

    public Optional<MailService> mail() {
        return Optional.ofNullable(mail);
    }

    public Optional<FileService> files() {
        return Optional.ofNullable(files);
    }

    public Optional<LogService> log() {
        return Optional.ofNullable(log);
    }

    public Optional<ComponentResolver> resolver() {
        return Optional.ofNullable(resolver);
    }

    /** Builder for {@link Collaborators}. */
    public static final class Builder {
        private final Map<String, DataSource> dataSources = new HashMap<>();
        private MessagingTransport messaging;
        private LlmService llm;
        private AgentService agents;
        private MailService mail;
        private FileService files;
        private LogService log;
        private ComponentResolver resolver;

        Builder() {}

        public Builder dataSource(String name, DataSource dataSource) {
            dataSources.put(name, dataSource);
            return this;
        }

        /** Registers the data source used when a query names none. */
        public Builder dataSource(DataSource dataSource) {
            return dataSource(DEFAULT_DATASOURCE, dataSource);
        }

        public Builder messaging(MessagingTransport messaging) {
            this.messaging = messaging;
            return this;
        }

        public Builder llm(LlmService llm) {
            this.llm = llm;
            return this;
        }

        public Builder agents(AgentService agents) {
            this.agents = agents;
            return this;
        }

        public Builder mail(MailService mail) {
            this.mail = mail;
            return this;
        }

        public Builder files(FileService files) {
            this.files = files;
            return this;
        }

        public Builder log(LogService log) {
            this.log = log;
            return this;
        }

        public Builder resolver(ComponentResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Collaborators build() {
            return new Collaborators(this);
        }
    }
}
