package io.quantum.core.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable map from {@code q:} tag name to its handler and accepted attributes, built once at
 * startup. Adding a tag means registering a handler here and an executor for the node it produces.
 */
public final class TagRegistry {

    /**
     * One registered tag.
     *
     * @param attributes accepted attribute names, or {@code null} when the tag accepts any
     *     (for example {@code q:invoke}, whose extra attributes are arguments)
     */
    public record TagSpec(String tag, Set<String> attributes, TagHandler handler) {

        public TagSpec {
            attributes = attributes == null ? null : Set.copyOf(attributes);
        }

        public boolean accepts(String attribute) {
            return attributes == null || attributes.contains(attribute);
        }
    }

    private static final TagRegistry DEFAULTS = createDefaults();

    private final Map<String, TagSpec> tags;

    private TagRegistry(Map<String, TagSpec> tags) {
        this.tags = Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    /** The built-in tag set. */
    public static TagRegistry defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** A builder seeded with this registry's tags, for adding or replacing handlers. */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.tags.putAll(tags);
        return builder;
    }

    public Optional<TagSpec> lookup(String tag) {
        return Optional.ofNullable(tags.get(tag));
    }

    public Set<String> tags() {
        return tags.keySet();
    }

    public int size() {
        return tags.size();
    }

    private static TagRegistry createDefaults() {
        Builder builder = builder();
        ControlTags.registerAll(builder);
        FunctionTags.registerAll(builder);
        CompositionTags.registerAll(builder);
        ServiceTags.registerAll(builder);
        return builder.build();
    }

    /** Builder for {@link TagRegistry}. */
    public static final class Builder {

        private final Map<String, TagSpec> tags = new LinkedHashMap<>();

        Builder() {}

        /**
         * Registers a handler, replacing any previous registration for the tag.
         *
         * @param tag        qualified name, e.g. {@code q:loop}
         * @param attributes accepted attributes, or {@code null} for any
         */
        public Builder register(String tag, Set<String> attributes, TagHandler handler) {
            if (tag == null || !tag.startsWith(XmlReader.QUANTUM_PREFIX)) {
                throw new IllegalArgumentException("tag must start with 'q:', got: " + tag);
            }
            if (handler == null) {
                throw new NullPointerException("handler must not be null");
            }
            tags.put(tag, new TagSpec(tag, attributes, handler));
            return this;
        }

        public TagRegistry build() {
            return new TagRegistry(tags);
        }
    }
}
