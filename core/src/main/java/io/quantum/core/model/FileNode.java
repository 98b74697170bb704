package io.quantum.core.model;

/** {@code <q:file action="read|write" path="..." content="..." name="..."/>}. */
public record FileNode(Action action, String path, String content, String name, SourceLocation location)
        implements Node {

    public enum Action {
        READ,
        WRITE
    }
}
