package io.quantum.core.model;

/** {@code <q:redirect url="..." flash="..." status="302"/>}. */
public record RedirectNode(String url, String flash, String status, SourceLocation location) implements Node {}
