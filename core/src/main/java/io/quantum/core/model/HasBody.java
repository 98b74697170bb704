package io.quantum.core.model;

import java.util.List;

/** Capability of nodes that own child statements. */
public interface HasBody {

    /** All child statements, in document order. */
    List<Node> children();
}
