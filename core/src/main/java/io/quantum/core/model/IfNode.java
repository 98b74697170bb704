package io.quantum.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code <q:if>} with its {@code q:elseif} and {@code q:else} branches in declaration order. The
 * first branch whose condition is truthy runs; an else branch has a {@code null} condition and
 * is always last.
 */
public record IfNode(List<Branch> branches, SourceLocation location) implements Node, HasBody {

    public IfNode {
        branches = List.copyOf(branches);
    }

    @Override
    public List<Node> children() {
        List<Node> all = new ArrayList<>();
        for (Branch branch : branches) {
            all.addAll(branch.body());
        }
        return List.copyOf(all);
    }

    /** One arm of a conditional chain. */
    public record Branch(String condition, List<Node> body, SourceLocation location) implements HasBody {

        public Branch {
            body = List.copyOf(body);
        }

        public boolean isElse() {
            return condition == null;
        }

        @Override
        public List<Node> children() {
            return body;
        }
    }
}
