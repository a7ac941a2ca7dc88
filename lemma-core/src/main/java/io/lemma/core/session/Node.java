package io.lemma.core.session;

import io.lemma.core.engine.Snapshot;
import java.util.Objects;

/// One checkpoint in the proof-construction tree.
///
/// Nodes are immutable; the tree only ever grows. A node's id is its index in
/// {@link SessionState}, so it is not stored here.
///
/// @param snapshot engine state at this checkpoint, not null
/// @param parent id of the node this one was derived from; the root is its own parent
/// @param step step text that produced this node, empty for the root and for
///     administrative transitions (`newState`, `giveUp`), not null
public record Node(Snapshot snapshot, int parent, String step) {

    public Node {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Objects.requireNonNull(step, "step must not be null");
        if (parent < 0) {
            throw new IllegalArgumentException("parent must not be negative, was " + parent);
        }
    }

    /// Creates the root node of a session.
    ///
    /// @param snapshot ambient starting state, not null
    /// @return root node with parent 0 and empty step, never null
    public static Node root(Snapshot snapshot) {
        return new Node(snapshot, SessionState.ROOT, "");
    }

    /// Creates a node produced by an administrative transition.
    ///
    /// @param snapshot resulting engine state, not null
    /// @param parent id of the originating node
    /// @return node with empty step text, never null
    public static Node administrative(Snapshot snapshot, int parent) {
        return new Node(snapshot, parent, "");
    }
}
