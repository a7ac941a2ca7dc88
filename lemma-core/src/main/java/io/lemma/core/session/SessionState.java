package io.lemma.core.session;

import io.lemma.core.exception.ProofSessionException;
import java.util.ArrayList;
import java.util.List;

/// Append-only node arena plus the session's running flag.
///
/// Node ids are indices into the arena: zero-based, sequential, never reused. The root
/// (id 0) is present from construction. `running` starts true and flips to false exactly
/// once.
///
/// @implNote **Not thread-safe**. Owned by the single session thread.
public final class SessionState {

    /// Id of the root node.
    public static final int ROOT = 0;

    private final List<Node> nodes = new ArrayList<>();
    private boolean running = true;

    /// Creates a session holding only the given root.
    ///
    /// @param root root node, must be its own parent, not null
    public SessionState(Node root) {
        if (root.parent() != ROOT) {
            throw new IllegalArgumentException("root node must be its own parent");
        }
        nodes.add(root);
    }

    /// Appends a node and assigns it the next id.
    ///
    /// @param node node to append; its parent must already exist, not null
    /// @return id of the appended node, equal to the node count before the append
    /// @throws IllegalArgumentException if the parent id does not exist
    public int append(Node node) {
        int id = nodes.size();
        if (node.parent() >= id) {
            throw new IllegalArgumentException(
                    "parent " + node.parent() + " does not precede node " + id);
        }
        nodes.add(node);
        return id;
    }

    /// Looks up a node by id.
    ///
    /// @param id node id
    /// @return the node, never null
    /// @throws ProofSessionException with kind `INVALID_PARAMS` if `id` is out of range
    public Node lookup(int id) {
        if (id < 0 || id >= nodes.size()) {
            throw ProofSessionException.unknownNode(id, nodes.size());
        }
        return nodes.get(id);
    }

    /// Returns the number of nodes, which is also the next id to be assigned.
    ///
    /// @return node count, at least 1
    public int size() {
        return nodes.size();
    }

    public boolean isRunning() {
        return running;
    }

    /// Stops the session.
    ///
    /// @return true if this call performed the running -> stopped transition
    public boolean stop() {
        boolean wasRunning = running;
        running = false;
        return wasRunning;
    }
}
