package io.lemma.kernel.state;

import io.lemma.core.engine.Diagnostic;
import io.lemma.core.engine.Snapshot;
import java.util.List;

/// Immutable capture of a {@link KernelState}.
///
/// @param owner id of the engine instance that produced the snapshot
/// @param goals open goals
/// @param messages accumulated diagnostics
/// @param fresh counter for generated names
public record KernelSnapshot(long owner, List<Goal> goals, List<Diagnostic> messages, int fresh)
        implements Snapshot {

    public KernelSnapshot {
        goals = List.copyOf(goals);
        messages = List.copyOf(messages);
    }
}
