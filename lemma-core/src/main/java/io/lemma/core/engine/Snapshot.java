package io.lemma.core.engine;

/// Opaque, restorable capture of a {@link ProofEngine}'s mutable state.
///
/// Produced by {@link ProofEngine#captureSnapshot()} and {@link ProofEngine#buildContext}.
/// Implementations must be immutable: restoring the same snapshot any number of times
/// yields the same observable engine state. A snapshot is only meaningful to the engine
/// instance that produced it.
///
/// @see ProofEngine#restore(Snapshot)
public interface Snapshot {}
