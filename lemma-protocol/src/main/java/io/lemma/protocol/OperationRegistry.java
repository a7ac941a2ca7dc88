package io.lemma.protocol;

import io.lemma.core.engine.GoalSpec;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Explicit map from wire method names to {@link OperationHandler}s.
///
/// {@link #standard(long)} registers the nine session operations. The registry is built
/// once at start-up and only read afterwards.
public final class OperationRegistry {

    public static final String APPLY_STEP = "applyStep";
    public static final String QUERY_STATE = "queryState";
    public static final String QUERY_MESSAGES = "queryMessages";
    public static final String RESOLVE_NAME = "resolveName";
    public static final String UNIFY = "unify";
    public static final String NEW_STATE = "newState";
    public static final String GIVE_UP = "giveUp";
    public static final String COMMIT = "commit";
    public static final String POSITION = "position";

    private final Map<String, OperationHandler> handlers = new LinkedHashMap<>();

    /// Creates a registry with every session operation.
    ///
    /// @param defaultBudget budget for `applyStep` requests that carry none, `0` for
    ///     unlimited
    /// @return populated registry, never null
    public static OperationRegistry standard(long defaultBudget) {
        OperationRegistry registry = new OperationRegistry();
        registry.register(
                APPLY_STEP,
                (session, params) ->
                        session.applyStep(
                                params.requireInt("sid"),
                                params.requireString("step"),
                                params.optionalLong("budget", defaultBudget)));
        registry.register(
                QUERY_STATE, (session, params) -> session.queryState(params.requireInt("sid")));
        registry.register(
                QUERY_MESSAGES,
                (session, params) -> session.queryMessages(params.requireInt("sid")));
        registry.register(
                RESOLVE_NAME,
                (session, params) ->
                        session.resolveName(
                                params.requireInt("sid"), params.requireString("name")));
        registry.register(
                UNIFY,
                (session, params) ->
                        session.unify(
                                        params.requireInt("sid"),
                                        params.requireString("lhs"),
                                        params.requireString("rhs"))
                                .orElse(null));
        registry.register(
                NEW_STATE,
                (session, params) ->
                        session.newState(params.requireList("goals", GoalSpec.class)));
        registry.register(
                GIVE_UP, (session, params) -> session.giveUp(params.requireInt("sid")));
        registry.register(
                COMMIT,
                (session, params) -> {
                    session.commit(params.requireInt("sid"));
                    return null;
                });
        registry.register(POSITION, (session, params) -> session.position().orElse(null));
        return registry;
    }

    /// Registers a handler, replacing any previous one for the same method.
    ///
    /// @param method wire method name, not null
    /// @param handler handler, not null
    public void register(String method, OperationHandler handler) {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        handlers.put(method, handler);
    }

    public Optional<OperationHandler> lookup(String method) {
        return Optional.ofNullable(handlers.get(method));
    }

    /// Returns the registered method names in registration order.
    ///
    /// @return unmodifiable view, never null
    public Set<String> methods() {
        return Collections.unmodifiableSet(handlers.keySet());
    }
}
