package io.lemma.protocol;

import io.lemma.core.session.ProofSession;

/// Contract for one protocol method.
///
/// A handler binds its params to typed arguments, invokes the session and returns the
/// value serialized as the response `result`. Register handlers in an
/// {@link OperationRegistry}.
@FunctionalInterface
public interface OperationHandler {

    /// Executes the method.
    ///
    /// @param session session the request targets, not null
    /// @param params request params, not null
    /// @return result value, may be null
    /// @throws io.lemma.core.exception.ProofSessionException on any taxonomy failure
    Object handle(ProofSession session, Params params);
}
