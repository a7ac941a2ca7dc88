package io.lemma.core.exception;

/// Error taxonomy of the session driver with stable wire codes.
///
/// Transport-level kinds use the JSON-RPC reserved range; engine-level kinds use small
/// non-negative codes.
public enum ErrorKind {
    /// Input line is not valid JSON. Never correlated to a request id.
    TRANSPORT_PARSE(-32700, "Parse error"),
    /// Valid JSON that is not a request. Never correlated to a request id.
    INVALID_REQUEST(-32600, "Invalid request"),
    METHOD_NOT_FOUND(-32601, "Method not found"),
    /// Malformed params or an unknown node id.
    INVALID_PARAMS(-32602, "Invalid params"),
    INTERNAL(-32603, "Internal error"),
    STEP_PARSE(0, "Step parse error"),
    /// Carries the step's diagnostic messages.
    STEP_EXECUTION(1, "Step execution error"),
    EXPRESSION_PARSE(2, "Expression parse error"),
    ELABORATION(3, "Elaboration error");

    private final int code;
    private final String title;

    ErrorKind(int code, String title) {
        this.code = code;
        this.title = title;
    }

    /// Returns the wire error code.
    ///
    /// @return stable code for this kind
    public int getCode() {
        return code;
    }

    /// Returns a short human-readable title.
    ///
    /// @return title, never null
    public String getTitle() {
        return title;
    }

    /// Returns whether responses for this kind echo the request id.
    ///
    /// @return false for failures raised before a request could be decoded
    public boolean isCorrelated() {
        return this != TRANSPORT_PARSE && this != INVALID_REQUEST;
    }
}
