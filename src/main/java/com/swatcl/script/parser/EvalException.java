package com.swatcl.script.parser;

/**
 * Raised for every lexing, parsing and evaluation failure. Evaluation stops at
 * the first one; there is never a partial result.
 */
public class EvalException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode code;

    public EvalException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public EvalException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }

    @Override
    public String toString() {
        return code + ": " + getMessage();
    }
}
