package com.swatcl.script;

/**
 * Capabilities the surrounding interpreter lends to the expression engine.
 * Either method may throw; the engine reports the failure as a VARIABLE or
 * COMMAND error. Implementations may call back into {@link SwatclExpr}.
 */
public interface ExprHost {

    /** Current value of the named variable, or null if it does not exist. */
    String getVariable(String name);

    /** Runs the text of a bracketed command and returns its result. */
    String evaluateCommand(String script);
}
