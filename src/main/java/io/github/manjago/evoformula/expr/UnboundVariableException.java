package io.github.manjago.evoformula.expr;

/**
 * Thrown when a variable has no binding anywhere in the active provider chain.
 * <p>
 * This is a configuration error of the caller (the expression and the
 * provider disagree on variable names) and is never recovered internally.
 */
public class UnboundVariableException extends RuntimeException {

    private final String variable;

    public UnboundVariableException(String variable) {
        super("No binding for variable '" + variable + "'");
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }
}
