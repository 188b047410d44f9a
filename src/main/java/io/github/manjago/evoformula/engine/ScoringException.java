package io.github.manjago.evoformula.engine;

/**
 * A fitness evaluation failed in a worker thread or the barrier was interrupted.
 */
public class ScoringException extends RuntimeException {

    public ScoringException(String message, Throwable cause) {
        super(message, cause);
    }
}
