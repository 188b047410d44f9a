package io.github.manjago.evoformula.engine;

/**
 * Population entry: a candidate and its fitness.
 */
public record Scored<T>(T candidate, double score) {

    @Override
    public String toString() {
        return String.format("%s [score=%.6g]", candidate, score);
    }
}
