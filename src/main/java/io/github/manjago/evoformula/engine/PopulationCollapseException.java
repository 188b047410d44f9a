package io.github.manjago.evoformula.engine;

/**
 * Backfill could not restore the population to its required size.
 * <p>
 * Signals a defect in the breeder (mutation and fresh generation stopped
 * producing distinct candidates), so the run is aborted.
 */
public class PopulationCollapseException extends IllegalStateException {

    private final int required;
    private final int available;

    public PopulationCollapseException(int required, int available, int rejected) {
        super(String.format("Population collapsed: %d of %d distinct candidates after %d rejected backfills",
                available, required, rejected));
        this.required = required;
        this.available = available;
    }

    public int getRequired() {
        return required;
    }

    public int getAvailable() {
        return available;
    }
}
