package com.helmet.corpus.model;

/**
 * @param recover also claim entries left RUNNING, whatever their age. Only safe when no other
 *                run of the stage is alive.
 */
public record RunOptions(
    boolean force,
    boolean retryFailed,
    boolean recover
) {

    public RunOptions(boolean force, boolean retryFailed) {
        this(force, retryFailed, false);
    }

    public static RunOptions defaults() {
        return new RunOptions(false, false, false);
    }
}
