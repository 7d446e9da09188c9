package nl.bytesoflife.deltaboard.document;

/**
 * Tag naming the logical activity behind a transaction. The history manager uses it to
 * decide which transactions are undoable and which ones merge into a single step.
 */
public enum TransactionOrigin {
    /** Baseline: discrete local edits, each its own undo step. */
    LOCAL(true, false),
    GESTURE(true, true),
    DRAG(true, true),
    TEXT_EDIT(true, true),
    /** A committed agent diff; one undo step per commit. */
    AGENT(true, false),
    REMOTE(false, false),
    /** Undo/redo replay; never recorded again. */
    HISTORY(false, false);

    private final boolean tracked;
    private final boolean coalescing;

    TransactionOrigin(boolean tracked, boolean coalescing) {
        this.tracked = tracked;
        this.coalescing = coalescing;
    }

    public boolean isTracked() {
        return tracked;
    }

    public boolean isCoalescing() {
        return coalescing;
    }

    public boolean isBaseline() {
        return this == LOCAL;
    }
}
