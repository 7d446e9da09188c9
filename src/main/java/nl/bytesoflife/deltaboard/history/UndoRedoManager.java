package nl.bytesoflife.deltaboard.history;

import nl.bytesoflife.deltaboard.config.BoardSettings;
import nl.bytesoflife.deltaboard.document.BoardDocument;
import nl.bytesoflife.deltaboard.document.Transaction;
import nl.bytesoflife.deltaboard.document.TransactionListener;
import nl.bytesoflife.deltaboard.document.TransactionOrigin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Groups the document's tracked transactions into undo steps and replays their recorded
 * changes backwards or forwards.
 * <p>
 * Baseline ({@link TransactionOrigin#LOCAL}) and agent transactions are one step each. Coalescing
 * origins keep appending to the open step until the origin changes, a baseline transaction
 * arrives or {@link #stopCapturing()} is called. Remote and replayed transactions are never recorded
 * and do not close the open step.
 */
public class UndoRedoManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(UndoRedoManager.class);

    private final BoardDocument document;
    private final int stackCap;
    private final Deque<UndoStep> undoStack = new ArrayDeque<>();
    private final Deque<UndoStep> redoStack = new ArrayDeque<>();
    private final List<Runnable> stackChangeListeners = new ArrayList<>();
    private final TransactionListener listener = this::onTransaction;

    private UndoStep open;
    private boolean closed;

    public UndoRedoManager(BoardDocument document) {
        this(document, BoardSettings.defaults());
    }

    public UndoRedoManager(BoardDocument document, BoardSettings settings) {
        this.document = document;
        this.stackCap = settings.historyStackCap();
        document.registerTransactionListener(listener);
    }

    private void onTransaction(Transaction transaction) {
        TransactionOrigin origin = transaction.origin();
        if (!origin.isTracked() || transaction.isEmpty()) return;

        if (open != null && origin.isCoalescing() && open.getOrigin() == origin) {
            open.append(transaction);
            return;
        }

        UndoStep step = new UndoStep(transaction);
        undoStack.addLast(step);
        redoStack.clear();
        while (undoStack.size() > stackCap) {
            undoStack.removeFirst();
        }
        open = origin.isCoalescing() ? step : null;
        notifyStackChange();
    }

    /**
     * Closes the open step so the next transaction starts a new one.
     */
    public void stopCapturing() {
        open = null;
    }

    public boolean undo() {
        open = null;
        UndoStep step = undoStack.pollLast();
        if (step == null) return false;
        document.applyChanges(TransactionOrigin.HISTORY, step.inverseChanges());
        redoStack.addLast(step);
        log.debug("Undid {} step of {} transactions", step.getOrigin(), step.getTransactionCount());
        notifyStackChange();
        return true;
    }

    public boolean redo() {
        open = null;
        UndoStep step = redoStack.pollLast();
        if (step == null) return false;
        document.applyChanges(TransactionOrigin.HISTORY, step.forwardChanges());
        undoStack.addLast(step);
        log.debug("Redid {} step of {} transactions", step.getOrigin(), step.getTransactionCount());
        notifyStackChange();
        return true;
    }

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    public int getUndoDepth() {
        return undoStack.size();
    }

    public int getRedoDepth() {
        return redoStack.size();
    }

    public void registerStackChangeListener(Runnable callback) {
        stackChangeListeners.add(callback);
    }

    public void clear() {
        undoStack.clear();
        redoStack.clear();
        open = null;
        notifyStackChange();
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        document.unregisterTransactionListener(listener);
        stackChangeListeners.clear();
    }

    private void notifyStackChange() {
        for (Runnable callback : List.copyOf(stackChangeListeners)) {
            callback.run();
        }
    }
}
