package com.iksanov.checkpoint.node.event;

import com.iksanov.checkpoint.node.storage.StateDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fan-out of checkpoint events to registered listeners.
 * <p>
 * Listeners are invoked synchronously in registration order. A listener that throws is logged
 * and skipped; it never aborts the operation that raised the event or prevents later listeners
 * from running.
 */
public class CheckpointEventNotifier {

    private static final Logger log = LoggerFactory.getLogger(CheckpointEventNotifier.class);
    private final List<CheckpointListener> listeners = new CopyOnWriteArrayList<>();

    public void register(CheckpointListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public boolean unregister(CheckpointListener listener) {
        return listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    public void stateReplaced(StateDocument newState) {
        dispatch("stateReplaced", l -> l.onStateReplaced(newState));
    }

    public void snapshotCreated(String snapshotId) {
        dispatch("snapshotCreated", l -> l.onSnapshotCreated(snapshotId));
    }

    public void snapshotEvicted(String snapshotId) {
        dispatch("snapshotEvicted", l -> l.onSnapshotEvicted(snapshotId));
    }

    public void documentsPruned(List<String> documentIds) {
        List<String> ids = List.copyOf(documentIds);
        dispatch("documentsPruned", l -> l.onDocumentsPruned(ids));
    }

    private void dispatch(String event, Consumer<CheckpointListener> call) {
        for (CheckpointListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (Exception e) {
                log.error("Error in checkpoint listener {} handling {}: {}", listener, event, e.getMessage(), e);
            }
        }
    }
}
