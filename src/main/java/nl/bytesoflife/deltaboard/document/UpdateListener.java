package nl.bytesoflife.deltaboard.document;

/**
 * Receives the updates a replica produces locally, for shipping to other replicas or to an update log.
 */
@FunctionalInterface
public interface UpdateListener {

    void onUpdate(DocumentUpdate update);
}
