package nl.bytesoflife.deltaboard.agent;

import nl.bytesoflife.deltaboard.document.BoardDocument;
import nl.bytesoflife.deltaboard.document.ObjectMap;
import nl.bytesoflife.deltaboard.document.TransactionOrigin;
import nl.bytesoflife.deltaboard.model.BoardObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Point-in-time copy of a live board held in a private document that only one agent session
 * mutates. Objects are immutable, so copying references is enough to decouple it from the source.
 */
public final class BoardMirror {

    private static final String SITE_SUFFIX = "/mirror";

    private final BoardDocument document;

    private BoardMirror(BoardDocument document) {
        this.document = document;
    }

    public static BoardMirror snapshot(BoardDocument live) {
        BoardDocument copy = BoardDocument.create(live.getSiteId() + SITE_SUFFIX);
        List<BoardObject> objects = new ArrayList<>(live.objects().values());
        List<String> order = new ArrayList<>();
        for (String id : live.zOrder().toList()) {
            if (live.objects().has(id) && !order.contains(id)) order.add(id);
        }
        copy.transact(TransactionOrigin.LOCAL, () -> {
            for (BoardObject obj : objects) {
                copy.objects().set(obj);
            }
            if (!order.isEmpty()) copy.zOrder().push(order);
        });
        return new BoardMirror(copy);
    }

    public BoardDocument getDocument() {
        return document;
    }

    public ObjectMap objects() {
        return document.objects();
    }

    /**
     * Ids in paint order.
     */
    public List<String> getOrder() {
        return document.zOrder().toList();
    }
}
