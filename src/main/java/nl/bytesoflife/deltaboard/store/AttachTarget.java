package nl.bytesoflife.deltaboard.store;

import nl.bytesoflife.deltaboard.geometry.Port;
import nl.bytesoflife.deltaboard.model.BoardObject;

/**
 * Object a connector end would snap to, and the port it would bind.
 */
public record AttachTarget(BoardObject object, Port port) {
}
