package nl.bytesoflife.deltaboard.model;

/**
 * Variant-specific part of a {@link BoardObject}. Consumers dispatch with
 * {@link #accept(PayloadVisitor)} so every variant has to be handled.
 */
public sealed interface ObjectPayload
        permits StickyPayload, ShapePayload, TextPayload, ConnectorPayload, FramePayload, TablePayload {

    ObjectType type();

    <R> R accept(PayloadVisitor<R> visitor);

    /**
     * Color token or hex value, null for variants without a fill.
     */
    String color();

    /**
     * Copy with a new fill color. Connectors have none and return themselves.
     */
    ObjectPayload withColor(String color);
}
