package nl.bytesoflife.deltaboard.model;

public interface PayloadVisitor<R> {

    R visitSticky(StickyPayload sticky);

    R visitShape(ShapePayload shape);

    R visitText(TextPayload text);

    R visitConnector(ConnectorPayload connector);

    R visitFrame(FramePayload frame);

    R visitTable(TablePayload table);
}
