package nl.bytesoflife.deltaboard.model;

public record StickyPayload(String text, String color) implements ObjectPayload {

    public StickyPayload {
        if (text == null) text = "";
        if (color == null) color = "yellow";
    }

    @Override
    public ObjectType type() {
        return ObjectType.STICKY;
    }

    @Override
    public <R> R accept(PayloadVisitor<R> visitor) {
        return visitor.visitSticky(this);
    }

    @Override
    public StickyPayload withColor(String color) {
        return new StickyPayload(text, color);
    }

    public StickyPayload withText(String text) {
        return new StickyPayload(text, color);
    }
}
