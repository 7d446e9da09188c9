package nl.bytesoflife.deltaboard.model;

public record TextPayload(String content, String color, TextStyle style) implements ObjectPayload {

    public static final String DEFAULT_COLOR = "#334155";

    public TextPayload {
        if (content == null) content = "";
        if (color == null) color = DEFAULT_COLOR;
        if (style == null) style = TextStyle.DEFAULT;
    }

    @Override
    public ObjectType type() {
        return ObjectType.TEXT;
    }

    @Override
    public <R> R accept(PayloadVisitor<R> visitor) {
        return visitor.visitText(this);
    }

    @Override
    public TextPayload withColor(String color) {
        return new TextPayload(content, color, style);
    }

    public TextPayload withContent(String content) {
        return new TextPayload(content, color, style);
    }

    public TextPayload withStyle(TextStyle style) {
        return new TextPayload(content, color, style);
    }
}
