package nl.bytesoflife.deltaboard.model;

public record ShapePayload(ShapeKind kind, String color, String strokeColor) implements ObjectPayload {

    public static final String DEFAULT_STROKE = "#64748b";

    public ShapePayload {
        if (kind == null) kind = ShapeKind.RECTANGLE;
        if (color == null) color = kind == ShapeKind.ELLIPSE ? "teal" : "blue";
        if (strokeColor == null) strokeColor = DEFAULT_STROKE;
    }

    @Override
    public ObjectType type() {
        return ObjectType.SHAPE;
    }

    @Override
    public <R> R accept(PayloadVisitor<R> visitor) {
        return visitor.visitShape(this);
    }

    @Override
    public ShapePayload withColor(String color) {
        return new ShapePayload(kind, color, strokeColor);
    }
}
