package nl.bytesoflife.deltaboard.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Container payload. {@code children} holds ids in attach order.
 */
public record FramePayload(String title, String color, List<String> children) implements ObjectPayload {

    public static final String DEFAULT_TITLE = "Frame";
    public static final String DEFAULT_COLOR = "#E3E8EF";

    public FramePayload {
        if (title == null) title = DEFAULT_TITLE;
        if (color == null) color = DEFAULT_COLOR;
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public ObjectType type() {
        return ObjectType.FRAME;
    }

    @Override
    public <R> R accept(PayloadVisitor<R> visitor) {
        return visitor.visitFrame(this);
    }

    @Override
    public FramePayload withColor(String color) {
        return new FramePayload(title, color, children);
    }

    public FramePayload withTitle(String title) {
        return new FramePayload(title, color, children);
    }

    public FramePayload withChildren(List<String> children) {
        return new FramePayload(title, color, children);
    }

    public FramePayload withChild(String childId) {
        if (children.contains(childId)) return this;
        List<String> next = new ArrayList<>(children);
        next.add(childId);
        return new FramePayload(title, color, next);
    }

    public FramePayload withoutChild(String childId) {
        if (!children.contains(childId)) return this;
        List<String> next = new ArrayList<>(children);
        next.remove(childId);
        return new FramePayload(title, color, next);
    }
}
