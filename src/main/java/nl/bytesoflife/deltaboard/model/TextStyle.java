package nl.bytesoflife.deltaboard.model;

public record TextStyle(boolean bold, boolean italic, TextSize size) {

    public static final TextStyle DEFAULT = new TextStyle(false, false, TextSize.MEDIUM);

    public TextStyle {
        if (size == null) size = TextSize.MEDIUM;
    }

    public TextStyle withBold(boolean bold) {
        return new TextStyle(bold, italic, size);
    }

    public TextStyle withItalic(boolean italic) {
        return new TextStyle(bold, italic, size);
    }

    public TextStyle withSize(TextSize size) {
        return new TextStyle(bold, italic, size);
    }
}
