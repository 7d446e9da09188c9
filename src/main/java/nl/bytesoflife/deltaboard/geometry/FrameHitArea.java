package nl.bytesoflife.deltaboard.geometry;

public enum FrameHitArea {
    TITLE,
    BORDER,
    INSIDE
}
