package nl.bytesoflife.deltaboard.model;

import java.util.Locale;

/**
 * The eight fixed attachment points on an object's perimeter.
 * Each port is expressed as a fraction of the unrotated box.
 */
public enum PortName {
    N("n", 0.5, 0.0),
    E("e", 1.0, 0.5),
    S("s", 0.5, 1.0),
    W("w", 0.0, 0.5),
    NW("nw", 0.0, 0.0),
    NE("ne", 1.0, 0.0),
    SE("se", 1.0, 1.0),
    SW("sw", 0.0, 1.0);

    private final String wireName;
    private final double fx;
    private final double fy;

    PortName(String wireName, double fx, double fy) {
        this.wireName = wireName;
        this.fx = fx;
        this.fy = fy;
    }

    public String getWireName() {
        return wireName;
    }

    public double getFractionX() {
        return fx;
    }

    public double getFractionY() {
        return fy;
    }

    public static PortName fromWireName(String name) {
        if (name == null) return null;
        String lower = name.toLowerCase(Locale.ROOT).trim();
        for (PortName port : values()) {
            if (port.wireName.equals(lower)) return port;
        }
        return null;
    }
}
