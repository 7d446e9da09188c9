package nl.bytesoflife.deltaboard.geometry;

import nl.bytesoflife.deltaboard.model.Point;
import nl.bytesoflife.deltaboard.model.PortName;

public record Port(PortName name, Point position) {

    public double distanceTo(double px, double py) {
        return position.distanceTo(px, py);
    }
}
