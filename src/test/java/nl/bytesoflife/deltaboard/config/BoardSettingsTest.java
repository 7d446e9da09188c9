package nl.bytesoflife.deltaboard.config;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class BoardSettingsTest {

    @Test
    void bundledResourceMatchesDefaults() {
        assertEquals(BoardSettings.defaults(), BoardSettings.load());
    }

    @Test
    void propertiesOverrideDefaults() {
        Properties p = new Properties();
        p.setProperty("object.min-size", "10");
        p.setProperty("agent.placement.gap-x", " 300 ");
        p.setProperty("history.stack-cap", "5");

        BoardSettings settings = BoardSettings.fromProperties(p);

        assertEquals(10, settings.minObjectSize());
        assertEquals(300, settings.placementGapX());
        assertEquals(170, settings.placementGapY());
        assertEquals(5, settings.historyStackCap());
    }

    @Test
    void malformedValuesFallBack() {
        Properties p = new Properties();
        p.setProperty("object.min-size", "-4");
        p.setProperty("connector.attach-radius", "wide");
        p.setProperty("agent.coordinate-limit", "Infinity");
        p.setProperty("history.stack-cap", "0");

        assertEquals(BoardSettings.defaults(), BoardSettings.fromProperties(p));
    }

    @Test
    void withersCopy() {
        BoardSettings base = BoardSettings.defaults();
        BoardSettings changed = base.withHistoryStackCap(3).withLayout(10, 20).withAttachRadius(0);

        assertEquals(100, base.historyStackCap());
        assertEquals(3, changed.historyStackCap());
        assertEquals(10, changed.layoutMargin());
        assertEquals(20, changed.layoutTitleBar());
        assertEquals(0, changed.attachRadius());
        assertEquals(base.coordinateLimit(), changed.coordinateLimit());
    }

    @Test
    void invalidValuesAreRejected() {
        BoardSettings d = BoardSettings.defaults();
        assertThrows(IllegalArgumentException.class, () -> d.withMinObjectSize(0));
        assertThrows(IllegalArgumentException.class, () -> d.withAttachRadius(-1));
        assertThrows(IllegalArgumentException.class, () -> d.withCoordinateLimit(0));
        assertThrows(IllegalArgumentException.class, () -> d.withHistoryStackCap(0));
    }
}
