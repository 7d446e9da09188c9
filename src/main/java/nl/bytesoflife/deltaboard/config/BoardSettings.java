package nl.bytesoflife.deltaboard.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Tunable constants shared by the store, the history manager and the agent runner.
 * Distances are in world units.
 *
 * @param minObjectSize      floor for width and height of every non-connector object
 * @param attachRadius       how close a point must be to a port for a connector to attach
 * @param placementGapX      column spacing of the agent's auto-placement grid
 * @param placementGapY      row spacing of the agent's auto-placement grid
 * @param layoutMargin       margin around frames wrapped by the agent's template post-processing
 * @param layoutTitleBar     extra top space reserved for a wrapping frame's title
 * @param coordinateLimit    absolute bound for agent-supplied coordinates
 * @param historyStackCap    maximum number of undo steps kept
 */
public record BoardSettings(
        double minObjectSize,
        double attachRadius,
        double placementGapX,
        double placementGapY,
        double layoutMargin,
        double layoutTitleBar,
        double coordinateLimit,
        int historyStackCap
) {
    private static final Logger log = LoggerFactory.getLogger(BoardSettings.class);

    public static final String RESOURCE = "/deltaboard.properties";

    public static final BoardSettings DEFAULTS = new BoardSettings(24, 20, 230, 170, 24, 32, 100_000, 100);

    public BoardSettings {
        if (minObjectSize <= 0) {
            throw new IllegalArgumentException("Minimum object size must be > 0");
        }
        if (attachRadius < 0 || layoutMargin < 0 || layoutTitleBar < 0) {
            throw new IllegalArgumentException("Distances must be >= 0");
        }
        if (coordinateLimit <= 0) {
            throw new IllegalArgumentException("Coordinate limit must be > 0");
        }
        if (historyStackCap < 1) {
            throw new IllegalArgumentException("History stack cap must be >= 1");
        }
    }

    public static BoardSettings defaults() {
        return DEFAULTS;
    }

    /**
     * Defaults overridden by {@value #RESOURCE} when it is on the classpath.
     */
    public static BoardSettings load() {
        try (InputStream is = BoardSettings.class.getResourceAsStream(RESOURCE)) {
            if (is == null) {
                log.debug("No {} on the classpath, using defaults", RESOURCE);
                return DEFAULTS;
            }
            Properties properties = new Properties();
            properties.load(is);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE, e);
        }
    }

    public static BoardSettings fromProperties(Properties p) {
        BoardSettings d = DEFAULTS;
        return new BoardSettings(
                positive(p, "object.min-size", d.minObjectSize),
                nonNegative(p, "connector.attach-radius", d.attachRadius),
                nonNegative(p, "agent.placement.gap-x", d.placementGapX),
                nonNegative(p, "agent.placement.gap-y", d.placementGapY),
                nonNegative(p, "agent.layout.margin", d.layoutMargin),
                nonNegative(p, "agent.layout.title-bar", d.layoutTitleBar),
                positive(p, "agent.coordinate-limit", d.coordinateLimit),
                (int) positive(p, "history.stack-cap", d.historyStackCap));
    }

    public BoardSettings withMinObjectSize(double minObjectSize) {
        return new BoardSettings(minObjectSize, attachRadius, placementGapX, placementGapY,
                layoutMargin, layoutTitleBar, coordinateLimit, historyStackCap);
    }

    public BoardSettings withAttachRadius(double attachRadius) {
        return new BoardSettings(minObjectSize, attachRadius, placementGapX, placementGapY,
                layoutMargin, layoutTitleBar, coordinateLimit, historyStackCap);
    }

    public BoardSettings withPlacementGap(double gapX, double gapY) {
        return new BoardSettings(minObjectSize, attachRadius, gapX, gapY,
                layoutMargin, layoutTitleBar, coordinateLimit, historyStackCap);
    }

    public BoardSettings withLayout(double margin, double titleBar) {
        return new BoardSettings(minObjectSize, attachRadius, placementGapX, placementGapY,
                margin, titleBar, coordinateLimit, historyStackCap);
    }

    public BoardSettings withCoordinateLimit(double coordinateLimit) {
        return new BoardSettings(minObjectSize, attachRadius, placementGapX, placementGapY,
                layoutMargin, layoutTitleBar, coordinateLimit, historyStackCap);
    }

    public BoardSettings withHistoryStackCap(int historyStackCap) {
        return new BoardSettings(minObjectSize, attachRadius, placementGapX, placementGapY,
                layoutMargin, layoutTitleBar, coordinateLimit, historyStackCap);
    }

    private static double positive(Properties p, String key, double fallback) {
        double value = number(p, key, fallback);
        if (value <= 0) {
            log.warn("Setting {}={} must be > 0, using {}", key, value, fallback);
            return fallback;
        }
        return value;
    }

    private static double nonNegative(Properties p, String key, double fallback) {
        double value = number(p, key, fallback);
        if (value < 0) {
            log.warn("Setting {}={} must be >= 0, using {}", key, value, fallback);
            return fallback;
        }
        return value;
    }

    private static double number(Properties p, String key, double fallback) {
        String raw = p.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            double value = Double.parseDouble(raw.trim());
            if (!Double.isFinite(value)) {
                log.warn("Setting {}={} is not finite, using {}", key, raw, fallback);
                return fallback;
            }
            return value;
        } catch (NumberFormatException e) {
            log.warn("Setting {}={} is not a number, using {}", key, raw, fallback);
            return fallback;
        }
    }
}
