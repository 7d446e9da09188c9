package nl.bytesoflife.deltaboard.model;

import java.util.Locale;

/**
 * Which end of a connector an edit addresses.
 */
public enum ConnectorSide {
    FROM("start"),
    TO("end");

    private final String wireName;

    ConnectorSide(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public ConnectorEndpoint endpointOf(ConnectorPayload connector) {
        return this == FROM ? connector.from() : connector.to();
    }

    public ConnectorPayload replace(ConnectorPayload connector, ConnectorEndpoint endpoint) {
        return this == FROM ? connector.withFrom(endpoint) : connector.withTo(endpoint);
    }

    public static ConnectorSide fromWireName(String name) {
        if (name == null) return null;
        return switch (name.toLowerCase(Locale.ROOT).trim()) {
            case "start", "from" -> FROM;
            case "end", "to" -> TO;
            default -> null;
        };
    }
}
