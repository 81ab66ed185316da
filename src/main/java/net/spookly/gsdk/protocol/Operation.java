package net.spookly.gsdk.protocol;

import java.util.HashMap;
import java.util.Map;

/**
 * Instruction carried by a heartbeat response.
 */
public enum Operation {
    CONTINUE("Continue"),
    ACTIVE("Active"),
    TERMINATE("Terminate"),
    /** Any operation name this agent does not act on. */
    UNKNOWN(null);

    private static final Map<String, Operation> BY_WIRE_NAME = new HashMap<>();

    static {
        for (Operation operation : values()) {
            if (operation.wireName != null) {
                BY_WIRE_NAME.put(operation.wireName, operation);
            }
        }
    }

    private final String wireName;

    Operation(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Total lookup: names outside the recognized table map to {@link #UNKNOWN}.
     */
    public static Operation fromWireName(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return BY_WIRE_NAME.getOrDefault(value, UNKNOWN);
    }
}
