package net.tvcatalog.support.pagination;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Traversal direction carried by a continuation token.
 */
public enum CursorDirection {
    NEXT("next"),
    PREV("prev");

    private final String wireValue;

    CursorDirection(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public boolean isBackward() {
        return this == PREV;
    }

    /**
     * Resolves the wire value ({@code next} or {@code prev}); anything else is rejected.
     */
    @JsonCreator
    public static CursorDirection fromWireValue(String raw) {
        for (CursorDirection direction : values()) {
            if (direction.wireValue.equals(raw)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown cursor direction: " + raw);
    }
}
