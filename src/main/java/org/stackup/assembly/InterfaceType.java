package org.stackup.assembly;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 配合界面类型，附带该类型的建议对称公差（mm）。
 */
public enum InterfaceType {
    FACE_TO_FACE("face_to_face", 0.05),
    PIN_IN_HOLE("pin_in_hole", 0.025),
    SHAFT_IN_BORE("shaft_in_bore", 0.016),
    THREAD_ENGAGEMENT("thread_engagement", 0.1),
    UNKNOWN("unknown", 0.1);

    private final String wireName;
    private final double suggestedTolerance;

    InterfaceType(String wireName, double suggestedTolerance) {
        this.wireName = wireName;
        this.suggestedTolerance = suggestedTolerance;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public double suggestedTolerance() {
        return suggestedTolerance;
    }

    @JsonCreator
    public static InterfaceType fromWireName(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (InterfaceType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
