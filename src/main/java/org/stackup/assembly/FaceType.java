package org.stackup.assembly;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 面的几何分类（由外部几何前端给出）。
 */
public enum FaceType {
    PLANAR("planar"),
    CYLINDRICAL("cylindrical"),
    CONICAL("conical"),
    SPHERICAL("spherical"),
    TOROIDAL("toroidal"),
    FREEFORM("freeform");

    private final String wireName;

    FaceType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static FaceType fromWireName(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (FaceType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
