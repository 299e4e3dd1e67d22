package org.stackup.tolerance;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 公差链环节的语义类型。
 */
public enum LinkType {
    PART_DIMENSION("part_dimension"),
    INTERFACE_GAP("interface_gap"),
    DATUM_REFERENCE("datum_reference");

    private final String wireName;

    LinkType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * 按外部名称（大小写不敏感）解析；无法识别时返回 null。
     */
    @JsonCreator
    public static LinkType fromWireName(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (LinkType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
