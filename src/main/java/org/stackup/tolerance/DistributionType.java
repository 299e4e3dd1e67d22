package org.stackup.tolerance;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 环节误差的统计分布假设。
 * <p>
 * {@link #TRIANGULAR} 仅为后续扩展预留：分析器目前按正态分布处理它。
 */
public enum DistributionType {
    NORMAL("normal"),
    UNIFORM("uniform"),
    TRIANGULAR("triangular");

    private final String wireName;

    DistributionType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static DistributionType fromWireName(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (DistributionType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
