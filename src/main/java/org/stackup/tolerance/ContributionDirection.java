package org.stackup.tolerance;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 环节对叠加总量的贡献方向：正向贡献 {@code +nominal}，负向贡献 {@code -nominal}。
 */
public enum ContributionDirection {
    POSITIVE("positive", 1.0),
    NEGATIVE("negative", -1.0);

    private final String wireName;
    private final double sign;

    ContributionDirection(String wireName, double sign) {
        this.wireName = wireName;
        this.sign = sign;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public double sign() {
        return sign;
    }

    public ContributionDirection opposite() {
        return this == POSITIVE ? NEGATIVE : POSITIVE;
    }

    @JsonCreator
    public static ContributionDirection fromWireName(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ContributionDirection direction : values()) {
            if (direction.wireName.equals(normalized)) {
                return direction;
            }
        }
        return null;
    }
}
