package org.stackup.dto.tolerance;

/**
 * 直方图分箱（等宽）。
 *
 * @param min        分箱下界（含）
 * @param max        分箱上界（最后一箱含上界）
 * @param count      落入该箱的样本数
 * @param percentage {@code 100 * count / samples}
 */
public record HistogramBin(
        double min,
        double max,
        int count,
        double percentage
) {
}
