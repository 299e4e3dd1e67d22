package org.stackup.tolerance;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * ISO 常用配合（基孔制）的孔/轴偏差表，单位 mm，针对公称尺寸约 18–30 mm 的区段。
 */
public final class StandardFits {

    public enum Category {
        CLEARANCE,
        TRANSITION,
        INTERFERENCE
    }

    /**
     * 偏差（两者均以非负幅值存储，含义同 {@link ChainLink}）。
     */
    public record Deviation(double plusTolerance, double minusTolerance) {
    }

    /**
     * @param designation 配合代号，例如 {@code H7/g6}
     * @param category    配合类别
     * @param hole        孔偏差
     * @param shaft       轴偏差
     */
    public record Fit(String designation, Category category, Deviation hole, Deviation shaft) {
    }

    private static final List<Fit> FITS = List.of(
            new Fit("H7/g6", Category.CLEARANCE, new Deviation(0.025, 0), new Deviation(0, 0.016)),
            new Fit("H8/f7", Category.CLEARANCE, new Deviation(0.033, 0), new Deviation(0, 0.025)),
            new Fit("H9/d9", Category.CLEARANCE, new Deviation(0.052, 0), new Deviation(0, 0.052)),
            new Fit("H7/k6", Category.TRANSITION, new Deviation(0.025, 0), new Deviation(0.015, 0.001)),
            new Fit("H7/n6", Category.TRANSITION, new Deviation(0.025, 0), new Deviation(0.023, 0.002)),
            new Fit("H7/p6", Category.INTERFERENCE, new Deviation(0.025, 0), new Deviation(0.035, 0.022)),
            new Fit("H7/s6", Category.INTERFERENCE, new Deviation(0.025, 0), new Deviation(0.043, 0.035))
    );

    private StandardFits() {
    }

    public static List<Fit> all() {
        return FITS;
    }

    /**
     * 按代号查找（忽略大小写与斜杠，例如 {@code h7g6}、{@code H7/g6} 均可）。
     */
    public static Optional<Fit> find(String designation) {
        if (designation == null || designation.isBlank()) {
            return Optional.empty();
        }
        String key = normalize(designation);
        return FITS.stream().filter(f -> normalize(f.designation()).equals(key)).findFirst();
    }

    private static String normalize(String designation) {
        return designation.replace("/", "").trim().toLowerCase(Locale.ROOT);
    }
}
