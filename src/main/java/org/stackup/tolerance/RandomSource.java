package org.stackup.tolerance;

import java.util.SplittableRandom;

/**
 * Monte Carlo 使用的随机源抽象。
 * <p>
 * 测试中使用 {@link #seeded(long)} 获得可复现的序列；生产环境使用 {@link #unseeded()}。
 * {@link #split()} 用于并行采样时为每个 worker 派生独立的随机流。
 */
public interface RandomSource {

    /**
     * 返回 {@code [0, 1)} 区间的均匀随机数。
     */
    double nextDouble();

    /**
     * 派生一个与当前源统计独立的新随机源（对确定性种子而言，派生结果同样确定）。
     */
    RandomSource split();

    static RandomSource seeded(long seed) {
        return new SplittableRandomSource(new SplittableRandom(seed));
    }

    static RandomSource unseeded() {
        return new SplittableRandomSource(new SplittableRandom());
    }

    /**
     * 基于 {@link SplittableRandom} 的实现（非线程安全；每个 worker 各持一个）。
     */
    final class SplittableRandomSource implements RandomSource {

        private final SplittableRandom random;

        SplittableRandomSource(SplittableRandom random) {
            this.random = random;
        }

        @Override
        public double nextDouble() {
            return random.nextDouble();
        }

        @Override
        public RandomSource split() {
            return new SplittableRandomSource(random.split());
        }
    }
}
