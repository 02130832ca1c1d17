/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package io.github.jbellis.fixedbits.bench;

import io.github.jbellis.fixedbits.BitWidth;
import io.github.jbellis.fixedbits.Bitset;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Benchmark of single-bit access, word-wise logic and width conversion for each bitset width.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Thread)
@Fork(value = 1)
@Warmup(iterations = 2)
@Measurement(iterations = 3)
@Threads(1)
public class BitsetOperationsBenchmark {
    private static final Logger log = LoggerFactory.getLogger(BitsetOperationsBenchmark.class);

    /**
     * Creates a new benchmark instance.
     * <p>
     * This constructor is invoked by JMH and should not be called directly.
     */
    public BitsetOperationsBenchmark() {
    }

    /**
     * The bitset width in bits.
     */
    @Param({"8", "16", "32", "64", "128", "256"})
    private int bits;

    private BitWidth width;

    /** Two random operands of the benchmarked width. */
    private Operands<?> operands;

    /** Positions visited by the single-bit benchmarks, all valid for the width. */
    private int[] positions;

    private static final class Operands<T extends Bitset<T>> {
        final T left;
        final T right;

        Operands(T left, T right) {
            this.left = left;
            this.right = right;
        }
    }

    /**
     * Creates random operands and positions for the configured width.
     */
    @Setup
    public void setup() {
        width = BitWidth.of(bits);
        var random = new Random(42);
        operands = operandsFor(width.convert(randomBitset256(random)), random);
        positions = new int[1024];
        for (int i = 0; i < positions.length; i++) {
            positions[i] = random.nextInt(bits);
        }
        log.info("Created operands for width {}: {} and {}", width, operands.left, operands.right);
    }

    private static <T extends Bitset<T>> Operands<T> operandsFor(Bitset<T> left, Random random) {
        T right = left.copy();
        for (int i = 0; i < right.length(); i++) {
            if (random.nextBoolean()) {
                right.flip(i);
            }
        }
        return new Operands<>(left.copy(), right);
    }

    private static Bitset<?> randomBitset256(Random random) {
        long[] words = new long[BitWidth.W256.words()];
        for (int i = 0; i < words.length; i++) {
            words[i] = random.nextLong();
        }
        return BitWidth.W256.fromLongArray(words);
    }

    /**
     * Sets, flips and tests single bits at precomputed positions.
     *
     * @param blackhole JMH blackhole to prevent dead code elimination
     */
    @Benchmark
    public void singleBitAccess(Blackhole blackhole) {
        blackhole.consume(accessBits(operands.left.copy(), positions));
    }

    private static <T extends Bitset<T>> int accessBits(Bitset<T> bitset, int[] positions) {
        int hits = 0;
        for (int position : positions) {
            bitset.flip(position);
            if (bitset.test(position)) {
                hits++;
            }
            bitset.set(position, (hits & 1) == 0);
        }
        return hits;
    }

    /**
     * Combines the operands with every word-wise operator.
     *
     * @param blackhole JMH blackhole to prevent dead code elimination
     */
    @Benchmark
    public void wordwiseLogic(Blackhole blackhole) {
        blackhole.consume(combine(operands));
    }

    private static <T extends Bitset<T>> T combine(Operands<T> operands) {
        T and = operands.left.and(operands.right);
        T xor = operands.left.xor(operands.right);
        return and.or(xor).not();
    }

    /**
     * Widens to 256 bits and narrows back to the benchmarked width.
     *
     * @param blackhole JMH blackhole to prevent dead code elimination
     */
    @Benchmark
    public void widenAndNarrow(Blackhole blackhole) {
        blackhole.consume(width.convert(operands.left.toBitset256()));
    }

    /**
     * Renders the left operand as binary digits.
     *
     * @param blackhole JMH blackhole to prevent dead code elimination
     */
    @Benchmark
    public void render(Blackhole blackhole) {
        blackhole.consume(operands.left.toString());
    }
}
