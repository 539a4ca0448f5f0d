/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.phylodist.core.unifrac;

import io.phylodist.core.PhyloDistException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/// Fills a {@link DistanceMatrix} by computing every unordered sample pair once.
///
/// The pair list is built up front and never modified. It is cut into contiguous slices,
/// each slice is computed by one task which returns its {@link PairDistance} values, and the calling
/// thread copies every result into its two mirror cells. Slices cover disjoint pairs, so no
/// cell is written twice and no locking is needed. The diagonal is left at zero and never
/// computed.
public final class PairScheduler {
    private static final Logger logger = LogManager.getLogger(PairScheduler.class);

    // Slices per worker; more slices even out pairs of unequal cost
    private static final int SLICES_PER_THREAD = 4;

    private final int threads;

    /// @param threads number of worker threads; 1 computes on the calling thread
    public PairScheduler(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("Thread count must be positive, got: " + threads);
        }
        this.threads = threads;
    }

    /// @return the configured worker count
    public int threads() {
        return threads;
    }

    /// Lists every pair {@code (i, j)} with {@code i < j < sampleCount}, ordered by {@code i}
    /// then {@code j}.
    ///
    /// @param sampleCount number of samples
    /// @return the pairs as {@code [first[], second[]]}
    public static int[][] pairs(int sampleCount) {
        long count = (long) sampleCount * (sampleCount - 1) / 2;
        if (count > Integer.MAX_VALUE - 8) {
            throw new PhyloDistException("Too many samples for a single matrix: " + sampleCount);
        }
        int[] first = new int[(int) Math.max(0, count)];
        int[] second = new int[first.length];
        int k = 0;
        for (int i = 0; i < sampleCount; i++) {
            for (int j = i + 1; j < sampleCount; j++) {
                first[k] = i;
                second[k] = j;
                k++;
            }
        }
        return new int[][]{first, second};
    }

    /// Computes the full matrix.
    ///
    /// @param samples  sample names, which also fix the sample count
    /// @param distance the pair distance to evaluate; must be safe for concurrent calls
    /// @return the filled, symmetric matrix
    /// @throws PairComputationException if any pair computation fails
    public DistanceMatrix compute(List<String> samples, PairDistanceFunction distance) {
        DistanceMatrix matrix = new DistanceMatrix(samples);
        int[][] pairs = pairs(samples.size());
        int[] first = pairs[0];
        int[] second = pairs[1];
        int pairCount = first.length;
        if (pairCount == 0) {
            return matrix;
        }

        long start = System.nanoTime();
        int workers = Math.min(threads, pairCount);
        if (workers == 1) {
            try {
                writeAll(matrix, computeSlice(first, second, 0, pairCount, distance));
            } catch (RuntimeException e) {
                throw new PairComputationException("Pair computation failed: " + e.getMessage(), e);
            }
        } else {
            computeParallel(first, second, workers, distance, matrix);
        }
        logger.info("Computed {} sample pairs on {} thread(s) in {} ms",
            pairCount, workers, (System.nanoTime() - start) / 1_000_000);
        return matrix;
    }

    private void computeParallel(
        int[] first,
        int[] second,
        int workers,
        PairDistanceFunction distance,
        DistanceMatrix matrix
    ) {
        int pairCount = first.length;
        int sliceCount = Math.min(pairCount, workers * SLICES_PER_THREAD);
        int sliceSize = (pairCount + sliceCount - 1) / sliceCount;
        AtomicInteger completed = new AtomicInteger();
        AtomicInteger threadIds = new AtomicInteger();

        ExecutorService pool = Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable, "unifrac-pairs-" + threadIds.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
        try {
            List<Future<List<PairDistance>>> futures = new ArrayList<>();
            for (int from = 0; from < pairCount; from += sliceSize) {
                final int sliceFrom = from;
                final int sliceTo = Math.min(from + sliceSize, pairCount);
                futures.add(pool.submit(() -> {
                    List<PairDistance> result = computeSlice(first, second, sliceFrom, sliceTo, distance);
                    logger.debug("Slice [{},{}) done ({} of {} slices)",
                        sliceFrom, sliceTo, completed.incrementAndGet(), sliceCount);
                    return result;
                }));
            }
            for (Future<List<PairDistance>> future : futures) {
                writeAll(matrix, future.get());
            }
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new PairComputationException("Pair computation failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PairComputationException("Interrupted while computing sample pairs", e);
        } finally {
            pool.shutdownNow();
        }
    }

    private static List<PairDistance> computeSlice(
        int[] first,
        int[] second,
        int from,
        int to,
        PairDistanceFunction distance
    ) {
        List<PairDistance> results = new ArrayList<>(to - from);
        for (int k = from; k < to; k++) {
            results.add(new PairDistance(first[k], second[k], distance.distance(first[k], second[k])));
        }
        return results;
    }

    private static void writeAll(DistanceMatrix matrix, List<PairDistance> results) {
        for (PairDistance result : results) {
            matrix.set(result.first(), result.second(), result.distance());
        }
    }
}
