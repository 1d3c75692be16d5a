package com.record.dedup.similarity;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Longest-matching-blocks similarity (Ratcliff/Obershelp).
 * Computes similarity as {@code 2 * M / T}, where M is the total length of the
 * matching blocks and T the combined length of both strings.
 *
 * <p>Blocks are found by taking the longest common contiguous block (earliest in
 * the first string, then in the second, on ties) and recursing on the pieces to
 * its left and right. The operands are put in lexicographic order first so the
 * result does not depend on argument order. Lengths are counted in code points.</p>
 */
public class SequenceMatchSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        String first = s1 != null ? s1 : "";
        String second = s2 != null ? s2 : "";
        if (first.equals(second)) {
            return 1.0;
        }
        if (first.isEmpty() || second.isEmpty()) {
            return 0.0;
        }

        // Canonical operand order keeps the alignment symmetric
        if (first.compareTo(second) > 0) {
            String temp = first;
            first = second;
            second = temp;
        }

        int[] a = first.codePoints().toArray();
        int[] b = second.codePoints().toArray();
        return ratio(matchingCharacters(a, b), a.length + b.length);
    }

    /**
     * Returns the smaller of the length bound and the shared-character bound.
     * Neither can be exceeded by the block matching, so this is always
     * {@code >= compute(s1, s2)}.
     */
    @Override
    public double upperBound(String s1, String s2) {
        String first = s1 != null ? s1 : "";
        String second = s2 != null ? s2 : "";
        int[] a = first.codePoints().toArray();
        int[] b = second.codePoints().toArray();
        int total = a.length + b.length;
        if (total == 0) {
            return 1.0;
        }

        int lengthBound = Math.min(a.length, b.length);
        if (lengthBound == 0) {
            return 0.0;
        }
        return ratio(Math.min(lengthBound, sharedCharacters(a, b)), total);
    }

    @Override
    public String getName() {
        return "SequenceMatch";
    }

    private static double ratio(int matches, int total) {
        return total > 0 ? 2.0 * matches / total : 1.0;
    }

    /**
     * Total size of all matching blocks between {@code a} and {@code b}.
     */
    int matchingCharacters(int[] a, int[] b) {
        Map<Integer, int[]> positions = indexPositions(b);
        BlockFinder finder = new BlockFinder(a, b, positions);

        int matched = 0;
        Deque<int[]> pending = new ArrayDeque<>();
        pending.push(new int[]{0, a.length, 0, b.length});
        while (!pending.isEmpty()) {
            int[] range = pending.pop();
            int aLow = range[0];
            int aHigh = range[1];
            int bLow = range[2];
            int bHigh = range[3];

            Block block = finder.longestMatch(aLow, aHigh, bLow, bHigh);
            if (block.size() == 0) {
                continue;
            }
            matched += block.size();
            if (aLow < block.aStart() && bLow < block.bStart()) {
                pending.push(new int[]{aLow, block.aStart(), bLow, block.bStart()});
            }
            int aEnd = block.aStart() + block.size();
            int bEnd = block.bStart() + block.size();
            if (aEnd < aHigh && bEnd < bHigh) {
                pending.push(new int[]{aEnd, aHigh, bEnd, bHigh});
            }
        }
        return matched;
    }

    private static int sharedCharacters(int[] a, int[] b) {
        Map<Integer, Integer> available = new HashMap<>();
        for (int cp : b) {
            available.merge(cp, 1, Integer::sum);
        }
        int shared = 0;
        for (int cp : a) {
            Integer count = available.get(cp);
            if (count != null && count > 0) {
                available.put(cp, count - 1);
                shared++;
            }
        }
        return shared;
    }

    private static Map<Integer, int[]> indexPositions(int[] b) {
        Map<Integer, List<Integer>> collected = new HashMap<>();
        for (int j = 0; j < b.length; j++) {
            collected.computeIfAbsent(b[j], k -> new ArrayList<>()).add(j);
        }
        Map<Integer, int[]> positions = new HashMap<>(collected.size() * 2);
        collected.forEach((cp, list) -> positions.put(cp, list.stream().mapToInt(Integer::intValue).toArray()));
        return positions;
    }

    private record Block(int aStart, int bStart, int size) {
    }

    /**
     * Longest common block search over sub-ranges, reusing its run-length
     * buffers between calls.
     */
    private static final class BlockFinder {
        private final int[] a;
        private final Map<Integer, int[]> positions;

        // runs[j + 1] = length of the common run ending at b[j] for the previous row
        private int[] runs;
        private int[] nextRuns;
        private int[] touched;
        private int[] nextTouched;
        private int touchedCount;

        BlockFinder(int[] a, int[] b, Map<Integer, int[]> positions) {
            this.a = a;
            this.positions = positions;
            this.runs = new int[b.length + 1];
            this.nextRuns = new int[b.length + 1];
            this.touched = new int[b.length];
            this.nextTouched = new int[b.length];
        }

        Block longestMatch(int aLow, int aHigh, int bLow, int bHigh) {
            int bestA = aLow;
            int bestB = bLow;
            int bestSize = 0;

            for (int i = aLow; i < aHigh; i++) {
                int nextCount = 0;
                int[] candidates = positions.get(a[i]);
                if (candidates != null) {
                    for (int j : candidates) {
                        if (j < bLow) {
                            continue;
                        }
                        if (j >= bHigh) {
                            break;
                        }
                        int k = runs[j] + 1;
                        nextRuns[j + 1] = k;
                        nextTouched[nextCount++] = j + 1;
                        if (k > bestSize) {
                            bestA = i - k + 1;
                            bestB = j - k + 1;
                            bestSize = k;
                        }
                    }
                }
                clearRuns();
                swapRows(nextCount);
            }
            clearRuns();
            touchedCount = 0;
            return new Block(bestA, bestB, bestSize);
        }

        private void clearRuns() {
            for (int t = 0; t < touchedCount; t++) {
                runs[touched[t]] = 0;
            }
            touchedCount = 0;
        }

        private void swapRows(int nextCount) {
            int[] tempRuns = runs;
            runs = nextRuns;
            nextRuns = tempRuns;
            int[] tempTouched = touched;
            touched = nextTouched;
            nextTouched = tempTouched;
            touchedCount = nextCount;
        }
    }
}
