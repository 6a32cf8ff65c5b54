package dev.badgersnacks.albionmarket.matching;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Ratcliff/Obershelp similarity: {@code 2 * M / (|a| + |b|)} where {@code M} is the number of characters
 * covered by recursively taking the longest common block and repeating on both sides of it.
 *
 * <p>Among equally long blocks the one starting earliest in {@code a}, then earliest in {@code b}, wins.
 */
public final class SequenceSimilarity {

    private SequenceSimilarity() {
    }

    public static double ratio(String a, String b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchingCharacters(a, b) / total;
    }

    public static double distance(String a, String b) {
        return 1.0 - ratio(a, b);
    }

    static int matchingCharacters(String a, String b) {
        int matched = 0;
        Deque<int[]> pending = new ArrayDeque<>();
        pending.push(new int[]{0, a.length(), 0, b.length()});
        while (!pending.isEmpty()) {
            int[] range = pending.pop();
            int aLo = range[0];
            int aHi = range[1];
            int bLo = range[2];
            int bHi = range[3];
            Block block = longestBlock(a, aLo, aHi, b, bLo, bHi);
            if (block.size == 0) {
                continue;
            }
            matched += block.size;
            if (aLo < block.aStart && bLo < block.bStart) {
                pending.push(new int[]{aLo, block.aStart, bLo, block.bStart});
            }
            int aEnd = block.aStart + block.size;
            int bEnd = block.bStart + block.size;
            if (aEnd < aHi && bEnd < bHi) {
                pending.push(new int[]{aEnd, aHi, bEnd, bHi});
            }
        }
        return matched;
    }

    private static Block longestBlock(String a, int aLo, int aHi, String b, int bLo, int bHi) {
        int bestA = aLo;
        int bestB = bLo;
        int bestSize = 0;
        int width = bHi - bLo;
        // slot j + 1 holds the length of the common run ending at b[bLo + j]
        int[] previous = new int[width + 1];
        int[] current = new int[width + 1];
        for (int i = aLo; i < aHi; i++) {
            char ch = a.charAt(i);
            for (int j = 0; j < width; j++) {
                if (b.charAt(bLo + j) == ch) {
                    int run = previous[j] + 1;
                    current[j + 1] = run;
                    if (run > bestSize) {
                        bestA = i - run + 1;
                        bestB = bLo + j - run + 1;
                        bestSize = run;
                    }
                } else {
                    current[j + 1] = 0;
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return new Block(bestA, bestB, bestSize);
    }

    private record Block(int aStart, int bStart, int size) {
    }
}
