package org.carball.induction.ml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

/**
 * Train/test split that keeps each label's share roughly equal on both sides.
 */
public class StratifiedSplitter {

    public record Split(int[] trainIndices, int[] testIndices) {
    }

    /**
     * @throws IllegalArgumentException when some label has fewer than two rows,
     *                                  so it cannot appear on both sides
     */
    public Split split(int[] labels, double testFraction, Random random) {
        Map<Integer, List<Integer>> byLabel = new TreeMap<>();
        for (int i = 0; i < labels.length; i++) {
            byLabel.computeIfAbsent(labels[i], k -> new ArrayList<>()).add(i);
        }

        List<Integer> train = new ArrayList<>();
        List<Integer> test = new ArrayList<>();
        for (Map.Entry<Integer, List<Integer>> entry : byLabel.entrySet()) {
            List<Integer> members = new ArrayList<>(entry.getValue());
            if (members.size() < 2) {
                throw new IllegalArgumentException("Cannot stratify: label " + entry.getKey() +
                        " has only " + members.size() + " sample");
            }
            Collections.shuffle(members, random);
            int testCount = (int) Math.round(members.size() * testFraction);
            testCount = Math.max(1, Math.min(members.size() - 1, testCount));
            test.addAll(members.subList(0, testCount));
            train.addAll(members.subList(testCount, members.size()));
        }

        Collections.sort(train);
        Collections.sort(test);
        return new Split(toArray(train), toArray(test));
    }

    private static int[] toArray(List<Integer> values) {
        return values.stream().mapToInt(Integer::intValue).toArray();
    }
}
