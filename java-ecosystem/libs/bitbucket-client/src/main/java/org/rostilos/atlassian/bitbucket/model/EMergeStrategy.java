package org.rostilos.atlassian.bitbucket.model;

import java.util.Arrays;
import java.util.stream.Collectors;

public enum EMergeStrategy {
    MERGE_COMMIT("merge_commit"),
    SQUASH("squash"),
    FAST_FORWARD("fast_forward");

    private final String value;

    EMergeStrategy(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static EMergeStrategy fromValue(String value) {
        for (EMergeStrategy strategy : values()) {
            if (strategy.value.equals(value)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("merge_strategy must be one of " + Arrays.stream(values())
                .map(EMergeStrategy::getValue)
                .collect(Collectors.joining(", ", "[", "]")) + ", got: " + value);
    }
}
