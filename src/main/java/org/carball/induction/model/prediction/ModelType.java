package org.carball.induction.model.prediction;

import lombok.Getter;

import java.util.Arrays;

@Getter
public enum ModelType {
    RANDOM_FOREST("random_forest"),
    DECISION_TREE("decision_tree");

    private final String configName;

    ModelType(String configName) {
        this.configName = configName;
    }

    public static ModelType fromName(String name) {
        return Arrays.stream(values())
                .filter(type -> type.configName.equalsIgnoreCase(name) || type.name().equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown model type: " + name +
                        ". Available types: random_forest, decision_tree"));
    }
}
