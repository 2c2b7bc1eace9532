package org.carball.induction.output;

public enum OutputFormat {
    JSON, MARKDOWN, BOTH;

    public static OutputFormat fromName(String name) {
        for (OutputFormat format : values()) {
            if (format.name().equalsIgnoreCase(name)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown output format: " + name + " (expected json, markdown or both)");
    }
}
