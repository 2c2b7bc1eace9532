package org.carball.induction.feature;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only mapping from category values to integer codes. Code 0 is
 * reserved for {@link #UNKNOWN}; registered values receive codes from 1 in
 * order of first registration and keep them for the registry's lifetime.
 */
public class CategoryRegistry implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String UNKNOWN = "Unknown";
    public static final int UNKNOWN_CODE = 0;

    private final String field;
    private final List<String> categories = new ArrayList<>();
    private final Map<String, Integer> codes = new HashMap<>();

    public CategoryRegistry(String field) {
        this.field = field;
        categories.add(UNKNOWN);
        codes.put(UNKNOWN, UNKNOWN_CODE);
    }

    public String getField() {
        return field;
    }

    /**
     * Registers {@code value} if new and returns its code. Null and blank values
     * are not registered and map to {@link #UNKNOWN_CODE}.
     */
    public int register(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN_CODE;
        }
        Integer existing = codes.get(value);
        if (existing != null) {
            return existing;
        }
        int code = categories.size();
        categories.add(value);
        codes.put(value, code);
        return code;
    }

    /**
     * Looks up {@code value} without registering it.
     */
    public int lookup(String value) {
        if (value == null) {
            return UNKNOWN_CODE;
        }
        return codes.getOrDefault(value, UNKNOWN_CODE);
    }

    public boolean isKnown(String value) {
        return value != null && codes.containsKey(value);
    }

    /**
     * Registered categories in code order, {@link #UNKNOWN} first.
     */
    public List<String> categories() {
        return Collections.unmodifiableList(categories);
    }

    public int size() {
        return categories.size();
    }

    public CategoryRegistry copy() {
        CategoryRegistry copy = new CategoryRegistry(field);
        for (int i = 1; i < categories.size(); i++) {
            copy.register(categories.get(i));
        }
        return copy;
    }
}
