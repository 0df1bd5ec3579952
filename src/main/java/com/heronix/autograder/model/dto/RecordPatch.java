package com.heronix.autograder.model.dto;

import java.util.Map;

/**
 * A mutation payload bound to its validation schema.
 */
public interface RecordPatch {

    /**
     * Copy with strings trimmed. Constraints are checked against this copy.
     */
    RecordPatch trimmed();

    /**
     * Copy with store normalizations applied (e.g. upper-cased class codes).
     * Only called on a patch that passed validation.
     */
    default RecordPatch normalized() {
        return this;
    }

    /**
     * Present fields as a canonical (camelCase) map, in schema order.
     * Absent fields are left out so the store update stays partial.
     */
    Map<String, Object> toCanonicalMap();

    static String trim(String value) {
        return value != null ? value.trim() : null;
    }
}
