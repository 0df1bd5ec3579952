package com.heronix.autograder.event;

import java.util.Map;

import com.heronix.autograder.model.enums.RecordKind;

/**
 * Published after a mutation landed in the store and was read back.
 *
 * @param kind      mutation path that produced the update
 * @param recordId  identifier of the updated row
 * @param canonical the refreshed row in canonical (camelCase) form, unmodifiable
 */
public record RecordUpdatedEvent(RecordKind kind, String recordId, Map<String, Object> canonical) {
}
