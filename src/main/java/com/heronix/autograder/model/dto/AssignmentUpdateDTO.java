package com.heronix.autograder.model.dto;

import java.util.LinkedHashMap;
import java.util.Map;

import com.heronix.autograder.model.enums.AssignmentType;
import com.heronix.autograder.validation.EnumLabel;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Edit-assignment payload. Partial: absent fields keep their stored value.
 * Grading criteria are not part of this schema.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class AssignmentUpdateDTO implements RecordPatch {

    @Size(min = 3, message = "Title must be at least 3 characters")
    @Size(max = 100, message = "Title must be at most 100 characters")
    private String title;

    @Size(max = 2000, message = "Description must be at most 2000 characters")
    private String description;

    @EnumLabel(value = AssignmentType.class, message = "Type must be one of voice, text, document")
    private String type;

    @Positive(message = "Points must be a positive integer")
    private Integer points;

    @Override
    public AssignmentUpdateDTO trimmed() {
        return toBuilder()
                .title(RecordPatch.trim(title))
                .description(RecordPatch.trim(description))
                .type(RecordPatch.trim(type))
                .build();
    }

    @Override
    public Map<String, Object> toCanonicalMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (title != null) map.put("title", title);
        if (description != null) map.put("description", description);
        if (type != null) map.put("type", type);
        if (points != null) map.put("points", points);
        return map;
    }
}
