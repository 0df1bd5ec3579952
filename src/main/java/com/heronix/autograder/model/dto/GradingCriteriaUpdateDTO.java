package com.heronix.autograder.model.dto;

import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Grading criteria payload, the only path that writes an assignment's rubric.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GradingCriteriaUpdateDTO implements RecordPatch {

    @NotBlank(message = "Grading criteria is required")
    @Size(max = 10000, message = "Grading criteria must be at most 10000 characters")
    private String gradingCriteria;

    @Override
    public GradingCriteriaUpdateDTO trimmed() {
        return new GradingCriteriaUpdateDTO(RecordPatch.trim(gradingCriteria));
    }

    @Override
    public Map<String, Object> toCanonicalMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (gradingCriteria != null) {
            map.put("gradingCriteria", gradingCriteria);
        }
        return map;
    }
}
