package com.heronix.autograder.model.dto;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import com.heronix.autograder.model.enums.ClassStatus;
import com.heronix.autograder.model.enums.Department;
import com.heronix.autograder.validation.EnumLabel;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Edit-class payload. Every field is required, as in the class form.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ClassUpdateDTO implements RecordPatch {

    @NotNull(message = "Title is required")
    @Size(min = 3, message = "Title must be at least 3 characters")
    @Size(max = 100, message = "Title must be at most 100 characters")
    private String title;

    @NotNull(message = "Description is required")
    @Size(min = 10, message = "Description must be at least 10 characters")
    @Size(max = 500, message = "Description must be at most 500 characters")
    private String description;

    @NotNull(message = "Please select a department")
    @EnumLabel(value = Department.class, message = "Please select a department")
    private String department;

    @NotNull(message = "Class code is required")
    @Size(min = 2, message = "Class code must be at least 2 characters")
    @Size(max = 10, message = "Class code must be at most 10 characters")
    @Pattern(regexp = "^[A-Za-z0-9]*$", message = "Class code must be alphanumeric")
    private String code;

    @NotBlank(message = "Schedule is required")
    private String schedule;

    @NotBlank(message = "Term is required")
    private String term;

    @NotNull(message = "Status is required")
    @EnumLabel(value = ClassStatus.class, message = "Status must be active or inactive")
    private String status;

    @Override
    public ClassUpdateDTO trimmed() {
        return toBuilder()
                .title(RecordPatch.trim(title))
                .description(RecordPatch.trim(description))
                .department(RecordPatch.trim(department))
                .code(RecordPatch.trim(code))
                .schedule(RecordPatch.trim(schedule))
                .term(RecordPatch.trim(term))
                .status(RecordPatch.trim(status))
                .build();
    }

    @Override
    public ClassUpdateDTO normalized() {
        return toBuilder()
                .code(code != null ? code.toUpperCase(Locale.ROOT) : null)
                .build();
    }

    @Override
    public Map<String, Object> toCanonicalMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        putIfPresent(map, "title", title);
        putIfPresent(map, "description", description);
        putIfPresent(map, "department", department);
        putIfPresent(map, "code", code);
        putIfPresent(map, "schedule", schedule);
        putIfPresent(map, "term", term);
        putIfPresent(map, "status", status);
        return map;
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
