package com.formpilot.domain.form.model;

import com.formpilot.domain.form.surface.FieldHandle;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-type ordered lists of field handles belonging to one question.
 *
 * @param fields handles keyed by modality; missing keys mean no fields of that type
 */
public record FieldSet(Map<FieldType, List<FieldHandle>> fields) {

    public FieldSet {
        EnumMap<FieldType, List<FieldHandle>> copy = new EnumMap<>(FieldType.class);
        if (fields != null) {
            fields.forEach((type, handles) -> {
                if (handles != null && !handles.isEmpty()) {
                    copy.put(type, List.copyOf(handles));
                }
            });
        }
        fields = Collections.unmodifiableMap(copy);
    }

    public static FieldSet empty() {
        return new FieldSet(Map.of());
    }

    public static FieldSet of(FieldType type, List<? extends FieldHandle> handles) {
        return new FieldSet(Map.of(type, List.copyOf(handles)));
    }

    public List<FieldHandle> get(FieldType type) {
        return fields.getOrDefault(type, List.of());
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public int size() {
        return fields.values().stream().mapToInt(List::size).sum();
    }

    /**
     * The first populated modality in {@link FieldType} priority order.
     */
    public Optional<FieldType> dominantType() {
        for (FieldType type : FieldType.values()) {
            if (fields.containsKey(type)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
