package com.formpilot.infrastructure.filling;

import com.formpilot.domain.form.model.AnswerCandidate;
import com.formpilot.domain.form.model.FieldType;
import com.formpilot.domain.form.model.Question;
import com.formpilot.domain.form.surface.FieldHandle;
import com.formpilot.domain.form.surface.FormSurface;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Writes resolved answers into the page, one strategy per field type.
 * A failure on one question is counted as not filled and never stops the others.
 */
@Slf4j
@Component
public class FormFiller {

    /**
     * @return number of questions that were filled
     */
    public int fill(FormSurface surface, List<Question> questions, Map<String, AnswerCandidate> answers) {
        int filled = 0;

        for (Question question : questions) {
            AnswerCandidate candidate = answers.get(question.text());
            if (candidate == null || candidate.value() == null || candidate.value().isBlank()) continue;

            try {
                if (fillQuestion(surface, question, candidate.value())) {
                    filled++;
                    log.debug("[Filler] Filled '{}' ({})", question.text(), candidate.source());
                } else {
                    log.debug("[Filler] Nothing to fill for '{}' with '{}'", question.text(), candidate.value());
                }
            } catch (RuntimeException e) {
                log.debug("[Filler] Failed to fill '{}': {}", question.text(), e.getMessage());
            }
        }

        log.info("[Filler] Filled {} of {} answers", filled, answers.size());
        return filled;
    }

    private boolean fillQuestion(FormSurface surface, Question question, String value) {
        Optional<FieldType> type = question.fields().dominantType();
        if (type.isEmpty()) {
            return false;
        }

        List<FieldHandle> handles = question.fields().get(type.get());
        return switch (type.get()) {
            case TEXT, TEXTAREA -> surface.setFieldValue(handles.get(0), value);
            case RADIO -> fillRadio(surface, handles, value);
            case CHECKBOX -> fillCheckbox(surface, handles, value);
            case SELECT -> fillSelect(surface, handles.get(0), value);
        };
    }

    private boolean fillRadio(FormSurface surface, List<FieldHandle> options, String value) {
        for (FieldHandle option : options) {
            if (labelMatches(surface.optionLabel(option), value)) {
                return surface.clickOption(option, surface.optionLabel(option));
            }
        }
        return false;
    }

    /**
     * Ticks every option named in the value. A value that matches a label as a whole is one
     * option; otherwise it is read as comma-separated labels, the shape the monitor records.
     */
    private boolean fillCheckbox(FormSurface surface, List<FieldHandle> options, String value) {
        List<String> wanted = options.stream().anyMatch(option -> labelMatches(surface.optionLabel(option), value))
                ? List.of(value)
                : Arrays.stream(value.split(","))
                        .map(String::strip)
                        .filter(part -> !part.isEmpty())
                        .toList();

        boolean any = false;
        for (FieldHandle option : options) {
            String label = surface.optionLabel(option);
            if (wanted.stream().noneMatch(part -> labelMatches(label, part))) continue;

            if (surface.isSelected(option) || surface.clickOption(option, label)) {
                any = true;
            }
        }
        return any;
    }

    private boolean fillSelect(FormSurface surface, FieldHandle select, String value) {
        for (String option : surface.listOptions(select)) {
            if (labelMatches(option, value)) {
                return surface.clickOption(select, option);
            }
        }
        return false;
    }

    // case-insensitive: the answer must appear inside the option label
    private static boolean labelMatches(String label, String value) {
        if (label == null || label.isBlank()) {
            return false;
        }
        return label.toLowerCase(Locale.ROOT).contains(value.strip().toLowerCase(Locale.ROOT));
    }
}
