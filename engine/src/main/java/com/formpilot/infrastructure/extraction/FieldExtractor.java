package com.formpilot.infrastructure.extraction;

import com.formpilot.domain.form.model.FieldSet;
import com.formpilot.domain.form.model.Question;
import com.formpilot.domain.form.surface.ContainerHandle;
import com.formpilot.domain.form.surface.FormSurface;
import com.formpilot.infrastructure.preprocessing.QuestionTextCleaner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the question containers of the current page into {@link Question}s.
 * A container that fails, has an empty label or has no inputs is left out.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FieldExtractor {

    private final QuestionTextCleaner textCleaner;

    /**
     * @return questions in page order, empty if the page has none
     * @throws com.formpilot.domain.form.surface.FormSurfaceException if the page cannot be read
     */
    public List<Question> extract(FormSurface surface, String pageUrl) {
        List<ContainerHandle> containers = surface.listQuestionContainers();
        List<Question> questions = new ArrayList<>();

        for (ContainerHandle container : containers) {
            try {
                String label = textCleaner.clean(surface.extractLabel(container));
                if (label.isEmpty()) continue;

                FieldSet fields = surface.extractFields(container);
                if (fields == null || fields.isEmpty()) {
                    log.debug("[Extractor] No input fields for '{}'", label);
                    continue;
                }

                questions.add(new Question(label, fields, pageUrl));
            } catch (RuntimeException e) {
                log.debug("[Extractor] Skipping container: {}", e.getMessage());
            }
        }

        log.info("[Extractor] {} questions from {} containers", questions.size(), containers.size());
        return questions;
    }
}
