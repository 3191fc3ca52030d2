package com.webresearch.core.service.planner;

import com.webresearch.core.entity.AnswerKind;
import com.webresearch.core.entity.SourceCategoryType;

import java.util.List;
import java.util.regex.Pattern;

/**
 * An intent the planner can recognize in an objective, with what answering it takes
 *
 * @param name             category id, also recorded on the generated question
 * @param questionTemplate question text with {@code %s} standing for the research subject
 * @param unit             unit of numeric answers, null when not applicable
 */
public record QuestionCategory(
        String name,
        Pattern pattern,
        AnswerKind answerKind,
        List<SourceCategoryType> sourceCategories,
        List<String> extractionHints,
        String questionTemplate,
        String unit
) {

    public boolean matches(String text) {
        return text != null && pattern.matcher(text).find();
    }

    public String questionFor(String subject) {
        return String.format(questionTemplate, subject);
    }
}
