package com.production.pdf_analysis.normalize;

import com.production.pdf_analysis.model.Category;
import com.production.pdf_analysis.model.CategoryDecision;
import com.production.pdf_analysis.model.CategoryDecision.Decision;
import com.production.pdf_analysis.model.CategoryDecision.NewCategoryDefinition;
import com.production.pdf_analysis.model.CategoryDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.production.pdf_analysis.normalize.LooseValues.asMap;
import static com.production.pdf_analysis.normalize.LooseValues.asStringList;
import static com.production.pdf_analysis.normalize.LooseValues.asText;
import static com.production.pdf_analysis.normalize.LooseValues.first;

/**
 * Maps a model answer onto {@link CategoryDecision}. A {@code matched_existing} answer must
 * name one of the offered categories; otherwise it is turned into {@code created_new}.
 */
@Component
@Slf4j
public class CategoryDecisionNormalizer {

    public CategoryDecision normalize(Map<String, Object> data, List<CategoryDescriptor> existing) {
        List<CategoryDescriptor> offered = existing != null ? existing : List.of();

        Decision decision = Decision.fromWire(asText(first(data, "decision", "решение")).orElse(null));
        Category category = ResponseNormalizer.category(first(data, "category", "категория"));
        String existingLabel = asText(first(data, "existing_label", "existingLabel")).orElse(null);

        if (decision == Decision.MATCHED_EXISTING) {
            Optional<String> matched = findOffered(offered, existingLabel)
                    .or(() -> findOffered(offered, category.label()));
            if (matched.isPresent()) {
                existingLabel = matched.get();
            } else {
                log.debug("Model matched '{}' which is not an offered category; treating as new", existingLabel);
                decision = Decision.CREATED_NEW;
                existingLabel = null;
            }
        } else {
            existingLabel = null;
        }

        NewCategoryDefinition definition = null;
        if (decision == Decision.CREATED_NEW) {
            definition = newDefinition(asMap(first(data, "new_category_def", "new_category", "newCategoryDef")), category);
        }
        return new CategoryDecision(decision, category, existingLabel, definition);
    }

    private static Optional<String> findOffered(List<CategoryDescriptor> offered, String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String wanted = label.trim().toLowerCase(Locale.ROOT);
        return offered.stream()
                .map(CategoryDescriptor::label)
                .filter(l -> l != null && l.trim().toLowerCase(Locale.ROOT).equals(wanted))
                .findFirst();
    }

    private static NewCategoryDefinition newDefinition(Map<String, Object> raw, Category category) {
        String label = asText(first(raw, "label", "name", "title")).orElse(category.label());
        String description = asText(first(raw, "description", "описание"))
                .orElse(category.basis() != null ? category.basis() : CategoryDecision.FALLBACK_DESCRIPTION);
        List<String> keywords = raw != null && first(raw, "keywords") != null
                ? asStringList(first(raw, "keywords"))
                : category.keywords();
        List<String> examples = raw != null && first(raw, "examples") != null
                ? asStringList(first(raw, "examples"))
                : null;
        return new NewCategoryDefinition(label, description, keywords, examples);
    }
}
