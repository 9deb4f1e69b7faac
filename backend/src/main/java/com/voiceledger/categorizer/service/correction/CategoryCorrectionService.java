package com.voiceledger.categorizer.service.correction;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.voiceledger.categorizer.config.ApplicationProperties;
import com.voiceledger.categorizer.exception.ConfigurationException;
import com.voiceledger.categorizer.service.text.ExpenseTextNormalizer;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Fixes obviously wrong suggested categories. The canonical item description is looked up in
 * curated term sets loaded from a classpath JSON file of the form {@code {"Groceries": ["milk",
 * ...], ...}}; a hit overrides whatever category was suggested.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CategoryCorrectionService {

  private final ObjectMapper objectMapper;
  private final ApplicationProperties applicationProperties;
  private final ExpenseTextNormalizer textNormalizer;

  private Map<String, String> categoryByTerm = Collections.emptyMap();

  @PostConstruct
  public void init() {
    String resource = applicationProperties.getCorrection().getTermsResource();
    try (InputStream is = CategoryCorrectionService.class.getResourceAsStream(resource)) {
      if (is == null) {
        throw new ConfigurationException("Category term resource not found: " + resource);
      }
      Map<String, List<String>> termSets =
          objectMapper.readValue(is, new TypeReference<LinkedHashMap<String, List<String>>>() {});
      loadTermSets(termSets);
      log.info(
          "Loaded {} curated terms for {} categories from {}",
          categoryByTerm.size(),
          termSets.size(),
          resource);
    } catch (IOException e) {
      throw new ConfigurationException("Failed to read category term resource " + resource, e);
    }
  }

  void loadTermSets(Map<String, List<String>> termSets) {
    Map<String, String> index = new HashMap<>();
    termSets.forEach(
        (category, terms) -> {
          for (String term : terms) {
            String key = textNormalizer.canonicalTerm(term);
            String previous = index.putIfAbsent(key, category);
            if (previous != null && !previous.equals(category)) {
              log.warn(
                  "Term '{}' listed under {} and {}; keeping {}",
                  key,
                  previous,
                  category,
                  previous);
            }
          }
        });
    categoryByTerm = Collections.unmodifiableMap(index);
  }

  /**
   * @param description item description
   * @return the category the description's term is curated under, if any
   */
  public Optional<String> findRuleCategory(String description) {
    if (description == null || description.isBlank()) {
      return Optional.empty();
    }
    return Optional.ofNullable(categoryByTerm.get(textNormalizer.canonicalTerm(description)));
  }

  /**
   * @return the rule category when one applies, otherwise the suggested category unchanged
   */
  public String correct(String description, String suggestedCategory) {
    Optional<String> ruleCategory = findRuleCategory(description);
    if (ruleCategory.isPresent() && !ruleCategory.get().equals(suggestedCategory)) {
      log.info(
          "Category for '{}' corrected from {} to {}",
          description,
          suggestedCategory,
          ruleCategory.get());
    }
    return ruleCategory.orElse(suggestedCategory);
  }
}
