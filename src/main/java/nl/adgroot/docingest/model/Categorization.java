package nl.adgroot.docingest.model;

import java.util.List;

/**
 * Result of categorizing a text: a category plus free-form tags and insights.
 * Never holds nulls; an unknown category is the empty string.
 */
public record Categorization(String category, List<String> tags, List<String> insights) {

  private static final Categorization EMPTY = new Categorization("", List.of(), List.of());

  public Categorization {
    category = category == null ? "" : category.trim();
    tags = tags == null ? List.of() : List.copyOf(tags);
    insights = insights == null ? List.of() : List.copyOf(insights);
  }

  public static Categorization empty() {
    return EMPTY;
  }

  public boolean hasCategory() {
    return !category.isEmpty();
  }
}
