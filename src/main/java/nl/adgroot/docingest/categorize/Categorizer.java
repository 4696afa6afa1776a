package nl.adgroot.docingest.categorize;

import nl.adgroot.docingest.model.Categorization;

/** Assigns a category, tags and insights to a text. Never throws; failures yield an empty result. */
@FunctionalInterface
public interface Categorizer {

  Categorization categorize(String text);
}
