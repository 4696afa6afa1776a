package nl.adgroot.docingest.organize;

import java.util.Locale;
import java.util.Optional;

/** Named ways of choosing a document's destination folder. */
public enum OrganizationCriteria {
  DATE,
  YEAR,
  MONTH,
  NAME,
  TYPE;

  /** Case-insensitive lookup; empty for unknown or blank selectors. */
  public static Optional<OrganizationCriteria> find(String selector) {
    if (selector == null || selector.isBlank()) {
      return Optional.empty();
    }
    String normalized = selector.trim().toUpperCase(Locale.ROOT);
    for (OrganizationCriteria c : values()) {
      if (c.name().equals(normalized)) {
        return Optional.of(c);
      }
    }
    return Optional.empty();
  }
}
