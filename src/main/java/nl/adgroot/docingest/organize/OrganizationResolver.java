package nl.adgroot.docingest.organize;

import java.time.ZoneId;

import nl.adgroot.docingest.model.Document;

/**
 * Computes the destination path fragment of a processed document, e.g. {@code 2023-01}.
 * Implementations must be deterministic and free of side effects.
 */
@FunctionalInterface
public interface OrganizationResolver {

  String resolve(Document document);

  /**
   * Resolver for a named criteria ({@code date}, {@code year}, {@code month}, {@code name},
   * {@code type}). Unknown selectors behave like {@code date}.
   */
  static OrganizationResolver forCriteria(String criteria, ZoneId zone) {
    return new CriteriaOrganizationResolver(criteria, zone);
  }
}
