package nl.adgroot.docingest.organize;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.regex.Pattern;

import nl.adgroot.docingest.model.Categorization;
import nl.adgroot.docingest.model.Document;
import nl.adgroot.docingest.model.ProcessedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves fragments from the named criteria table.
 *
 * <ul>
 *   <li>{@code date}: directory creation date, {@code yyyy-MM-dd}</li>
 *   <li>{@code year}: {@code yyyy}</li>
 *   <li>{@code month}: the first {@code yyyy/MM} tag on any artifact, else {@code yyyy-MM}</li>
 *   <li>{@code name}: the document name</li>
 *   <li>{@code type}: the document category, else the first artifact category, else
 *       {@value #UNCATEGORIZED}</li>
 * </ul>
 */
public class CriteriaOrganizationResolver implements OrganizationResolver {

  private static final Logger log = LoggerFactory.getLogger(CriteriaOrganizationResolver.class);

  public static final String UNCATEGORIZED = "uncategorized";

  static final Pattern YEAR_MONTH_TAG = Pattern.compile("^\\d{4}/\\d{2}$");

  private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
  private static final DateTimeFormatter YEAR = DateTimeFormatter.ofPattern("yyyy");
  private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyy-MM");

  private final OrganizationCriteria criteria;
  private final ZoneId zone;

  public CriteriaOrganizationResolver(String selector, ZoneId zone) {
    Optional<OrganizationCriteria> found = OrganizationCriteria.find(selector);
    if (found.isEmpty()) {
      log.warn("Unknown organization criteria '{}', organizing by date", selector);
    }
    this.criteria = found.orElse(OrganizationCriteria.DATE);
    this.zone = zone;
  }

  public OrganizationCriteria criteria() {
    return criteria;
  }

  @Override
  public String resolve(Document document) {
    return switch (criteria) {
      case DATE -> format(document, DATE);
      case YEAR -> format(document, YEAR);
      case MONTH -> yearMonthTag(document).orElseGet(() -> format(document, MONTH));
      case NAME -> document.getName();
      case TYPE -> category(document);
    };
  }

  private String format(Document document, DateTimeFormatter formatter) {
    return formatter.format(document.getCreatedAt().atZone(zone));
  }

  private static Optional<String> yearMonthTag(Document document) {
    for (ProcessedFile file : document.getProcessedFiles()) {
      for (String tag : file.getTags()) {
        if (YEAR_MONTH_TAG.matcher(tag).matches()) {
          return Optional.of(tag);
        }
      }
    }
    return Optional.empty();
  }

  private static String category(Document document) {
    Optional<String> own = document.getCategorization()
        .filter(Categorization::hasCategory)
        .map(Categorization::category);
    if (own.isPresent()) {
      return own.get();
    }
    return document.getProcessedFiles().stream()
        .map(ProcessedFile::getCategory)
        .filter(c -> !c.isEmpty())
        .findFirst()
        .orElse(UNCATEGORIZED);
  }
}
