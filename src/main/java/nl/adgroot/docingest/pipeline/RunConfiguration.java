package nl.adgroot.docingest.pipeline;

import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Objects;

import nl.adgroot.docingest.organize.OrganizationResolver;

/**
 * Immutable configuration of one pipeline run.
 *
 * @param inputRoot directory whose immediate subdirectories are the documents
 * @param outputDirectory directory generated artifacts are written to
 * @param outputFormat generator format selector, e.g. {@code Word} or {@code PDF}
 * @param organizationCriteria named criteria, e.g. {@code month}; ignored when a custom resolver is set
 * @param customResolver resolver that takes precedence over {@code organizationCriteria}, may be null
 * @param zone zone used to turn directory timestamps into dates
 */
public record RunConfiguration(
    Path inputRoot,
    Path outputDirectory,
    String outputFormat,
    String organizationCriteria,
    OrganizationResolver customResolver,
    ZoneId zone
) {

  public static final String DEFAULT_OUTPUT_FORMAT = "Word";
  public static final String DEFAULT_CRITERIA = "date";

  public RunConfiguration {
    Objects.requireNonNull(inputRoot, "inputRoot");
    Objects.requireNonNull(outputDirectory, "outputDirectory");
    outputFormat = outputFormat == null ? DEFAULT_OUTPUT_FORMAT : outputFormat;
    organizationCriteria = organizationCriteria == null ? DEFAULT_CRITERIA : organizationCriteria;
    zone = zone == null ? ZoneId.systemDefault() : zone;
  }

  public RunConfiguration(Path inputRoot, Path outputDirectory, String outputFormat, String organizationCriteria) {
    this(inputRoot, outputDirectory, outputFormat, organizationCriteria, null, null);
  }

  /** The resolver this run organizes documents with: the custom one if set, else the named criteria. */
  public OrganizationResolver organizationResolver() {
    return customResolver != null
        ? customResolver
        : OrganizationResolver.forCriteria(organizationCriteria, zone);
  }

  public RunConfiguration withCustomResolver(OrganizationResolver resolver) {
    return new RunConfiguration(inputRoot, outputDirectory, outputFormat, organizationCriteria, resolver, zone);
  }
}
