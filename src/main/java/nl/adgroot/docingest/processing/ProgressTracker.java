package nl.adgroot.docingest.processing;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/** Counts finished documents and formats a one-line status with throughput and ETA. */
public class ProgressTracker {
  private final int totalDocuments;
  private final Clock clock;
  private final Instant startAll;
  private int doneDocuments;
  private int artifacts;

  public ProgressTracker(int totalDocuments) {
    this(totalDocuments, Clock.systemUTC());
  }

  ProgressTracker(int totalDocuments, Clock clock) {
    this.totalDocuments = totalDocuments;
    this.clock = clock;
    this.startAll = clock.instant();
  }

  public void finishDocument(int producedArtifacts) {
    doneDocuments++;
    artifacts += producedArtifacts;
  }

  public String formatStatus(String documentName, long lastDocumentMillis) {
    int remaining = totalDocuments - doneDocuments;

    Duration elapsed = Duration.between(startAll, clock.instant());
    double elapsedSec = Math.max(0.001, elapsed.toMillis() / 1000.0);

    double throughput = doneDocuments / elapsedSec;
    long etaSec = (throughput <= 0) ? 0 : (long) Math.ceil(remaining / throughput);

    double pct = totalDocuments == 0 ? 100.0 : (doneDocuments * 100.0) / totalDocuments;

    return String.format(Locale.ROOT,
        "Document %d/%d (%.2f%%) '%s' | artifacts=%d | last=%s | elapsed=%s | ETA=%s",
        doneDocuments, totalDocuments, pct, documentName, artifacts,
        fmtDuration(Duration.ofMillis(lastDocumentMillis)),
        fmtDuration(elapsed),
        fmtDuration(Duration.ofSeconds(etaSec))
    );
  }

  static String fmtDuration(Duration d) {
    long s = d.getSeconds();
    long h = s / 3600;
    long m = (s % 3600) / 60;
    long sec = s % 60;
    if (h > 0) return String.format("%dh %02dm %02ds", h, m, sec);
    if (m > 0) return String.format("%dm %02ds", m, sec);
    return String.format("%ds", sec);
  }
}
