package nl.adgroot.docingest.organize;

import java.io.IOException;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import nl.adgroot.docingest.model.Document;
import nl.adgroot.docingest.model.ProcessedFile;
import nl.adgroot.docingest.pipeline.NextStage;
import nl.adgroot.docingest.pipeline.PipelineState;
import nl.adgroot.docingest.pipeline.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tags each generated artifact with the {@code yyyy/MM} of the first date found in its text, which
 * the {@code month} criteria prefers over the directory timestamp.
 */
public class DateParsingStage implements Stage {

  private static final Logger log = LoggerFactory.getLogger(DateParsingStage.class);

  // year first: 2023-01-15, 2023/01/15
  private static final Pattern ISO = Pattern.compile("\\b(\\d{4})[-/](\\d{1,2})[-/](\\d{1,2})\\b");
  // day first: 15-01-2023, 15.01.2023, 15/01/2023
  private static final Pattern DAY_FIRST = Pattern.compile("\\b(\\d{1,2})[-./](\\d{1,2})[-./](\\d{4})\\b");

  @Override
  public void process(PipelineState state, NextStage next) throws IOException {
    for (Document document : state.documents()) {
      for (ProcessedFile file : document.getProcessedFiles()) {
        findDate(file.getContent()).ifPresent(date -> {
          String tag = String.format("%04d/%02d", date.getYear(), date.getMonthValue());
          file.addTag(tag);
          log.debug("Tagged {} of {} with {}", file, document.getName(), tag);
        });
      }
    }
    next.invoke(state);
  }

  /** The earliest-positioned valid date in {@code text}. */
  static Optional<LocalDate> findDate(String text) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }

    LocalDate best = null;
    int bestPos = Integer.MAX_VALUE;
    for (Pattern pattern : List.of(ISO, DAY_FIRST)) {
      Matcher m = pattern.matcher(text);
      while (m.find()) {
        if (m.start() >= bestPos) {
          break;
        }
        LocalDate date = pattern == ISO
            ? toDate(m.group(1), m.group(2), m.group(3))
            : toDate(m.group(3), m.group(2), m.group(1));
        if (date != null) {
          best = date;
          bestPos = m.start();
          break;
        }
      }
    }
    return Optional.ofNullable(best);
  }

  private static LocalDate toDate(String year, String month, String day) {
    try {
      return LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day));
    } catch (DateTimeException e) {
      return null;
    }
  }
}
