package nl.adgroot.docingest.generate;

import java.util.Locale;

/** Formats the default generator can write. Selectors match case-insensitively. */
public enum OutputFormat {
  WORD("docx"),
  PDF("pdf"),
  TEXT("txt");

  private final String extension;

  OutputFormat(String extension) {
    this.extension = extension;
  }

  public String extension() {
    return extension;
  }

  /**
   * Parses a selector such as {@code Word}, {@code pdf} or {@code text}.
   *
   * @throws UnsupportedOutputFormatException for anything else
   */
  public static OutputFormat parse(String selector) {
    if (selector == null) {
      throw new UnsupportedOutputFormatException("null");
    }
    return switch (selector.trim().toLowerCase(Locale.ROOT)) {
      case "word", "docx" -> WORD;
      case "pdf" -> PDF;
      case "text", "txt" -> TEXT;
      default -> throw new UnsupportedOutputFormatException(selector);
    };
  }
}
