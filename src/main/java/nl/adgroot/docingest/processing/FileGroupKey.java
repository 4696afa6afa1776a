package nl.adgroot.docingest.processing;

/**
 * Group key and page number derived from a file name.
 *
 * <p>The first maximal run of ASCII digits is the page number; the text around it is the key, so
 * {@code scan_01.png} and {@code scan_02.png} share key {@code scan_.png}. A name without digits is
 * its own key with page 0 and {@link #hasPage()} false, so {@code scan.png} never joins the
 * {@code scan1.png} group even though both keys read {@code scan.png}. Leading zeros are ignored and runs too large for a {@code long} are
 * clamped to {@link Long#MAX_VALUE}.
 */
public record FileGroupKey(String key, long page, boolean hasPage, String prefix, String suffix) {

  public static FileGroupKey parse(String fileName) {
    int start = -1;
    for (int i = 0; i < fileName.length(); i++) {
      if (isDigit(fileName.charAt(i))) {
        start = i;
        break;
      }
    }
    if (start < 0) {
      return new FileGroupKey(fileName, 0, false, fileName, "");
    }

    int end = start;
    while (end < fileName.length() && isDigit(fileName.charAt(end))) {
      end++;
    }

    String prefix = fileName.substring(0, start);
    String suffix = fileName.substring(end);
    return new FileGroupKey(prefix + suffix, toPage(fileName.substring(start, end)), true, prefix, suffix);
  }

  /** Rebuilds a file name for the given page, e.g. {@code withPage(3)} on {@code doc1.png} gives {@code doc3.png}. */
  public String withPage(long pageNr) {
    return prefix + pageNr + suffix;
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static long toPage(String digits) {
    String trimmed = digits.replaceFirst("^0+(?=\\d)", "");
    if (trimmed.length() > 18) {
      return Long.MAX_VALUE;
    }
    return Long.parseLong(trimmed);
  }
}
