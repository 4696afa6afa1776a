package nl.adgroot.docingest.generate;

import java.io.IOException;
import java.nio.file.Path;

/** Renders text into a file of the requested format. */
public interface DocumentGenerator {

  /**
   * Writes {@code text} to {@code outputDir/documentName.<ext>}.
   *
   * <p>Implementations may fall back to a plain-text file when the requested format cannot be
   * rendered; the returned path then carries the substituted extension.
   *
   * @return path of the written artifact
   * @throws UnsupportedOutputFormatException if {@code format} is unknown
   */
  Path generate(String text, String documentName, String format, Path outputDir) throws IOException;
}
