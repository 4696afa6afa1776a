package nl.adgroot.docingest.generate;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes Word files with Apache POI, PDF files with PDFBox and plain text directly.
 * A PDF that cannot be rendered (e.g. characters the built-in font cannot encode) is written as
 * {@code .txt} instead.
 */
public class DefaultDocumentGenerator implements DocumentGenerator {

  private static final Logger log = LoggerFactory.getLogger(DefaultDocumentGenerator.class);

  private final PdfTextWriter pdfWriter;

  public DefaultDocumentGenerator() {
    this(new PdfTextWriter());
  }

  public DefaultDocumentGenerator(PdfTextWriter pdfWriter) {
    this.pdfWriter = pdfWriter;
  }

  @Override
  public Path generate(String text, String documentName, String format, Path outputDir) throws IOException {
    OutputFormat outputFormat = OutputFormat.parse(format);
    String safeText = text == null ? "" : text;

    Files.createDirectories(outputDir);
    Path out = outputDir.resolve(safeFileName(documentName) + "." + outputFormat.extension());

    switch (outputFormat) {
      case WORD -> writeWord(safeText, out);
      case TEXT -> writeText(safeText, out);
      case PDF -> {
        try {
          pdfWriter.write(safeText, out);
        } catch (IllegalArgumentException | IllegalStateException e) {
          Path fallback = outputDir.resolve(safeFileName(documentName) + "." + OutputFormat.TEXT.extension());
          log.warn("Could not render PDF for '{}' ({}); writing {} instead", documentName, e.getMessage(),
              fallback.getFileName());
          Files.deleteIfExists(out);
          writeText(safeText, fallback);
          return fallback;
        }
      }
    }
    log.debug("Generated {}", out);
    return out;
  }

  private static void writeWord(String text, Path out) throws IOException {
    try (XWPFDocument doc = new XWPFDocument();
         OutputStream os = Files.newOutputStream(out)) {
      for (String paragraph : text.replace("\r", "").split("\n", -1)) {
        doc.createParagraph().createRun().setText(paragraph);
      }
      doc.write(os);
    }
  }

  private static void writeText(String text, Path out) throws IOException {
    Files.writeString(out, text, StandardCharsets.UTF_8);
  }

  public static String safeFileName(String name) {
    String cleaned = name == null ? "" : name.replaceAll("[\\\\/:*?\"<>|\\p{Cntrl}]", "_").trim();
    return cleaned.isEmpty() ? "document" : cleaned;
  }
}
