package nl.adgroot.docingest.generate;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.PDPageContentStream.AppendMode;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

/**
 * Lays out plain text on A4 pages with word wrapping, starting a new page when one is full.
 *
 * <p>Uses the Standard 14 Helvetica font, so characters outside WinAnsi make PDFBox throw
 * {@link IllegalArgumentException}.
 */
public class PdfTextWriter {

  private static final float MARGIN = 48f;
  private static final float FONT_SIZE = 11f;
  private static final float LEADING = 1.2f * FONT_SIZE;

  public void write(String text, Path outputPdf) throws IOException {
    try (PDDocument out = new PDDocument()) {
      PDFont font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
      PDRectangle box = PDRectangle.A4;
      float maxWidth = box.getWidth() - 2 * MARGIN;

      List<String> lines = wrapPreserveSpaces(normalize(text), font, FONT_SIZE, maxWidth);
      int linesPerPage = Math.max(1, (int) ((box.getHeight() - 2 * MARGIN) / LEADING));

      int i = 0;
      do {
        PDPage page = new PDPage(box);
        out.addPage(page);
        int end = Math.min(lines.size(), i + linesPerPage);
        writeLines(out, page, lines.subList(i, end), font);
        i = end;
      } while (i < lines.size());

      out.save(outputPdf.toFile());
    }
  }

  private static String normalize(String text) {
    return text.replace("\r", "")
        .replace("\t", "    ")
        .replaceAll("[\\p{Cntrl}&&[^\n]]", "");
  }

  private static void writeLines(PDDocument doc, PDPage page, List<String> lines, PDFont font)
      throws IOException {
    PDRectangle box = page.getMediaBox();
    try (PDPageContentStream cs = new PDPageContentStream(doc, page, AppendMode.OVERWRITE, true, true)) {
      cs.beginText();
      cs.setFont(font, FONT_SIZE);
      cs.newLineAtOffset(MARGIN, box.getHeight() - MARGIN);
      for (String line : lines) {
        if (!line.isEmpty()) {
          cs.showText(line);
        }
        cs.newLineAtOffset(0, -LEADING);
      }
      cs.endText();
    }
  }

  static List<String> wrapPreserveSpaces(String text, PDFont font, float fontSize, float maxWidth)
      throws IOException {

    List<String> lines = new ArrayList<>();

    for (String paragraph : text.split("\n", -1)) {
      if (paragraph.isEmpty()) {
        lines.add("");
        continue;
      }

      StringBuilder line = new StringBuilder();
      for (String token : tokenize(paragraph)) {
        String candidate = line + token;
        if (width(font, candidate, fontSize) <= maxWidth || line.length() == 0) {
          line.setLength(0);
          line.append(candidate);
          continue;
        }

        lines.add(rstrip(line.toString()));
        line.setLength(0);

        if (width(font, token, fontSize) > maxWidth) {
          List<String> chunks = hardWrap(token, font, fontSize, maxWidth);
          for (int c = 0; c < chunks.size() - 1; c++) {
            lines.add(chunks.get(c));
          }
          line.append(chunks.get(chunks.size() - 1));
        } else if (!token.isBlank()) {
          line.append(token);
        }
      }
      lines.add(rstrip(line.toString()));
    }

    return lines;
  }

  // splits into alternating runs of spaces and non-spaces
  private static List<String> tokenize(String paragraph) {
    List<String> tokens = new ArrayList<>();
    StringBuilder tok = new StringBuilder();
    Boolean inWs = null;
    for (int i = 0; i < paragraph.length(); i++) {
      char c = paragraph.charAt(i);
      boolean ws = c == ' ';
      if (inWs != null && ws != inWs) {
        tokens.add(tok.toString());
        tok.setLength(0);
      }
      tok.append(c);
      inWs = ws;
    }
    if (tok.length() > 0) tokens.add(tok.toString());
    return tokens;
  }

  private static List<String> hardWrap(String token, PDFont font, float fontSize, float maxWidth)
      throws IOException {
    List<String> out = new ArrayList<>();
    StringBuilder line = new StringBuilder();
    for (int i = 0; i < token.length(); i++) {
      char c = token.charAt(i);
      if (line.length() > 0 && width(font, line.toString() + c, fontSize) > maxWidth) {
        out.add(line.toString());
        line.setLength(0);
      }
      line.append(c);
    }
    if (line.length() > 0) out.add(line.toString());
    return out;
  }

  private static float width(PDFont font, String s, float fontSize) throws IOException {
    return font.getStringWidth(s) / 1000f * fontSize;
  }

  private static String rstrip(String s) {
    int end = s.length();
    while (end > 0 && s.charAt(end - 1) == ' ') {
      end--;
    }
    return s.substring(0, end);
  }
}
