package nl.adgroot.docingest.support;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import javax.imageio.ImageIO;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.poi.xwpf.usermodel.XWPFDocument;

/** Builds real image, PDF and Word fixtures on disk. */
public final class TestFiles {

  private TestFiles() {
  }

  public static Path png(Path file, int width, int height, Color color) throws IOException {
    BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    Graphics2D g = img.createGraphics();
    try {
      g.setColor(color);
      g.fillRect(0, 0, width, height);
    } finally {
      g.dispose();
    }
    Files.createDirectories(file.getParent());
    ImageIO.write(img, "png", file.toFile());
    return file;
  }

  /** One PDF page per argument, each line of a page written on its own text line. */
  public static Path pdf(Path file, String... pages) throws IOException {
    Files.createDirectories(file.getParent());
    try (PDDocument doc = new PDDocument()) {
      for (String text : pages) {
        PDPage page = new PDPage();
        doc.addPage(page);
        try (PDPageContentStream cs = new PDPageContentStream(
            doc, page, PDPageContentStream.AppendMode.OVERWRITE, true, true)) {
          cs.beginText();
          cs.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
          cs.newLineAtOffset(50, 750);
          for (String line : text.split("\n", -1)) {
            if (!line.isEmpty()) {
              cs.showText(line);
            }
            cs.newLineAtOffset(0, -14);
          }
          cs.endText();
        }
      }
      doc.save(file.toFile());
    }
    return file;
  }

  public static Path docx(Path file, String... paragraphs) throws IOException {
    Files.createDirectories(file.getParent());
    try (XWPFDocument doc = new XWPFDocument();
         OutputStream os = Files.newOutputStream(file)) {
      for (String p : paragraphs) {
        doc.createParagraph().createRun().setText(p);
      }
      doc.write(os);
    }
    return file;
  }

  public static Path text(Path file, String content) throws IOException {
    Files.createDirectories(file.getParent());
    return Files.writeString(file, content);
  }

  public static Path touch(Path file, Instant lastModified) throws IOException {
    Files.setLastModifiedTime(file, FileTime.from(lastModified));
    return file;
  }
}
