package nl.adgroot.docingest.processing;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import nl.adgroot.docingest.model.SourceFile;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.poi.hwpf.extractor.WordExtractor;
import org.apache.poi.xwpf.extractor.XWPFWordExtractor;
import org.apache.poi.xwpf.usermodel.XWPFDocument;

/** Reads the text of pre-rendered documents: PDF through PDFBox, Word through Apache POI. */
public class DocumentTextExtractor {

  public static final String PAGE_BREAK = "\n\n----- Page Break -----\n\n";

  /** Text of every member in order, joined with {@link #PAGE_BREAK}. */
  public String extractGroup(List<SourceFile> members) throws IOException {
    List<String> texts = new ArrayList<>(members.size());
    for (SourceFile member : members) {
      texts.add(extract(member.path()));
    }
    return String.join(PAGE_BREAK, texts);
  }

  public String extract(Path file) throws IOException {
    String name = file.getFileName().toString().toLowerCase(java.util.Locale.ROOT);
    if (name.endsWith(".pdf")) return extractPdf(file);
    if (name.endsWith(".docx")) return extractDocx(file);
    if (name.endsWith(".doc")) return extractDoc(file);
    throw new IOException("Not a supported document: " + file);
  }

  /** One string per PDF page. */
  public List<String> extractPages(Path pdfPath) throws IOException {
    try (PDDocument doc = Loader.loadPDF(pdfPath.toFile())) {
      PDFTextStripper stripper = new PDFTextStripper();
      List<String> pages = new ArrayList<>(doc.getNumberOfPages());
      for (int p = 1; p <= doc.getNumberOfPages(); p++) {
        stripper.setStartPage(p);
        stripper.setEndPage(p);
        pages.add(stripper.getText(doc));
      }
      return pages;
    }
  }

  private String extractPdf(Path file) throws IOException {
    return String.join("", extractPages(file)).strip();
  }

  private static String extractDocx(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file);
         XWPFDocument doc = new XWPFDocument(in);
         XWPFWordExtractor extractor = new XWPFWordExtractor(doc)) {
      return extractor.getText().strip();
    } catch (RuntimeException e) {
      // POI reports malformed packages with unchecked exceptions
      throw new IOException("Unreadable Word document: " + file, e);
    }
  }

  private static String extractDoc(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file);
         WordExtractor extractor = new WordExtractor(in)) {
      return extractor.getText().strip();
    } catch (RuntimeException e) {
      throw new IOException("Unreadable Word document: " + file, e);
    }
  }
}
