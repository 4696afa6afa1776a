package nl.adgroot.docingest.processing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import nl.adgroot.docingest.model.SourceFile;
import nl.adgroot.docingest.support.TestFiles;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocumentTextExtractorTest {

  @TempDir
  Path dir;

  private final DocumentTextExtractor extractor = new DocumentTextExtractor();

  @Test
  void extractPages_returnsOneStringPerPdfPage() throws Exception {
    Path pdf = TestFiles.pdf(dir.resolve("two.pdf"), "FIRST PAGE", "SECOND PAGE");

    List<String> pages = extractor.extractPages(pdf);

    assertEquals(2, pages.size());
    assertTrue(pages.get(0).contains("FIRST PAGE"));
    assertTrue(pages.get(1).contains("SECOND PAGE"));
  }

  @Test
  void extract_docx_readsParagraphs() throws Exception {
    Path docx = TestFiles.docx(dir.resolve("letter.docx"), "Dear customer,", "Total due: 42");

    String text = extractor.extract(docx);

    assertTrue(text.contains("Dear customer,"));
    assertTrue(text.contains("Total due: 42"));
  }

  @Test
  void extractGroup_joinsMembersWithVisiblePageBreak() throws Exception {
    Path a = TestFiles.pdf(dir.resolve("part1.pdf"), "ALPHA");
    Path b = TestFiles.docx(dir.resolve("part2.docx"), "BETA");
    Instant t = Instant.now();

    String text = extractor.extractGroup(List.of(
        new SourceFile("part1.pdf", a, t),
        new SourceFile("part2.docx", b, t)));

    assertEquals("ALPHA" + DocumentTextExtractor.PAGE_BREAK + "BETA", text);
  }

  @Test
  void extract_corruptPdf_throwsIOException() throws Exception {
    Path broken = Files.writeString(dir.resolve("broken.pdf"), "definitely not a pdf");

    assertThrows(IOException.class, () -> extractor.extract(broken));
  }

  @Test
  void extract_corruptDocx_throwsIOException() throws Exception {
    Path broken = Files.writeString(dir.resolve("broken.docx"), "definitely not a zip");

    assertThrows(IOException.class, () -> extractor.extract(broken));
  }
}
