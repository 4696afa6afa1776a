package nl.adgroot.docingest.generate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class OutputFormatTest {

  @Test
  void parse_isCaseInsensitive() {
    assertEquals(OutputFormat.WORD, OutputFormat.parse("Word"));
    assertEquals(OutputFormat.WORD, OutputFormat.parse("DOCX"));
    assertEquals(OutputFormat.PDF, OutputFormat.parse(" pdf "));
    assertEquals(OutputFormat.TEXT, OutputFormat.parse("txt"));
  }

  @Test
  void parse_unknownOrNull_throwsUnsupported() {
    assertThrows(UnsupportedOutputFormatException.class, () -> OutputFormat.parse("html"));
    assertThrows(UnsupportedOutputFormatException.class, () -> OutputFormat.parse(null));
  }
}
