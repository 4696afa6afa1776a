package nl.adgroot.docingest.ocr;

import java.io.IOException;

/** Turns an encoded image into the text it shows. */
@FunctionalInterface
public interface OcrService {

  String extractText(byte[] imageBytes) throws IOException;
}
