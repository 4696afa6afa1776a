package nl.adgroot.docingest.processing;

import java.util.Set;

import nl.adgroot.docingest.model.SourceFile;

/** Content type of a source file, decided by extension. */
public enum FileKind {
  IMAGE,
  DOCUMENT,
  OTHER;

  private static final Set<String> IMAGE_EXTENSIONS = Set.of("jpg", "jpeg", "png", "bmp", "gif", "tif", "tiff");
  private static final Set<String> DOCUMENT_EXTENSIONS = Set.of("pdf", "docx", "doc");

  public static FileKind of(SourceFile file) {
    String ext = file.extension();
    if (IMAGE_EXTENSIONS.contains(ext)) return IMAGE;
    if (DOCUMENT_EXTENSIONS.contains(ext)) return DOCUMENT;
    return OTHER;
  }
}
