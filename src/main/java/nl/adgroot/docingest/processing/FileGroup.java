package nl.adgroot.docingest.processing;

import java.util.List;

import nl.adgroot.docingest.model.SourceFile;

/** Page-ordered files of one kind that share a group key and become one artifact. */
public record FileGroup(String key, FileKind kind, List<SourceFile> members) {

  public FileGroup {
    members = List.copyOf(members);
  }
}
