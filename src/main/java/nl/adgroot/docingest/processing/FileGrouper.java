package nl.adgroot.docingest.processing;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import nl.adgroot.docingest.model.SourceFile;

/**
 * Partitions a document's files into image groups, document groups and pass-through files.
 *
 * <p>Groups are returned in the order their first member was discovered. Members are sorted by page
 * number; members with the same page keep discovery order. Images and documents never share a group.
 */
public class FileGrouper {

  public record Partition(List<FileGroup> groups, List<SourceFile> passThrough) {}

  // a digit-less name is a group of its own, even if its key equals a numbered group's key
  private record GroupId(FileKind kind, String key, boolean paged) {}

  private record Member(SourceFile file, long page) {}

  public Partition partition(List<SourceFile> files) {
    Map<GroupId, List<Member>> buckets = new LinkedHashMap<>();
    List<SourceFile> passThrough = new ArrayList<>();

    for (SourceFile file : files) {
      FileKind kind = FileKind.of(file);
      if (kind == FileKind.OTHER) {
        passThrough.add(file);
        continue;
      }
      FileGroupKey parsed = FileGroupKey.parse(file.name());
      buckets.computeIfAbsent(new GroupId(kind, parsed.key(), parsed.hasPage()), k -> new ArrayList<>())
          .add(new Member(file, parsed.page()));
    }

    List<FileGroup> groups = new ArrayList<>(buckets.size());
    for (Map.Entry<GroupId, List<Member>> e : buckets.entrySet()) {
      List<SourceFile> ordered = e.getValue().stream()
          .sorted(Comparator.comparingLong(Member::page))
          .map(Member::file)
          .toList();
      groups.add(new FileGroup(e.getKey().key(), e.getKey().kind(), ordered));
    }
    return new Partition(groups, passThrough);
  }
}
