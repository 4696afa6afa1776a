package nl.adgroot.docingest.processing;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import nl.adgroot.docingest.model.SourceFile;
import org.junit.jupiter.api.Test;

class FileGrouperTest {

  private final FileGrouper grouper = new FileGrouper();

  private static List<SourceFile> files(String... names) {
    Instant t = Instant.parse("2024-01-01T00:00:00Z");
    return Arrays.stream(names)
        .map(n -> new SourceFile(n, Path.of("/in/doc", n), t))
        .toList();
  }

  private static List<String> names(FileGroup g) {
    return g.members().stream().map(SourceFile::name).toList();
  }

  @Test
  void partition_ordersGroupMembersByPageNumber() {
    FileGrouper.Partition p = grouper.partition(files("doc10.png", "doc2.png", "doc1.png"));

    assertEquals(1, p.groups().size());
    assertEquals(List.of("doc1.png", "doc2.png", "doc10.png"), names(p.groups().get(0)));
    assertEquals(FileKind.IMAGE, p.groups().get(0).kind());
  }

  @Test
  void partition_separatesKinds_andPassesThroughUnknownFiles() {
    FileGrouper.Partition p = grouper.partition(files("scan1.png", "scan1.pdf", "notes.txt", "scan2.png"));

    assertEquals(2, p.groups().size());
    assertEquals(List.of("scan1.png", "scan2.png"), names(p.groups().get(0)));
    assertEquals(List.of("scan1.pdf"), names(p.groups().get(1)));
    assertEquals(FileKind.DOCUMENT, p.groups().get(1).kind());
    assertEquals(List.of("notes.txt"), p.passThrough().stream().map(SourceFile::name).toList());
  }

  @Test
  void partition_groupsKeepFirstDiscoveryOrder() {
    FileGrouper.Partition p = grouper.partition(files("b1.jpg", "a1.jpg", "b2.jpg", "a2.jpg"));

    assertEquals(List.of("b.jpg", "a.jpg"), p.groups().stream().map(FileGroup::key).toList());
  }

  @Test
  void partition_samePage_keepsDiscoveryOrder() {
    FileGrouper.Partition p = grouper.partition(files("x01.png", "x1.png"));

    assertEquals(List.of("x01.png", "x1.png"), names(p.groups().get(0)));
  }

  @Test
  void partition_filesWithoutDigits_formSingletonGroups() {
    FileGrouper.Partition p = grouper.partition(files("front.JPG", "back.jpg"));

    assertEquals(2, p.groups().size());
    assertEquals(List.of("front.JPG"), names(p.groups().get(0)));
  }

  @Test
  void partition_fileWithoutDigits_neverJoinsNumberedGroupWithSameKey() {
    FileGrouper.Partition p = grouper.partition(files("scan.png", "scan1.png", "scan2.png"));

    assertEquals(2, p.groups().size());
    assertEquals(List.of("scan.png"), names(p.groups().get(0)));
    assertEquals(List.of("scan1.png", "scan2.png"), names(p.groups().get(1)));
  }

  @Test
  void partition_empty_yieldsNothing() {
    FileGrouper.Partition p = grouper.partition(List.of());

    assertEquals(0, p.groups().size());
    assertEquals(0, p.passThrough().size());
  }
}
