package nl.adgroot.docingest.delivery;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Copies artifacts into {@code <destinationRoot>/<destinationKey>/}, replacing existing files. */
public class FolderDeliveryService implements DeliveryService {

  private static final Logger log = LoggerFactory.getLogger(FolderDeliveryService.class);

  private final Path destinationRoot;

  public FolderDeliveryService(Path destinationRoot) {
    this.destinationRoot = destinationRoot.toAbsolutePath().normalize();
  }

  @Override
  public List<Path> deliver(List<Path> sources, String destinationKey) throws IOException {
    Path target = destinationRoot.resolve(destinationKey).normalize();
    if (!target.startsWith(destinationRoot)) {
      throw new IOException("Destination escapes delivery root: " + destinationKey);
    }
    Files.createDirectories(target);

    List<Path> committed = new ArrayList<>(sources.size());
    for (Path source : sources) {
      Path dest = target.resolve(source.getFileName().toString());
      Files.copy(source, dest, StandardCopyOption.REPLACE_EXISTING);
      committed.add(dest);
      log.debug("Delivered {} -> {}", source, dest);
    }
    return committed;
  }
}
