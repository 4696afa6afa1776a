package nl.adgroot.docingest.delivery;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** Commits finished artifacts to their destination. */
@FunctionalInterface
public interface DeliveryService {

  /**
   * @param sources artifacts to deliver
   * @param destinationKey relative destination, {@code <fragment>/<documentName>}
   * @return the committed files
   */
  List<Path> deliver(List<Path> sources, String destinationKey) throws IOException;
}
