package nl.adgroot.docingest.delivery;

import java.nio.file.Path;
import java.util.List;

import nl.adgroot.docingest.model.Document;

/** Artifacts of one document together with the fragment they are delivered under. */
public record DeliveryRequest(Document document, String fragment, List<Path> artifacts) {

  public DeliveryRequest {
    artifacts = List.copyOf(artifacts);
  }

  /** {@code <fragment>/<documentName>}, relative to the delivery destination. */
  public String destinationKey() {
    return fragment + "/" + document.getName();
  }
}
