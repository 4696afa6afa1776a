package nl.adgroot.docingest.delivery;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import nl.adgroot.docingest.model.Document;
import nl.adgroot.docingest.model.ProcessedFile;
import nl.adgroot.docingest.organize.OrganizationResolver;

/**
 * Builds delivery requests in document order, with each document's artifacts in processing order
 * and duplicate paths dropped. Documents without artifacts are left out.
 */
public class DeliveryPlanner {

  public List<DeliveryRequest> plan(List<Document> documents, OrganizationResolver resolver) {
    List<DeliveryRequest> requests = new ArrayList<>();
    for (Document document : documents) {
      Set<Path> artifacts = new LinkedHashSet<>();
      for (ProcessedFile file : document.getProcessedFiles()) {
        artifacts.add(file.getPath().toAbsolutePath().normalize());
      }
      if (artifacts.isEmpty()) {
        continue;
      }
      requests.add(new DeliveryRequest(document, resolver.resolve(document), new ArrayList<>(artifacts)));
    }
    return requests;
  }
}
