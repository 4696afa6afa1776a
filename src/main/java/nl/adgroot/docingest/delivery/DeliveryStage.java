package nl.adgroot.docingest.delivery;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import nl.adgroot.docingest.organize.OrganizationResolver;
import nl.adgroot.docingest.pipeline.NextStage;
import nl.adgroot.docingest.pipeline.PipelineState;
import nl.adgroot.docingest.pipeline.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Resolves each document's destination fragment and hands its artifacts to a {@link DeliveryService}. */
public class DeliveryStage implements Stage {

  private static final Logger log = LoggerFactory.getLogger(DeliveryStage.class);

  private final DeliveryService deliveryService;
  private final DeliveryPlanner planner;

  public DeliveryStage(DeliveryService deliveryService) {
    this(deliveryService, new DeliveryPlanner());
  }

  public DeliveryStage(DeliveryService deliveryService, DeliveryPlanner planner) {
    this.deliveryService = deliveryService;
    this.planner = planner;
  }

  @Override
  public void process(PipelineState state, NextStage next) throws IOException {
    OrganizationResolver resolver = state.configuration().organizationResolver();

    for (DeliveryRequest request : planner.plan(state.documents(), resolver)) {
      List<Path> committed = deliveryService.deliver(request.artifacts(), request.destinationKey());
      state.addDeliveredFiles(committed);
      log.info("Delivered {} file(s) of {} to {}", committed.size(), request.document().getName(),
          request.destinationKey());
    }
    next.invoke(state);
  }
}
