package com.phillippitts.mediametric.service.orchestration.event;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs asset failures published on the application event bus.
 */
@Component
public class RunEventsListener {

    private static final Logger LOG = LogManager.getLogger(RunEventsListener.class);

    @EventListener
    public void onAssetRunFailed(AssetRunFailedEvent event) {
        LOG.warn("Asset run failed: executor={}, category={}, asset={}, message={}",
                event.executorId(), event.category(), event.asset(), event.message());
    }
}
