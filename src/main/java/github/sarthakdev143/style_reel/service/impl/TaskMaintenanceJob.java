package github.sarthakdev143.style_reel.service.impl;

import github.sarthakdev143.style_reel.exception.StoreUnavailableException;
import github.sarthakdev143.style_reel.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class TaskMaintenanceJob {

    private static final Logger logger = LoggerFactory.getLogger(TaskMaintenanceJob.class);

    private final TaskService taskService;
    private final ReferenceProtectionService referenceProtectionService;

    public TaskMaintenanceJob(TaskService taskService, ReferenceProtectionService referenceProtectionService) {
        this.taskService = taskService;
        this.referenceProtectionService = referenceProtectionService;
    }

    @Scheduled(
            initialDelayString = "${style-reel.maintenance.interval:PT15M}",
            fixedDelayString = "${style-reel.maintenance.interval:PT15M}")
    public void runMaintenance() {
        try {
            int expired = taskService.expireStaleSelections();
            if (expired > 0) {
                logger.info("Expired {} tasks that waited too long for a selection", expired);
            }
            referenceProtectionService.sweepOrphans();
        } catch (StoreUnavailableException e) {
            logger.error("Maintenance run skipped; store unavailable", e);
        }
    }
}
