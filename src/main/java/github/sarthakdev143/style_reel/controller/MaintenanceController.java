package github.sarthakdev143.style_reel.controller;

import github.sarthakdev143.style_reel.dto.SweepResponse;
import github.sarthakdev143.style_reel.exception.StoreUnavailableException;
import github.sarthakdev143.style_reel.service.impl.ReferenceProtectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/maintenance")
public class MaintenanceController {

    private static final Logger logger = LoggerFactory.getLogger(MaintenanceController.class);

    private final ReferenceProtectionService referenceProtectionService;

    public MaintenanceController(ReferenceProtectionService referenceProtectionService) {
        this.referenceProtectionService = referenceProtectionService;
    }

    @PostMapping("/sweep")
    public ResponseEntity<?> sweep() {
        try {
            return ResponseEntity.ok(new SweepResponse(referenceProtectionService.sweepOrphans()));
        } catch (StoreUnavailableException e) {
            logger.error("Orphan sweep failed", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body("Storage is unavailable. Please try again later.");
        }
    }
}
