package github.sarthakdev143.style_reel.service.impl;

import github.sarthakdev143.style_reel.exception.StoreUnavailableException;
import github.sarthakdev143.style_reel.service.TaskService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TaskMaintenanceJobTest {

    @Mock
    private TaskService taskService;

    @Mock
    private ReferenceProtectionService referenceProtectionService;

    @InjectMocks
    private TaskMaintenanceJob job;

    @Test
    void maintenanceExpiresSelectionsThenSweeps() {
        when(taskService.expireStaleSelections()).thenReturn(2);

        job.runMaintenance();

        verify(taskService).expireStaleSelections();
        verify(referenceProtectionService).sweepOrphans();
    }

    @Test
    void unavailableStoreSkipsTheRun() {
        when(taskService.expireStaleSelections())
                .thenThrow(new StoreUnavailableException("listing failed", new IOException("EIO")));

        job.runMaintenance();

        verifyNoInteractions(referenceProtectionService);
    }
}
