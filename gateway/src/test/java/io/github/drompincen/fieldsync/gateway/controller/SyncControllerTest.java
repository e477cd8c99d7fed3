package io.github.drompincen.fieldsync.gateway.controller;

import io.github.drompincen.fieldsync.protocol.api.SyncPhase;
import io.github.drompincen.fieldsync.protocol.api.SyncResult;
import io.github.drompincen.fieldsync.runtime.sync.ProjectSyncCoordinator;
import io.github.drompincen.fieldsync.runtime.sync.SyncStatusHolder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SyncControllerTest {

    @Mock private ProjectSyncCoordinator coordinator;

    private SyncStatusHolder syncStatus;
    private SyncController controller;

    @BeforeEach
    void setUp() {
        syncStatus = new SyncStatusHolder();
        controller = new SyncController(coordinator, syncStatus);
    }

    @Test
    void successfulSyncIsOk() {
        SyncResult result = SyncResult.success("Synced 1 project(s): 1 fetched, 0 unchanged, 0 failed", List.of("A: 2/2 assets cached"));
        when(coordinator.syncAllProjects()).thenReturn(result);

        ResponseEntity<SyncResult> response = controller.syncAll();

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        assertThat(response.getBody()).isEqualTo(result);
    }

    @Test
    void concurrentSyncIsConflict() {
        when(coordinator.syncAllProjects()).thenReturn(SyncResult.failure(ProjectSyncCoordinator.ALREADY_RUNNING));

        assertThat(controller.syncAll().getStatusCode().value()).isEqualTo(409);
    }

    @Test
    void failedProjectSyncIsUnprocessable() {
        when(coordinator.syncProject("Z")).thenReturn(SyncResult.failure("project Z not found on server"));

        ResponseEntity<SyncResult> response = controller.syncOne("Z");

        assertThat(response.getStatusCode().value()).isEqualTo(422);
        assertThat(response.getBody().message()).isEqualTo("project Z not found on server");
    }

    @Test
    void statusReportsCurrentPhase() {
        assertThat(controller.status()).containsEntry("phase", SyncPhase.IDLE);

        syncStatus.tryStart();

        assertThat(controller.status()).containsEntry("phase", SyncPhase.RUNNING);
    }
}
