package com.licitia.etl.service;

import com.licitia.etl.domain.entity.Task;
import com.licitia.etl.domain.enums.Frequency;
import com.licitia.etl.exception.RunAlreadyInProgressException;
import com.licitia.etl.exception.UnknownDatasetException;
import com.licitia.etl.ingestion.DatasetCatalog;
import com.licitia.etl.ingestion.IngestionOptions;
import com.licitia.etl.ingestion.IngestionResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ManualIngestionServiceTest {

    @Mock TaskRegistryService taskRegistry;
    @Mock TaskDispatcher taskDispatcher;

    private ManualIngestionService service() {
        return new ManualIngestionService(taskRegistry, taskDispatcher, new DatasetCatalog());
    }

    private static final Task TASK = Task.builder().id(3L).dataset("nacional").subset("licitaciones")
            .frequency(Frequency.MONTHLY).build();

    @Test
    void ingest_registeredTask_dispatchesThroughLedger() {
        IngestionOptions options = IngestionOptions.parse("2025", false, false);
        when(taskRegistry.find("nacional", "licitaciones")).thenReturn(Optional.of(TASK));
        when(taskDispatcher.dispatchOrThrow(TASK, options))
                .thenReturn(new DispatchResult(3L, 1L, DispatchResult.Outcome.SUCCEEDED, new IngestionResult(4, 0), null));

        DispatchResult result = service().ingest("nacional", "licitaciones", options);

        assertTrue(result.succeeded());
        verify(taskRegistry, never()).register(any(), any(), any());
    }

    @Test
    void ingest_unregisteredTask_registersWithDefaultFrequency() {
        when(taskRegistry.find("nacional", "licitaciones")).thenReturn(Optional.empty());
        when(taskRegistry.register("nacional", "licitaciones", null))
                .thenReturn(new TaskRegistryService.Registration(TASK, TaskRegistryService.RegistrationOutcome.INSERTED));
        when(taskDispatcher.dispatchOrThrow(eq(TASK), any()))
                .thenReturn(new DispatchResult(3L, 1L, DispatchResult.Outcome.SUCCEEDED, IngestionResult.empty(), null));

        service().ingest("nacional", "licitaciones", IngestionOptions.forYear(2026));

        verify(taskRegistry).register("nacional", "licitaciones", null);
    }

    @Test
    void ingest_alreadyRunning_propagates() {
        when(taskRegistry.find("nacional", "licitaciones")).thenReturn(Optional.of(TASK));
        when(taskDispatcher.dispatchOrThrow(any(), any())).thenThrow(new RunAlreadyInProgressException(3L));

        assertThrows(RunAlreadyInProgressException.class,
                () -> service().ingest("nacional", "licitaciones", IngestionOptions.forYear(2026)));
    }

    @Test
    void ingest_unknownPair_rejectedBeforeAnyLookup() {
        assertThrows(UnknownDatasetException.class,
                () -> service().ingest("nacional", "nope", IngestionOptions.defaults()));
        verifyNoInteractions(taskRegistry, taskDispatcher);
    }
}
