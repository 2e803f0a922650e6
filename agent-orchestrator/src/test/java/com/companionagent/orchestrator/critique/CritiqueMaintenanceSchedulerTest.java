package com.companionagent.orchestrator.critique;

import com.companionagent.orchestrator.model.CritiqueJobLog;
import com.companionagent.orchestrator.repository.CritiqueJobLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class CritiqueMaintenanceSchedulerTest {

    private CritiqueJobLogRepository jobLog;
    private HintInjectionService hintService;
    private SelfCorrectionService correctionService;
    private CritiqueMaintenanceScheduler scheduler;

    @BeforeEach
    void setUp() {
        jobLog            = mock(CritiqueJobLogRepository.class);
        hintService       = mock(HintInjectionService.class);
        correctionService = mock(SelfCorrectionService.class);
        scheduler = new CritiqueMaintenanceScheduler(jobLog, hintService, correctionService);
    }

    @Test
    @DisplayName("completed rows expire after an hour, failed rows after a day")
    void sweep() {
        when(jobLog.deleteFinishedBefore(eq(CritiqueJobLog.COMPLETED), any())).thenReturn(Mono.just(3));
        when(jobLog.deleteFinishedBefore(eq(CritiqueJobLog.FAILED), any())).thenReturn(Mono.just(1));

        StepVerifier.create(scheduler.sweepJobLog())
            .expectNext(4)
            .verifyComplete();

        ArgumentCaptor<LocalDateTime> completedCutoff = ArgumentCaptor.forClass(LocalDateTime.class);
        ArgumentCaptor<LocalDateTime> failedCutoff = ArgumentCaptor.forClass(LocalDateTime.class);
        verify(jobLog).deleteFinishedBefore(eq(CritiqueJobLog.COMPLETED), completedCutoff.capture());
        verify(jobLog).deleteFinishedBefore(eq(CritiqueJobLog.FAILED), failedCutoff.capture());

        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        long completedAgeMin = Duration.between(completedCutoff.getValue(), now).toMinutes();
        long failedAgeHours  = Duration.between(failedCutoff.getValue(), now).toHours();
        assertTrue(completedAgeMin >= 59 && completedAgeMin <= 60);
        assertTrue(failedAgeHours >= 23 && failedAgeHours <= 24);
    }

    @Test
    @DisplayName("feedback cycle decays user hints then drops old corrections")
    void feedback() {
        when(hintService.decayUserHints(7)).thenReturn(Mono.just(5));
        when(correctionService.cleanupOldCorrections(7)).thenReturn(Mono.just(2));

        StepVerifier.create(scheduler.maintainFeedback())
            .expectNext(2)
            .verifyComplete();

        verify(hintService).decayUserHints(7);
        verify(correctionService).cleanupOldCorrections(7);
    }
}
