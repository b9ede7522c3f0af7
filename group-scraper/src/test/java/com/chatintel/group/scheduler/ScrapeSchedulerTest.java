package com.chatintel.group.scheduler;

import com.chatintel.group.config.GroupScraperProperties;
import com.chatintel.group.model.ScrapeResult;
import com.chatintel.group.service.IngestionService;
import com.chatintel.group.source.ConnectionState;
import com.chatintel.group.store.MessageStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.support.CronTrigger;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ScrapeSchedulerTest {

    private final IngestionService ingestionService = mock(IngestionService.class);
    private final MessageStore messageStore = mock(MessageStore.class);
    private final TaskScheduler taskScheduler = mock(TaskScheduler.class);
    private final GroupScraperProperties properties = new GroupScraperProperties();
    private final ScheduledFuture<?> ingestionFuture = mock(ScheduledFuture.class);
    private final ScheduledFuture<?> cleanupFuture = mock(ScheduledFuture.class);

    private ScrapeScheduler scheduler;

    @BeforeEach
    void setUp() {
        doReturn(ingestionFuture, cleanupFuture)
                .when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        scheduler = new ScrapeScheduler(ingestionService, messageStore, taskScheduler, properties);
    }

    @Test
    void startupPreparesSchemaAndClosesAbandonedRuns() {
        scheduler.onStartup();

        InOrder order = inOrder(messageStore);
        order.verify(messageStore).ensureSchema();
        order.verify(messageStore).failAbandonedRuns();
        verifyNoInteractions(taskScheduler);
    }

    @Test
    void startupRejectsAnUnparseableCron() {
        properties.getScheduling().setScrapeCron("every five minutes");

        assertThatThrownBy(scheduler::onStartup)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("scrape-cron");
        verifyNoInteractions(messageStore);
    }

    @Test
    void fiveFieldCronGetsASecondsField() {
        properties.getScheduling().setScrapeCron("*/5 * * * *");
        properties.getScheduling().setCleanupCron("30 3 * * *");

        scheduler.onStartup();
        scheduler.onStateChange(ConnectionState.AUTHENTICATED, ConnectionState.READY);

        ArgumentCaptor<Trigger> triggers = ArgumentCaptor.forClass(Trigger.class);
        verify(taskScheduler, times(2)).schedule(any(Runnable.class), triggers.capture());
        assertThat(triggers.getAllValues())
                .extracting(t -> ((CronTrigger) t).getExpression())
                .containsExactly("0 */5 * * * *", "0 30 3 * * *");
        assertThat(scheduler.getStatus().ingestion().schedule()).isEqualTo("0 */5 * * * *");
        assertThat(scheduler.getStatus().ingestion().armed()).isTrue();
    }

    @Test
    void cleanupIsArmedEvenWhenIngestionCannotBe() {
        properties.getScheduling().setScrapeCron("not a cron");

        scheduler.onStateChange(ConnectionState.AUTHENTICATED, ConnectionState.READY);

        verify(taskScheduler, times(1)).schedule(any(Runnable.class), any(Trigger.class));
        assertThat(scheduler.getStatus().ingestion().armed()).isFalse();
        assertThat(scheduler.getStatus().cleanup().armed()).isTrue();
    }

    @Test
    void startAllArmsBothJobsOnce() {
        scheduler.startAll();
        scheduler.startAll();

        ArgumentCaptor<Trigger> triggers = ArgumentCaptor.forClass(Trigger.class);
        verify(taskScheduler, times(2)).schedule(any(Runnable.class), triggers.capture());
        assertThat(triggers.getAllValues())
                .extracting(t -> ((CronTrigger) t).getExpression())
                .containsExactly("0 */5 * * * *", "0 0 2 * * *");

        SchedulerStatus status = scheduler.getStatus();
        assertThat(status.ingestion().armed()).isTrue();
        assertThat(status.cleanup().armed()).isTrue();
        assertThat(status.timezone()).isEqualTo("Asia/Colombo");
    }

    @Test
    void stopAllIsIdempotent() {
        scheduler.startAll();

        scheduler.stopAll();
        scheduler.stopAll();

        verify(ingestionFuture, times(1)).cancel(false);
        verify(cleanupFuture, times(1)).cancel(false);
        assertThat(scheduler.getStatus().ingestion().armed()).isFalse();
        assertThat(scheduler.getStatus().cleanup().armed()).isFalse();
    }

    @Test
    void restartAfterStopArmsAgain() {
        scheduler.startIngestion();
        scheduler.stopIngestion();
        scheduler.startIngestion();

        verify(taskScheduler, times(2)).schedule(any(Runnable.class), any(Trigger.class));
    }

    @Test
    void cleanupIsNotArmedWhenRetentionIsForever() {
        properties.getRetention().setDays(0);

        scheduler.startAll();

        verify(taskScheduler, times(1)).schedule(any(Runnable.class), any(Trigger.class));
        SchedulerStatus status = scheduler.getStatus();
        assertThat(status.cleanup().enabled()).isFalse();
        assertThat(status.cleanup().armed()).isFalse();
        assertThat(status.ingestion().armed()).isTrue();
    }

    @Test
    void readySourceArmsJobsWhenAutoStartIsOn() {
        scheduler.onStateChange(ConnectionState.AUTHENTICATED, ConnectionState.READY);

        verify(taskScheduler, times(2)).schedule(any(Runnable.class), any(Trigger.class));
    }

    @Test
    void readySourceLeavesJobsAloneWhenAutoStartIsOff() {
        properties.getScheduling().setAutoStart(false);

        scheduler.onStateChange(ConnectionState.AUTHENTICATED, ConnectionState.READY);

        verifyNoInteractions(taskScheduler);
    }

    @Test
    void ingestionTickSkipsUntilSourceIsReady() {
        scheduler.ingestionTick();
        verifyNoInteractions(ingestionService);

        scheduler.onStateChange(ConnectionState.READY, ConnectionState.DISCONNECTED);
        scheduler.ingestionTick();
        verifyNoInteractions(ingestionService);
    }

    @Test
    void ingestionTickScrapesWhenReady() {
        properties.getScheduling().setAutoStart(false);
        when(ingestionService.tryScrapeAllConfiguredGroups())
                .thenReturn(Optional.of(List.of(ScrapeResult.success("a@g.us", "A", 2, 1))));

        scheduler.onStateChange(ConnectionState.AUTHENTICATED, ConnectionState.READY);
        scheduler.ingestionTick();

        verify(ingestionService).tryScrapeAllConfiguredGroups();
    }

    @Test
    void ticksNeverThrow() {
        properties.getScheduling().setAutoStart(false);
        scheduler.onStateChange(ConnectionState.AUTHENTICATED, ConnectionState.READY);
        when(ingestionService.tryScrapeAllConfiguredGroups()).thenThrow(new IllegalStateException("boom"));
        when(ingestionService.cleanupExpiredMessages()).thenThrow(new IllegalStateException("db down"));

        assertThatCode(scheduler::ingestionTick).doesNotThrowAnyException();
        assertThatCode(scheduler::cleanupTick).doesNotThrowAnyException();
    }

    @Test
    void overlappingTickIsSkippedQuietly() {
        properties.getScheduling().setAutoStart(false);
        scheduler.onStateChange(ConnectionState.AUTHENTICATED, ConnectionState.READY);
        when(ingestionService.tryScrapeAllConfiguredGroups()).thenReturn(Optional.empty());

        assertThatCode(scheduler::ingestionTick).doesNotThrowAnyException();
        verify(ingestionService, never()).scrapeAllConfiguredGroups();
    }
}
