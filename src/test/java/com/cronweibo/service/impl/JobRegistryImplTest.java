package com.cronweibo.service.impl;

import com.cronweibo.TestProperties;
import com.cronweibo.client.WeiboClient;
import com.cronweibo.entity.AccessToken;
import com.cronweibo.entity.CronJob;
import com.cronweibo.entity.ShareResponse;
import com.cronweibo.entity.WeiboContent;
import com.cronweibo.entity.WeiboJob;
import com.cronweibo.service.TokenService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.scheduling.support.PeriodicTrigger;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

import static com.cronweibo.TestProperties.SECURITY_URL;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class JobRegistryImplTest {

    private TaskScheduler taskScheduler;
    private ScheduledFuture<?> future;
    private TokenService tokenService;
    private WeiboClient client;
    private JobRegistryImpl registry;

    @BeforeEach
    void setUp() {
        taskScheduler = mock(TaskScheduler.class);
        future = mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        tokenService = mock(TokenService.class);
        client = mock(WeiboClient.class);
        when(tokenService.currentToken()).thenReturn(new AccessToken("tok", 3600, "42", 0));
        when(client.statusesShare(anyString(), anyString(), any())).thenReturn(new ShareResponse("1", "u/42"));

        var props = TestProperties.create(0);
        registry = new JobRegistryImpl(taskScheduler, new WeiboJobExecutorImpl(tokenService, client, props), props);
    }

    @Test
    void helloWorldTickPublishesAugmentedText() {
        registry.registerWeiboJobs(new WeiboJob("helloworld", "@every 2m", () -> WeiboContent.text("hello world")));
        registry.start();

        ArgumentCaptor<Runnable> action = ArgumentCaptor.forClass(Runnable.class);
        ArgumentCaptor<Trigger> trigger = ArgumentCaptor.forClass(Trigger.class);
        verify(taskScheduler).schedule(action.capture(), trigger.capture());
        PeriodicTrigger periodic = assertInstanceOf(PeriodicTrigger.class, trigger.getValue());
        assertEquals(Duration.ofMinutes(2), periodic.getPeriodDuration());

        // 두 번의 tick
        action.getValue().run();
        action.getValue().run();

        verify(client, times(2)).statusesShare("tok", "hello world\n" + SECURITY_URL, null);
        verify(tokenService, times(2)).ensureValid();
    }

    @Test
    void malformedScheduleIsNotTimerTriggeredButStaysRoutable() {
        registry.registerWeiboJobs(new WeiboJob("a", "@every 2m", () -> WeiboContent.text("a")));
        registry.registerCronJobs(
                new CronJob("b", "0 0 * * * *", () -> { }),
                new CronJob("broken", "not a cron", () -> { }));
        registry.start();

        ArgumentCaptor<Trigger> trigger = ArgumentCaptor.forClass(Trigger.class);
        verify(taskScheduler, times(2)).schedule(any(Runnable.class), trigger.capture());
        assertInstanceOf(CronTrigger.class, trigger.getAllValues().get(1));
        assertTrue(registry.findCronJob("broken").isPresent());
        assertEquals(List.of("b", "broken"), registry.cronJobs().stream().map(CronJob::getName).toList());
    }

    @Test
    void duplicateNameWithinKindIsSkipped() {
        WeiboJob first = new WeiboJob("dup", "@hourly", () -> WeiboContent.text("first"));
        WeiboJob second = new WeiboJob("dup", "@daily", () -> WeiboContent.text("second"));

        registry.registerWeiboJobs(first, second);
        registry.registerCronJobs(new CronJob("dup", "@daily", () -> { }));

        assertEquals(1, registry.weiboJobs().size());
        assertSame(first, registry.findWeiboJob("dup").orElseThrow());
        assertEquals(1, registry.cronJobs().size());
    }

    @Test
    void registrationAfterStartIsRejected() {
        registry.start();

        assertTrue(registry.isStarted());
        assertThrows(IllegalStateException.class,
                () -> registry.registerCronJobs(new CronJob("late", "@daily", () -> { })));
        assertThrows(IllegalStateException.class, registry::start);
    }

    @Test
    void snapshotsAreImmutableAndOrdered() {
        registry.registerWeiboJobs(
                new WeiboJob("x", "@daily", () -> WeiboContent.text("x")),
                new WeiboJob("y", "@daily", () -> WeiboContent.text("y")));

        List<WeiboJob> snapshot = registry.weiboJobs();

        assertEquals("x", snapshot.get(0).getName());
        assertEquals("y", snapshot.get(1).getName());
        assertThrows(UnsupportedOperationException.class, snapshot::clear);
    }

    @Test
    void stopCancelsScheduledJobs() {
        registry.registerCronJobs(new CronJob("c", "@hourly", () -> { }));
        registry.start();

        registry.stop();

        verify(future).cancel(false);
    }

    @Test
    void restartAfterStopReschedulesWithoutReopeningRegistration() {
        registry.registerCronJobs(new CronJob("c", "@hourly", () -> { }));
        registry.start();
        registry.stop();

        registry.start();

        verify(taskScheduler, times(2)).schedule(any(Runnable.class), any(Trigger.class));
        assertThrows(IllegalStateException.class,
                () -> registry.registerCronJobs(new CronJob("late", "@daily", () -> { })));
    }
}
