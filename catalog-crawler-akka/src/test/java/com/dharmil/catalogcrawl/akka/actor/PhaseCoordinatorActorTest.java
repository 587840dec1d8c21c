package com.dharmil.catalogcrawl.akka.actor;

import akka.actor.ActorRef;
import akka.actor.ActorSystem;
import akka.testkit.javadsl.TestKit;
import com.dharmil.catalogcrawl.akka.messages.BatchFinished;
import com.dharmil.catalogcrawl.akka.messages.DrainPhase;
import com.dharmil.catalogcrawl.akka.messages.PausePhase;
import com.dharmil.catalogcrawl.akka.messages.PhaseFinished;
import com.dharmil.catalogcrawl.akka.messages.PhaseProgress;
import com.dharmil.catalogcrawl.akka.messages.ResumePhase;
import com.dharmil.catalogcrawl.akka.messages.StartPhase;
import com.dharmil.catalogcrawl.events.CrawlEventBroadcaster;
import com.dharmil.catalogcrawl.model.CrawlErrorKind;
import com.dharmil.catalogcrawl.model.PageTask;
import com.dharmil.catalogcrawl.model.PhaseKind;
import com.dharmil.catalogcrawl.model.PhaseResult;
import com.dharmil.catalogcrawl.model.PhaseSettings;
import com.dharmil.catalogcrawl.model.PhaseSnapshot;
import com.dharmil.catalogcrawl.service.FixedRetryDelay;
import com.dharmil.catalogcrawl.service.TaskExecutor;
import com.dharmil.catalogcrawl.support.ScriptedCatalog;
import com.dharmil.catalogcrawl.support.TestRuntimes;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PhaseCoordinatorActorTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    private static ActorSystem system;

    @BeforeAll
    static void setup() {
        system = ActorSystem.create("PhaseCoordinatorActorTest");
    }

    @AfterAll
    static void teardown() {
        TestKit.shutdownActorSystem(system);
        system = null;
    }

    private static PhaseSettings settings(int concurrency, int batchSize, int maxRetries, int failureThreshold,
                                          int downshiftMinSample) {
        return new PhaseSettings(PhaseKind.LIST_COLLECTION, concurrency, batchSize, maxRetries, 1, failureThreshold,
                Duration.ofSeconds(5), 0.30, 0.5, downshiftMinSample, new FixedRetryDelay(Duration.ofMillis(1)));
    }

    private static List<PageTask> pages(int count) {
        List<PageTask> tasks = new ArrayList<>();
        for (int page = 1; page <= count; page++) {
            tasks.add(new PageTask(page));
        }
        return tasks;
    }

    private static ActorRef coordinator(TestKit parent, ScriptedCatalog catalog, PhaseSettings settings,
                                        List<PageTask> tasks, Map<String, Integer> seeded) {
        return parent.childActorOf(PhaseCoordinatorActor.props("s-test", settings, tasks, seeded,
                new TaskExecutor(catalog, catalog, catalog), TestRuntimes.BLOCKING_DISPATCHER,
                new CrawlEventBroadcaster(256, Clock.systemUTC()), Clock.systemUTC()));
    }

    /** Collects parent messages until the phase reports its result. */
    private static PhaseResult awaitResult(TestKit parent, List<Object> seen) {
        while (true) {
            Object msg = parent.expectMsgClass(WAIT, Object.class);
            if (msg instanceof PhaseFinished finished) {
                return finished.result();
            }
            seen.add(msg);
        }
    }

    private static PhaseSnapshot awaitProcessed(TestKit parent, int processed) {
        while (true) {
            Object msg = parent.expectMsgClass(WAIT, Object.class);
            if (msg instanceof PhaseProgress progress && progress.snapshot().processed() >= processed) {
                return progress.snapshot();
            }
        }
    }

    @Test
    void completesAllBatchesWithinConcurrencyLimit() {
        new TestKit(system) {{
            ScriptedCatalog catalog = new ScriptedCatalog().listProducts(2, "a", "b");
            ActorRef coordinator = coordinator(this, catalog, settings(2, 2, 3, 50, 10), pages(6), Map.of());

            coordinator.tell(new StartPhase(false), getRef());
            List<Object> seen = new ArrayList<>();
            PhaseResult result = awaitResult(this, seen);

            assertEquals(PhaseResult.Outcome.COMPLETED, result.outcome());
            assertEquals(6, result.snapshot().succeeded());
            assertEquals(0, result.snapshot().failed());
            assertTrue(result.snapshot().unfinishedTasks().isEmpty());
            assertEquals(3, seen.stream().filter(BatchFinished.class::isInstance).count());
            assertTrue(seen.stream().anyMatch(msg -> msg instanceof PhaseProgress progress
                    && progress.discovered().size() == 2));
            assertTrue(catalog.maxActiveFetches() <= 2);
        }};
    }

    @Test
    void downshiftsOnceWhenFailureRateIsHigh() {
        new TestKit(system) {{
            ScriptedCatalog catalog = new ScriptedCatalog();
            for (int page = 1; page <= 6; page++) {
                catalog.failPage(page, CrawlErrorKind.PERMANENT);
            }
            ActorRef coordinator = coordinator(this, catalog, settings(4, 12, 0, 50, 10), pages(12), Map.of());

            coordinator.tell(new StartPhase(false), getRef());
            PhaseResult result = awaitResult(this, new ArrayList<>());

            assertEquals(PhaseResult.Outcome.COMPLETED, result.outcome());
            assertEquals(6, result.snapshot().failed());
            assertTrue(result.snapshot().concurrency().downshifted());
            assertEquals(2, result.snapshot().concurrency().currentLimit());
            assertEquals(4, result.snapshot().concurrency().downshiftMeta().oldLimit());
            assertTrue(result.snapshot().concurrency().downshiftMeta().trigger().startsWith("fail_rate>"));
        }};
    }

    @Test
    void stopsAtFailureThreshold() {
        new TestKit(system) {{
            ScriptedCatalog catalog = new ScriptedCatalog()
                    .failPage(1, CrawlErrorKind.PERMANENT)
                    .failPage(2, CrawlErrorKind.PERMANENT);
            ActorRef coordinator = coordinator(this, catalog, settings(1, 10, 0, 2, 10), pages(5), Map.of());

            coordinator.tell(new StartPhase(false), getRef());
            PhaseResult result = awaitResult(this, new ArrayList<>());

            assertEquals(PhaseResult.Outcome.THRESHOLD_EXCEEDED, result.outcome());
            assertEquals(2, result.snapshot().failed());
            assertEquals(List.of("page:1", "page:2"), result.snapshot().failedSample());
            assertEquals(0, catalog.fetchCount(5));
        }};
    }

    @Test
    void pauseStopsDispatchUntilResumed() {
        ScriptedCatalog catalog = new ScriptedCatalog().hold();
        try {
            new TestKit(system) {{
                ActorRef coordinator = coordinator(this, catalog, settings(2, 10, 0, 50, 10), pages(4), Map.of());
                coordinator.tell(new StartPhase(false), getRef());
                awaitCond(WAIT, () -> catalog.activeFetches() == 2);

                coordinator.tell(new PausePhase(), getRef());
                catalog.release();
                PhaseSnapshot paused = awaitProcessed(this, 2);
                expectNoMessage(Duration.ofMillis(200));

                assertEquals(2, paused.succeeded());
                assertEquals(2, catalog.fetchedPages().size());

                coordinator.tell(new ResumePhase(), getRef());
                PhaseResult result = awaitResult(this, new ArrayList<>());

                assertEquals(PhaseResult.Outcome.COMPLETED, result.outcome());
                assertEquals(4, result.snapshot().succeeded());
                for (int page = 1; page <= 4; page++) {
                    assertEquals(1, catalog.fetchCount(page));
                }
            }};
        } finally {
            catalog.release();
        }
    }

    @Test
    void drainDeadlineFailsInFlightTasks() {
        ScriptedCatalog catalog = new ScriptedCatalog().hold();
        try {
            new TestKit(system) {{
                ActorRef coordinator = coordinator(this, catalog, settings(2, 10, 3, 50, 10), pages(3), Map.of());
                coordinator.tell(new StartPhase(false), getRef());
                awaitCond(WAIT, () -> catalog.activeFetches() == 2);

                coordinator.tell(new DrainPhase(Duration.ofMillis(200)), getRef());
                PhaseResult result = awaitResult(this, new ArrayList<>());

                assertEquals(PhaseResult.Outcome.ABORTED, result.outcome());
                assertEquals(2, result.snapshot().failed());
                assertEquals(List.of(new PageTask(3)), result.snapshot().unfinishedTasks());
                assertTrue(result.snapshot().lastError().startsWith("INTERNAL_ERROR"));
            }};
        } finally {
            catalog.release();
        }
    }

    @Test
    void drainWithNothingInFlightFinishesImmediately() {
        new TestKit(system) {{
            ActorRef coordinator = coordinator(this, new ScriptedCatalog(), settings(2, 10, 3, 50, 10), pages(3), Map.of());

            coordinator.tell(new DrainPhase(Duration.ofSeconds(5)), getRef());
            PhaseResult result = awaitResult(this, new ArrayList<>());

            assertEquals(PhaseResult.Outcome.ABORTED, result.outcome());
            assertEquals(3, result.snapshot().unfinishedTasks().size());
            assertEquals(0, result.snapshot().failed());
        }};
    }

    @Test
    void taskListsTravelOnlyWithBatchAndPhaseResults() {
        new TestKit(system) {{
            ScriptedCatalog catalog = new ScriptedCatalog().failPageThen(3, CrawlErrorKind.SERVER_ERROR);
            ActorRef coordinator = coordinator(this, catalog, settings(1, 2, 3, 50, 10), pages(4), Map.of());

            coordinator.tell(new StartPhase(false), getRef());
            List<Object> seen = new ArrayList<>();
            PhaseResult result = awaitResult(this, seen);

            List<PhaseSnapshot> progress = seen.stream()
                    .filter(PhaseProgress.class::isInstance)
                    .map(msg -> ((PhaseProgress) msg).snapshot())
                    .toList();
            assertFalse(progress.isEmpty());
            assertTrue(progress.stream().allMatch(snapshot -> snapshot.unfinishedTasks().isEmpty()
                    && snapshot.retryCounts().isEmpty()));

            BatchFinished firstBatch = seen.stream()
                    .filter(BatchFinished.class::isInstance)
                    .map(BatchFinished.class::cast)
                    .findFirst()
                    .orElseThrow();
            assertEquals(List.of(new PageTask(3), new PageTask(4)), firstBatch.snapshot().unfinishedTasks());

            assertEquals(PhaseResult.Outcome.COMPLETED, result.outcome());
            assertEquals(Map.of(new PageTask(3), 1), result.snapshot().retryCounts());
            assertEquals(1, result.snapshot().totalRetries());
        }};
    }

    @Test
    void seededRetriesCountAgainstBudget() {
        new TestKit(system) {{
            ScriptedCatalog catalog = new ScriptedCatalog()
                    .failPageThen(1, CrawlErrorKind.SERVER_ERROR, CrawlErrorKind.SERVER_ERROR)
                    .failPageThen(2, CrawlErrorKind.SERVER_ERROR, CrawlErrorKind.SERVER_ERROR);
            ActorRef coordinator = coordinator(this, catalog, settings(2, 10, 2, 50, 10), pages(2),
                    Map.of(PageTask.keyFor(1), 1));

            coordinator.tell(new StartPhase(false), getRef());
            PhaseResult result = awaitResult(this, new ArrayList<>());

            assertEquals(PhaseResult.Outcome.COMPLETED, result.outcome());
            assertEquals(1, result.snapshot().failed());
            assertEquals(List.of(new PageTask(1)), result.snapshot().failedTasks());
            assertEquals(2, catalog.fetchCount(1));
            assertEquals(3, catalog.fetchCount(2));
            assertEquals(Map.of(2, 2), result.snapshot().retryHistogram());
            assertFalse(result.snapshot().concurrency().downshifted());
        }};
    }
}
