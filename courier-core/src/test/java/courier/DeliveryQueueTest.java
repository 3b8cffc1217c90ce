package courier;

import courier.retry.RetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

class DeliveryQueueTest {

    private final RecordingDelegate delegate = new RecordingDelegate();
    private DeliveryQueue queue;

    @AfterEach
    void tearDown() {
        if (queue != null) {
            queue.close();
        }
    }

    // ── Builder ─────────────────────────────────────────────────────

    @Test
    void builderRejectsNullDelegate() {
        assertThrows(NullPointerException.class, () -> DeliveryQueue.builder(null).build());
    }

    @Test
    void builderClampsNonPositiveBoundsToOne() {
        queue = DeliveryQueue.builder(delegate).maxInFlight(0).timeoutSecs(-5).build();

        assertEquals(1, queue.getMaxInFlight());
        assertEquals(1, queue.getTimeoutSecs());
    }

    @Test
    void builderRejectsNonPositiveIdleWait() {
        assertThrows(IllegalArgumentException.class, () ->
                DeliveryQueue.builder(delegate).idleWaitSecs(0).build());
    }

    @Test
    void builderRejectsNonPositiveSettleWarnInterval() {
        assertThrows(IllegalArgumentException.class, () ->
                DeliveryQueue.builder(delegate).settleWarnIntervalSecs(0).build());
    }

    @Test
    void createUsesGivenBounds() {
        queue = DeliveryQueue.create(delegate, 4, 12);

        assertEquals(4, queue.getMaxInFlight());
        assertEquals(12, queue.getTimeoutSecs());
        assertEquals(QueueState.NOT_RUNNING, queue.state());
        assertEquals(0, queue.pendingCount());
        assertEquals(0, queue.admissibleCount());
        assertEquals(0, queue.inFlightCount());
    }

    // ── Worker lifecycle ────────────────────────────────────────────

    @Test
    void startWorkerTwiceReturnsFalse() {
        queue = newQueue(1, 30);

        assertTrue(queue.startWorker());
        assertFalse(queue.startWorker());
        assertEquals(QueueState.RUNNING, queue.state());
    }

    @Test
    void stopWorkerWithWaitReturnsToNotRunningAndCanRestart() {
        queue = newQueue(1, 30);
        queue.startWorker();

        queue.stopWorker(true);

        assertEquals(QueueState.NOT_RUNNING, queue.state());
        assertTrue(queue.startWorker());
    }

    @Test
    void stopWorkerOnStoppedQueueIsNoop() {
        queue = newQueue(1, 30);

        queue.stopWorker(true);

        assertEquals(QueueState.NOT_RUNNING, queue.state());
    }

    @Test
    void stopWorkerWithoutWaitReturnsOnceProcessingSettles() throws Exception {
        queue = newQueue(1, 30);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        delegate.processor = m -> {
            entered.countDown();
            await(release);
            return ProcessResult.SUCCESS;
        };
        queue.startWorker();
        queue.append(Message.create(1));
        queue.append(Message.create(2));
        assertTrue(entered.await(3, TimeUnit.SECONDS));

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> stopped = executor.submit(() -> queue.stopWorker(false));
            Thread.sleep(200);
            assertFalse(stopped.isDone());

            release.countDown();

            stopped.get(3, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
        awaitCondition(() -> queue.state() == QueueState.NOT_RUNNING);
        assertEquals(1, delegate.processed.size());
        assertEquals(1, queue.pendingCount());
    }

    @Test
    void stoppedQueueKeepsMessages() throws Exception {
        queue = newQueue(1, 30);
        queue.startWorker();
        queue.stopWorker(true);

        assertTrue(queue.append(Message.create(1)));
        Thread.sleep(100);

        assertTrue(delegate.processed.isEmpty());
        assertEquals(1, queue.pendingCount());
    }

    @Test
    void closeRemovesEveryQueuedMessage() throws Exception {
        queue = newQueue(1, 30);
        Message a = Message.create(1);
        Message b = Message.create(2);
        queue.append(a);
        queue.append(b);

        queue.close();

        assertEquals(2, delegate.notifications.size());
        for (RecordingDelegate.Notification n : delegate.notifications) {
            assertFalse(n.success());
            assertEquals(FailureReason.REMOVE, n.reason());
            assertTrue(n.message().isDestroyed());
        }
        assertEquals(0, queue.pendingCount());
    }

    // ── Append and filter ───────────────────────────────────────────

    @Test
    void appendRejectsNull() {
        queue = newQueue(1, 30);

        assertFalse(queue.append(null));
    }

    @Test
    void appendRejectsMessageAlreadyQueued() {
        queue = newQueue(1, 30);
        Message m = Message.create(1);

        assertTrue(queue.append(m));
        assertFalse(queue.append(m));
        assertEquals(1, queue.pendingCount());
    }

    @Test
    void filteredMessageStaysPendingUntilRunFilterAdmitsIt() {
        queue = newQueue(1, 30);
        delegate.filter = m -> false;
        Message m = Message.create(1);

        queue.append(m);

        assertEquals(1, queue.pendingCount());
        assertEquals(0, queue.admissibleCount());
        assertEquals(MessageSlot.PENDING, m.slot());

        delegate.filter = x -> true;
        queue.runFilter();

        assertEquals(1, queue.pendingCount());
        assertEquals(1, queue.admissibleCount());
        assertEquals(MessageSlot.ADMISSIBLE, m.slot());
    }

    @Test
    void runFilterRemovesMessagesThatNoLongerPass() {
        queue = newQueue(1, 30);
        queue.append(Message.builder(1).deliveryMask(0x1).build());
        queue.append(Message.builder(2).deliveryMask(0x2).build());
        assertEquals(2, queue.admissibleCount());

        delegate.filter = m -> (m.deliveryMask() & 0x2) != 0;
        queue.runFilter();

        List<Long> admissible = new ArrayList<>();
        queue.iterate(QueueScope.FILTER, m -> admissible.add(m.id()));
        assertEquals(List.of(2L), admissible);
        assertEquals(2, queue.pendingCount());
    }

    @Test
    void filterExceptionHoldsMessageBack() {
        queue = newQueue(1, 30);
        delegate.filter = m -> {
            throw new IllegalStateException("boom");
        };

        assertTrue(queue.append(Message.create(1)));

        assertEquals(1, queue.pendingCount());
        assertEquals(0, queue.admissibleCount());
    }

    @Test
    void filteredMessageIsDispatchedOnlyAfterRunFilter() throws Exception {
        queue = newQueue(1, 30);
        delegate.filter = m -> false;
        queue.startWorker();
        Message m = Message.create(1);
        queue.append(m);

        Thread.sleep(200);
        assertTrue(delegate.processed.isEmpty());

        delegate.filter = x -> true;
        queue.runFilter();

        RecordingDelegate.Notification n = delegate.nextNotification();
        assertNotNull(n);
        assertSame(m, n.message());
        assertTrue(n.success());
    }

    // ── Dispatch results ────────────────────────────────────────────

    @Test
    void successWithoutReplyNotifiesSuccess() throws Exception {
        queue = newQueue(1, 30);
        queue.startWorker();
        Message m = Message.builder(1).payload("data").build();

        queue.append(m);

        RecordingDelegate.Notification n = delegate.nextNotification();
        assertNotNull(n);
        assertSame(m, n.message());
        assertTrue(n.success());
        assertEquals(FailureReason.NONE, n.reason());
        assertTrue(m.isDestroyed());
        assertEquals(0, queue.inFlightCount());
    }

    @Test
    void messagesAreDispatchedInAppendOrder() throws Exception {
        queue = newQueue(1, 30);
        queue.append(Message.create(1));
        queue.append(Message.create(2));
        queue.append(Message.create(3));
        queue.startWorker();

        for (long expected = 1; expected <= 3; expected++) {
            RecordingDelegate.Notification n = delegate.nextNotification();
            assertNotNull(n);
            assertEquals(expected, n.message().id());
        }
    }

    @Test
    void successWithReplyWaitsInFlightUntilCompleted() throws Exception {
        queue = newQueue(1, 30);
        queue.startWorker();
        Message m = Message.builder(7).expectsReply(true).build();

        queue.append(m);
        awaitCondition(() -> delegate.processCount(m) == 1);
        awaitCondition(() -> !queue.isBusy());

        assertEquals(1, queue.inFlightCount());
        assertEquals(MessageSlot.IN_FLIGHT, m.slot());

        Optional<Message> completed = queue.completed(7, "ack");

        assertTrue(completed.isPresent());
        assertSame(m, completed.get());
        assertEquals(0, queue.inFlightCount());
        assertEquals(MessageSlot.RELEASED, m.slot());
        assertTrue(delegate.notifications.isEmpty());
        assertFalse(m.isDestroyed());
    }

    @Test
    void successHandledNotifiesEvenWhenReplyExpected() throws Exception {
        queue = newQueue(1, 30);
        delegate.processor = m -> ProcessResult.SUCCESS_HANDLED;
        queue.startWorker();

        queue.append(Message.builder(1).expectsReply(true).build());

        RecordingDelegate.Notification n = delegate.nextNotification();
        assertNotNull(n);
        assertTrue(n.success());
        assertEquals(0, queue.inFlightCount());
    }

    @Test
    void invalidResultNotifiesInvalid() throws Exception {
        queue = newQueue(1, 30);
        delegate.processor = m -> ProcessResult.INVALID;
        queue.startWorker();

        queue.append(Message.builder(1).expectsReply(true).build());

        RecordingDelegate.Notification n = delegate.nextNotification();
        assertNotNull(n);
        assertFalse(n.success());
        assertEquals(FailureReason.INVALID, n.reason());
        assertEquals(0, queue.inFlightCount());
    }

    @Test
    void nullResultIsTreatedAsInvalid() throws Exception {
        queue = newQueue(1, 30);
        delegate.processor = m -> null;
        queue.startWorker();

        queue.append(Message.create(1));

        RecordingDelegate.Notification n = delegate.nextNotification();
        assertNotNull(n);
        assertEquals(FailureReason.INVALID, n.reason());
    }

    @Test
    void processExceptionCountsAsSendFailure() throws Exception {
        queue = newQueue(1, 30);
        delegate.processor = m -> {
            throw new IllegalStateException("link down");
        };
        queue.startWorker();
        Message m = Message.builder(1).numRetries(1).build();

        queue.append(m);

        RecordingDelegate.Notification n = delegate.nextNotification();
        assertNotNull(n);
        assertEquals(FailureReason.RETRY_MAX, n.reason());
        assertEquals(2, delegate.processCount(m));
    }

    @Test
    void notifyExceptionDoesNotStopWorker() throws Exception {
        AtomicInteger notified = new AtomicInteger();
        CountDownLatch second = new CountDownLatch(1);
        DeliveryDelegate throwing = new RecordingDelegate() {
            @Override
            public void notify(Message message, boolean success, FailureReason reason) {
                if (notified.incrementAndGet() == 1) {
                    throw new IllegalStateException("callback bug");
                }
                second.countDown();
            }
        };
        queue = DeliveryQueue.builder(throwing).idleWaitSecs(1).build();
        queue.startWorker();

        queue.append(Message.create(1));
        queue.append(Message.create(2));

        assertTrue(second.await(3, TimeUnit.SECONDS));
    }

    // ── Retry budget ────────────────────────────────────────────────

    @Test
    void sendFailureWithNoRetriesEndsAfterOneAttempt() throws Exception {
        queue = newQueue(1, 1);
        delegate.processor = m -> ProcessResult.SEND_FAILURE;
        queue.startWorker();
        Message a = Message.builder(1).expectsReply(true).numRetries(Message.NO_RETRIES).build();

        queue.append(a);

        RecordingDelegate.Notification n = delegate.nextNotification();
        assertNotNull(n);
        assertSame(a, n.message());
        assertFalse(n.success());
        assertEquals(FailureReason.RETRY_MAX, n.reason());
        assertEquals(1, delegate.processCount(a));
        awaitCondition(() -> queue.pendingCount() == 0 && queue.inFlightCount() == 0);
    }

    @Test
    void sendFailureIsAttemptedRetriesPlusOneTimes() throws Exception {
        queue = newQueue(1, 30);
        delegate.processor = m -> ProcessResult.SEND_FAILURE;
        queue.startWorker();
        Message b = Message.builder(2).numRetries(2).build();

        queue.append(b);

        RecordingDelegate.Notification n = delegate.nextNotification();
        assertNotNull(n);
        assertEquals(FailureReason.RETRY_MAX, n.reason());
        assertEquals(3, delegate.processCount(b));
        assertEquals(1, delegate.notifications.size());
    }

    @Test
    void replyTimeoutRequeuesUntilBudgetIsSpent() throws Exception {
        queue = newQueue(1, 1);
        queue.startWorker();
        Message m = Message.builder(3).expectsReply(true).numRetries(1).build();

        queue.append(m);

        RecordingDelegate.Notification n = delegate.nextNotification(10);
        assertNotNull(n);
        assertEquals(FailureReason.RETRY_MAX, n.reason());
        assertEquals(2, delegate.processCount(m));
        assertTrue(m.sentOnce());
        assertEquals(0, queue.inFlightCount());
    }

    @Test
    void delaySendRequeuesWithoutSpendingBudget() throws Exception {
        queue = newQueue(1, 30);
        AtomicInteger attempts = new AtomicInteger();
        delegate.processor = m -> attempts.incrementAndGet() <= 3
                ? ProcessResult.DELAY_SEND : ProcessResult.SUCCESS;
        queue.startWorker();
        Message m = Message.builder(4).requestId(99).numRetries(Message.NO_RETRIES).build();

        queue.append(m);

        RecordingDelegate.Notification n = delegate.nextNotification();
        assertNotNull(n);
        assertTrue(n.success());
        assertEquals(4, delegate.processCount(m));
        assertEquals(0, m.errorCount());
    }

    // ── In-flight bound and membership ──────────────────────────────

    @Test
    void inFlightSetIsBoundedByMaxInFlight() throws Exception {
        queue = newQueue(2, 30);
        queue.startWorker();
        for (long id = 1; id <= 3; id++) {
            queue.append(Message.builder(id).expectsReply(true).build());
        }

        awaitCondition(() -> delegate.processed.size() == 2);
        Thread.sleep(200);
        assertEquals(2, delegate.processed.size());
        assertEquals(2, queue.inFlightCount());
        assertEquals(1, queue.pendingCount());

        assertTrue(queue.completed(1, "ack").isPresent());

        awaitCondition(() -> delegate.processed.size() == 3);
        assertEquals(3, delegate.processed.get(2).id());
    }

    @Test
    void messageWithoutReplyNeverEntersInFlight() throws Exception {
        queue = newQueue(1, 30);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        delegate.processor = m -> {
            entered.countDown();
            await(release);
            return ProcessResult.SUCCESS;
        };
        queue.startWorker();
        Message m = Message.create(1);

        queue.append(m);
        assertTrue(entered.await(3, TimeUnit.SECONDS));

        assertEquals(0, queue.inFlightCount());
        assertEquals(MessageSlot.PROCESSING, m.slot());
        release.countDown();
        assertNotNull(delegate.nextNotification());
    }

    @Test
    void duplicateInFlightIdIsDroppedAsInvalid() throws Exception {
        queue = newQueue(2, 30);
        queue.startWorker();
        Message first = Message.builder(5).expectsReply(true).build();
        Message second = Message.builder(5).expectsReply(true).build();

        queue.append(first);
        queue.append(second);

        RecordingDelegate.Notification n = delegate.nextNotification();
        assertNotNull(n);
        assertSame(second, n.message());
        assertEquals(FailureReason.INVALID, n.reason());
        assertEquals(1, queue.inFlightCount());
        assertTrue(queue.containsMessage(first));
    }

    @Test
    void isBusyIsTrueOnlyWhileProcessing() throws Exception {
        queue = newQueue(1, 30);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        delegate.processor = m -> {
            entered.countDown();
            await(release);
            return ProcessResult.SUCCESS;
        };
        queue.startWorker();
        assertFalse(queue.isBusy());

        queue.append(Message.create(1));
        assertTrue(entered.await(3, TimeUnit.SECONDS));
        assertTrue(queue.isBusy());
        assertEquals(QueueState.PROCESSING, queue.state());

        release.countDown();
        assertNotNull(delegate.nextNotification());
        awaitCondition(() -> !queue.isBusy());
    }

    // ── Completion ──────────────────────────────────────────────────

    @Test
    void completedForUnknownIdIsNoop() {
        queue = newQueue(1, 30);
        queue.append(Message.create(1));

        assertTrue(queue.completed(42, "ack").isEmpty());

        assertEquals(1, queue.pendingCount());
        assertEquals(1, queue.admissibleCount());
        assertEquals(0, queue.inFlightCount());
        assertTrue(delegate.notifications.isEmpty());
    }

    @Test
    void completedForPendingMessageIsNoop() {
        queue = newQueue(1, 30);
        queue.append(Message.builder(1).expectsReply(true).build());

        assertTrue(queue.completed(1, "ack").isEmpty());
        assertEquals(1, queue.pendingCount());
    }

    @Test
    void vetoedReplyLeavesMessageInFlight() throws Exception {
        queue = newQueue(1, 30);
        delegate.removalCheck = payload -> !"partial".equals(payload);
        Message m = dispatchAwaitingReply(8);

        assertTrue(queue.completed(8, "partial").isEmpty());
        assertEquals(1, queue.inFlightCount());

        assertSame(m, queue.completed(8, "final").orElseThrow());
        assertEquals(0, queue.inFlightCount());
    }

    @Test
    void nullPayloadSkipsRemovalVeto() throws Exception {
        queue = newQueue(1, 30);
        delegate.removalCheck = payload -> false;
        Message m = dispatchAwaitingReply(8);

        assertSame(m, queue.completed(8, null).orElseThrow());
    }

    @Test
    void messageRemovalCheckIsConsultedByDefault() throws Exception {
        queue = newQueue(1, 30);
        queue.startWorker();
        Message m = Message.builder(9)
                .expectsReply(true)
                .sentRemovalCheck((msg, payload) -> "done".equals(payload))
                .build();
        queue.append(m);
        awaitCondition(() -> queue.inFlightCount() == 1 && !queue.isBusy());

        assertTrue(queue.completed(9, "progress").isEmpty());
        assertTrue(queue.completed(9, "done").isPresent());
    }

    @Test
    void completedCustomSearchMatchesWithoutVeto() throws Exception {
        queue = newQueue(2, 30);
        delegate.removalCheck = payload -> false;
        queue.startWorker();
        queue.append(Message.builder(1).requestId(100).expectsReply(true).build());
        Message target = Message.builder(2).requestId(200).expectsReply(true).build();
        queue.append(target);
        awaitCondition(() -> queue.inFlightCount() == 2 && !queue.isBusy());

        Optional<Message> found = queue.completedCustomSearch(
                (m, requestId) -> m.requestId() == requestId, 200L);

        assertSame(target, found.orElseThrow());
        assertEquals(1, queue.inFlightCount());
        assertTrue(queue.completedCustomSearch((m, arg) -> false, null).isEmpty());
        assertTrue(queue.completedCustomSearch(null, null).isEmpty());
    }

    @Test
    void replyDuringProcessingTakesOwnershipFromWorker() throws Exception {
        queue = newQueue(1, 30);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        delegate.processor = m -> {
            entered.countDown();
            await(release);
            return ProcessResult.SEND_FAILURE;
        };
        queue.startWorker();
        Message m = Message.builder(11).expectsReply(true).numRetries(0).build();

        queue.append(m);
        assertTrue(entered.await(3, TimeUnit.SECONDS));
        Optional<Message> completed = queue.completed(11, "fast reply");
        release.countDown();

        assertSame(m, completed.orElseThrow());
        assertNull(delegate.nextNotification(1));
        assertEquals(1, delegate.processCount(m));
        assertFalse(queue.containsMessage(m));
    }

    // ── Remove and clear ────────────────────────────────────────────

    @Test
    void removePendingMessageNotifiesRemove() throws Exception {
        queue = newQueue(1, 30);
        Message m = Message.create(1);
        queue.append(m);

        assertTrue(queue.remove(1));

        RecordingDelegate.Notification n = delegate.nextNotification();
        assertNotNull(n);
        assertSame(m, n.message());
        assertEquals(FailureReason.REMOVE, n.reason());
        assertEquals(0, queue.pendingCount());
        assertEquals(0, queue.admissibleCount());
    }

    @Test
    void removeUnknownIdReturnsFalse() {
        queue = newQueue(1, 30);

        assertFalse(queue.remove(1));
        assertTrue(delegate.notifications.isEmpty());
    }

    @Test
    void removeInFlightMessage() throws Exception {
        queue = newQueue(1, 30);
        Message m = dispatchAwaitingReply(3);

        assertTrue(queue.remove(3));

        assertEquals(FailureReason.REMOVE, delegate.nextNotification().reason());
        assertEquals(0, queue.inFlightCount());
        assertTrue(m.isDestroyed());
    }

    @Test
    void removeWaitsForProcessingToSettle() throws Exception {
        queue = newQueue(1, 30);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        delegate.processor = m -> {
            entered.countDown();
            await(release);
            return ProcessResult.SUCCESS;
        };
        queue.startWorker();
        Message m = Message.builder(1).expectsReply(true).build();
        queue.append(m);
        assertTrue(entered.await(3, TimeUnit.SECONDS));

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> removed = executor.submit(() -> queue.remove(1));
            Thread.sleep(200);
            assertFalse(removed.isDone());
            assertFalse(m.isDestroyed());

            release.countDown();

            assertTrue(removed.get(3, TimeUnit.SECONDS));
            assertEquals(FailureReason.REMOVE, delegate.nextNotification().reason());
            assertEquals(1, delegate.processCount(m));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void clearWaitsForProcessingToSettle() throws Exception {
        queue = newQueue(1, 30);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        delegate.filter = m -> m.id() != 2;
        delegate.processor = m -> {
            entered.countDown();
            await(release);
            return ProcessResult.SUCCESS;
        };
        queue.startWorker();
        Message busy = Message.create(1);
        Message held = Message.create(2);
        queue.append(busy);
        queue.append(held);
        assertTrue(entered.await(3, TimeUnit.SECONDS));

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Integer> cleared = executor.submit(() -> queue.clear());
            Thread.sleep(200);
            assertFalse(cleared.isDone());
            assertTrue(delegate.notifications.isEmpty());
            assertFalse(busy.isDestroyed());

            release.countDown();

            assertEquals(1, cleared.get(3, TimeUnit.SECONDS));
            awaitCondition(() -> delegate.notifications.size() == 2);
        } finally {
            executor.shutdownNow();
        }
        for (RecordingDelegate.Notification n : delegate.notifications) {
            if (n.message() == busy) {
                assertTrue(n.success());
            } else {
                assertSame(held, n.message());
                assertEquals(FailureReason.REMOVE, n.reason());
            }
        }
    }

    @Test
    void removeIsNotStarvedByBackToBackProcessing() throws Exception {
        queue = DeliveryQueue.builder(delegate)
                .idleWaitSecs(1)
                .retryPolicy(RetryPolicy.fixed(0))
                .build();
        CountDownLatch entered = new CountDownLatch(1);
        delegate.processor = m -> {
            entered.countDown();
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ProcessResult.DELAY_SEND;
        };
        queue.startWorker();
        Message m = Message.create(1);
        queue.append(m);
        assertTrue(entered.await(3, TimeUnit.SECONDS));

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> removed = executor.submit(() -> queue.remove(1));
            assertTrue(removed.get(2, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
        RecordingDelegate.Notification n = delegate.nextNotification();
        assertNotNull(n);
        assertSame(m, n.message());
        assertEquals(FailureReason.REMOVE, n.reason());
        assertTrue(m.isDestroyed());
    }

    @Test
    void clearReturnsNumberOfRemovedMessages() throws Exception {
        queue = newQueue(2, 30);
        delegate.filter = m -> m.expectsReply();
        queue.startWorker();
        queue.append(Message.builder(1).expectsReply(true).build());
        awaitCondition(() -> queue.inFlightCount() == 1 && !queue.isBusy());
        queue.append(Message.create(2));
        queue.append(Message.create(3));

        assertEquals(3, queue.clear());

        assertEquals(0, queue.pendingCount());
        assertEquals(0, queue.inFlightCount());
        assertEquals(3, delegate.notifications.size());
        assertEquals(1, delegate.notifications.get(0).message().id());
    }

    // ── containsMessage and iterate ─────────────────────────────────

    @Test
    void containsMessageTracksMembership() throws Exception {
        queue = newQueue(1, 30);
        Message pending = Message.create(1);
        assertFalse(queue.containsMessage(pending));
        assertFalse(queue.containsMessage(null));

        queue.append(pending);
        assertTrue(queue.containsMessage(pending));
        assertFalse(queue.containsMessage(Message.create(1)));

        queue.remove(1);
        assertFalse(queue.containsMessage(pending));

        Message inFlight = dispatchAwaitingReply(2);
        assertTrue(queue.containsMessage(inFlight));
    }

    @Test
    void iterateVisitsScopeInOrderAndStopsEarly() throws Exception {
        queue = newQueue(1, 30);
        delegate.filter = m -> m.id() % 2 == 1;
        for (long id = 1; id <= 4; id++) {
            queue.append(Message.create(id));
        }

        List<Long> all = new ArrayList<>();
        queue.iterate(QueueScope.ALL, m -> all.add(m.id()));
        List<Long> admissible = new ArrayList<>();
        queue.iterate(QueueScope.FILTER, m -> admissible.add(m.id()));
        List<Long> firstTwo = new ArrayList<>();
        queue.iterate(QueueScope.ALL, m -> {
            firstTwo.add(m.id());
            return firstTwo.size() < 2;
        });
        List<Long> sent = new ArrayList<>();
        queue.iterate(QueueScope.SENT, m -> sent.add(m.id()));

        assertEquals(List.of(1L, 2L, 3L, 4L), all);
        assertEquals(List.of(1L, 3L), admissible);
        assertEquals(List.of(1L, 2L), firstTwo);
        assertTrue(sent.isEmpty());
    }

    // ── Tuning ──────────────────────────────────────────────────────

    @Test
    void settersRejectNonPositiveValues() {
        queue = newQueue(3, 20);

        assertFalse(queue.setMaxInFlight(0));
        assertFalse(queue.setTimeoutSecs(0));
        assertEquals(3, queue.getMaxInFlight());
        assertEquals(20, queue.getTimeoutSecs());

        assertTrue(queue.setMaxInFlight(5));
        assertTrue(queue.setTimeoutSecs(60));
        assertEquals(5, queue.getMaxInFlight());
        assertEquals(60, queue.getTimeoutSecs());
    }

    @Test
    void raisingMaxInFlightReleasesWaitingMessages() throws Exception {
        queue = newQueue(1, 30);
        queue.startWorker();
        queue.append(Message.builder(1).expectsReply(true).build());
        queue.append(Message.builder(2).expectsReply(true).build());
        awaitCondition(() -> queue.inFlightCount() == 1 && !queue.isBusy());

        queue.setMaxInFlight(2);

        awaitCondition(() -> queue.inFlightCount() == 2);
        assertEquals(2, delegate.processed.size());
    }

    // ── Concurrency ─────────────────────────────────────────────────

    @Test
    void everyMessageGetsExactlyOneDisposition() throws Exception {
        Map<Message, AtomicInteger> dispositions = new ConcurrentHashMap<>();
        DeliveryDelegate counting = new DeliveryDelegate() {
            @Override
            public boolean filter(Message message) {
                return message.id() % 7 != 0;
            }

            @Override
            public ProcessResult process(Message message) {
                int roll = ThreadLocalRandom.current().nextInt(10);
                if (roll < 5) {
                    return ProcessResult.SUCCESS;
                }
                if (roll < 7) {
                    return ProcessResult.SEND_FAILURE;
                }
                if (roll < 8) {
                    return ProcessResult.DELAY_SEND;
                }
                if (roll < 9) {
                    return ProcessResult.SUCCESS_HANDLED;
                }
                return ProcessResult.INVALID;
            }

            @Override
            public void notify(Message message, boolean success, FailureReason reason) {
                dispositions.get(message).incrementAndGet();
                message.destroy();
            }
        };
        queue = DeliveryQueue.builder(counting)
                .maxInFlight(4)
                .timeoutSecs(1)
                .idleWaitSecs(1)
                .retryPolicy(RetryPolicy.fixed(0))
                .build();
        queue.startWorker();

        int producers = 4;
        int perProducer = 200;
        AtomicLong ids = new AtomicLong();
        ExecutorService executor = Executors.newFixedThreadPool(producers + 2);
        List<Future<?>> futures = new ArrayList<>();
        for (int p = 0; p < producers; p++) {
            futures.add(executor.submit(() -> {
                for (int i = 0; i < perProducer; i++) {
                    Message m = Message.builder(ids.incrementAndGet())
                            .expectsReply(i % 2 == 0)
                            .numRetries(1)
                            .build();
                    dispositions.put(m, new AtomicInteger());
                    queue.append(m);
                }
            }));
        }
        futures.add(executor.submit(() -> {
            for (int i = 0; i < 300; i++) {
                long id = ThreadLocalRandom.current().nextLong(1, producers * perProducer + 1);
                queue.completed(id, "ack").ifPresent(m -> {
                    dispositions.get(m).incrementAndGet();
                    m.destroy();
                });
            }
        }));
        futures.add(executor.submit(() -> {
            for (int i = 0; i < 100; i++) {
                queue.remove(ThreadLocalRandom.current().nextLong(1, producers * perProducer + 1));
                if (i % 40 == 39) {
                    queue.clear();
                }
            }
        }));
        for (Future<?> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        queue.close();

        assertEquals(producers * perProducer, dispositions.size());
        dispositions.forEach((m, count) ->
                assertEquals(1, count.get(), "dispositions for " + m));
    }

    // ── Helpers ─────────────────────────────────────────────────────

    private DeliveryQueue newQueue(int maxInFlight, int timeoutSecs) {
        return DeliveryQueue.builder(delegate)
                .maxInFlight(maxInFlight)
                .timeoutSecs(timeoutSecs)
                .idleWaitSecs(1)
                .retryPolicy(RetryPolicy.fixed(10))
                .build();
    }

    private Message dispatchAwaitingReply(long id) throws InterruptedException {
        queue.startWorker();
        Message m = Message.builder(id).expectsReply(true).build();
        queue.append(m);
        awaitCondition(() -> m.slot() == MessageSlot.IN_FLIGHT && !queue.isBusy());
        return m;
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("latch not released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }
}
