package courier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Configurable delegate that records every filter, process and notify call.
 */
class RecordingDelegate implements DeliveryDelegate {

    record Notification(Message message, boolean success, FailureReason reason) {
    }

    volatile Predicate<Message> filter = m -> true;
    volatile Function<Message, ProcessResult> processor = m -> ProcessResult.SUCCESS;
    volatile Predicate<Object> removalCheck = null;

    final List<Message> processed = new CopyOnWriteArrayList<>();
    final List<Notification> notifications = new CopyOnWriteArrayList<>();
    private final LinkedBlockingQueue<Notification> notified = new LinkedBlockingQueue<>();

    @Override
    public boolean filter(Message message) {
        return filter.test(message);
    }

    @Override
    public ProcessResult process(Message message) {
        processed.add(message);
        return processor.apply(message);
    }

    @Override
    public void notify(Message message, boolean success, FailureReason reason) {
        message.destroy();
        Notification n = new Notification(message, success, reason);
        notifications.add(n);
        notified.add(n);
    }

    @Override
    public boolean canBeRemovedFromSentQueue(Message message, Object payload) {
        Predicate<Object> check = removalCheck;
        return check == null ? DeliveryDelegate.super.canBeRemovedFromSentQueue(message, payload)
                : check.test(payload);
    }

    /** Waits up to three seconds for the next notification; {@code null} on timeout. */
    Notification nextNotification() throws InterruptedException {
        return nextNotification(3);
    }

    Notification nextNotification(long timeoutSecs) throws InterruptedException {
        return notified.poll(timeoutSecs, TimeUnit.SECONDS);
    }

    long processCount(Message message) {
        return processed.stream().filter(m -> m == message).count();
    }
}
