package io.carelink.a2a.server.streaming;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

import io.carelink.a2a.server.tasks.IllegalTaskStateTransitionException;
import io.carelink.a2a.server.tasks.TaskManager;
import io.carelink.a2a.server.util.MessageUtils;
import io.carelink.a2a.spec.Message;
import io.carelink.a2a.spec.StreamingEventKind;
import io.carelink.a2a.spec.Task;
import io.carelink.a2a.spec.TaskStatusUpdateEvent;
import io.carelink.a2a.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes the events of one streamed request.
 * <p>
 * The first event is the {@link Task} snapshot in state {@code working}. Each configured stage
 * then yields a non-final {@link TaskStatusUpdateEvent} carrying the stage's progress message,
 * and the stream ends with exactly one final status update produced by the completion
 * function, which runs the agent. All events belong to the same task.
 * <p>
 * Events are produced on demand only. The task is created when the first event is requested,
 * so a stream nobody subscribes to leaves nothing behind. Stage delays are scheduled on the
 * executor, never slept. The publisher accepts a single subscriber.
 * <p>
 * A stream that is cancelled or fails before its final event fails the task, so an abandoned
 * stream never leaves a task in {@code working}.
 */
public class StagedStatusPublisher implements Flow.Publisher<StreamingEventKind> {

    private static final Logger LOGGER = LoggerFactory.getLogger(StagedStatusPublisher.class);

    static final String CANCELLED_TEXT = "Stream cancelled before the task finished";
    static final String FAILED_TEXT = "Stream failed before the task finished: ";

    private final TaskManager taskManager;
    private final StreamingStages stages;
    private final Message inbound;
    private final UnaryOperator<Task> completion;
    private final Executor executor;
    private final AtomicBoolean subscribed = new AtomicBoolean();

    /**
     * @param taskManager the lifecycle engine of the agent
     * @param stages the progress stages to report
     * @param inbound the message that was streamed
     * @param completion runs the agent against the working task and returns the terminal task
     * @param executor runs the stages and the completion
     */
    public StagedStatusPublisher(TaskManager taskManager, StreamingStages stages, Message inbound,
                                 UnaryOperator<Task> completion, Executor executor) {
        this.taskManager = Assert.checkNotNullParam("taskManager", taskManager);
        this.stages = Assert.checkNotNullParam("stages", stages);
        this.inbound = Assert.checkNotNullParam("inbound", inbound);
        this.completion = Assert.checkNotNullParam("completion", completion);
        this.executor = Assert.checkNotNullParam("executor", executor);
    }

    @Override
    public void subscribe(Flow.Subscriber<? super StreamingEventKind> subscriber) {
        Assert.checkNotNullParam("subscriber", subscriber);
        if (!subscribed.compareAndSet(false, true)) {
            subscriber.onSubscribe(new Flow.Subscription() {
                @Override
                public void request(long n) {
                }

                @Override
                public void cancel() {
                }
            });
            subscriber.onError(new IllegalStateException("This stream already has a subscriber"));
            return;
        }
        StageSubscription subscription = new StageSubscription(subscriber);
        subscriber.onSubscribe(subscription);
    }

    private final class StageSubscription implements Flow.Subscription {

        private final Flow.Subscriber<? super StreamingEventKind> subscriber;
        private final AtomicLong demand = new AtomicLong();
        private final AtomicBoolean producing = new AtomicBoolean();
        private volatile boolean done;
        // step 0 is the snapshot, steps 1..n the stages, step n + 1 the final update
        private int step;
        private volatile @Nullable Task task;

        StageSubscription(Flow.Subscriber<? super StreamingEventKind> subscriber) {
            this.subscriber = subscriber;
        }

        @Override
        public void request(long n) {
            if (done) {
                return;
            }
            if (n <= 0) {
                fail(new IllegalArgumentException("Demand must be positive, got " + n));
                return;
            }
            demand.getAndUpdate(current -> current + n < 0 ? Long.MAX_VALUE : current + n);
            drain();
        }

        @Override
        public void cancel() {
            if (!done) {
                done = true;
                LOGGER.debug("Stream for task {} cancelled at step {}", task != null ? task.id() : null, step);
                abandon(CANCELLED_TEXT);
            }
        }

        private void drain() {
            if (done || demand.get() == 0 || !producing.compareAndSet(false, true)) {
                return;
            }
            if (step > 0 && step <= stages.size() && !stages.stageDelay().isZero()) {
                // the delayer thread only hands the step over to the executor
                Executor delayer = CompletableFuture.delayedExecutor(stages.stageDelay().toMillis(), TimeUnit.MILLISECONDS);
                try {
                    delayer.execute(this::submit);
                } catch (RuntimeException e) {
                    producing.set(false);
                    fail(e);
                }
            } else {
                submit();
            }
        }

        private void submit() {
            try {
                executor.execute(this::produceNext);
            } catch (RuntimeException e) {
                producing.set(false);
                fail(e);
            }
        }

        private void produceNext() {
            try {
                if (done) {
                    return;
                }
                StreamingEventKind event = nextEvent();
                if (done) {
                    // cancelled while the event was produced
                    abandon(CANCELLED_TEXT);
                    return;
                }
                demand.decrementAndGet();
                subscriber.onNext(event);
                if (event instanceof TaskStatusUpdateEvent update && update.isFinal()) {
                    done = true;
                    subscriber.onComplete();
                }
            } catch (Throwable t) {
                fail(t);
            } finally {
                producing.set(false);
            }
            drain();
        }

        private StreamingEventKind nextEvent() {
            int current = step++;
            if (current == 0) {
                Task created = taskManager.createTask(inbound);
                task = taskManager.startWork(created);
                return task;
            }
            Task working = Assert.checkNotNullParam("task", task);
            if (current <= stages.size()) {
                String description = stages.descriptions().get(current - 1);
                Message progress = MessageUtils.newAgentTextMessage(description, working.contextId(), working.id());
                task = taskManager.startWork(working, progress);
                return TaskStatusUpdateEvent.of(task, false);
            }
            task = completion.apply(working);
            return TaskStatusUpdateEvent.of(task, true);
        }

        private void fail(Throwable t) {
            if (done) {
                return;
            }
            done = true;
            LOGGER.warn("Stream for task {} failed", task != null ? task.id() : null, t);
            abandon(FAILED_TEXT + (t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName()));
            subscriber.onError(t);
        }

        private void abandon(String reason) {
            Task current = task;
            if (current == null) {
                return;
            }
            Task stored = taskManager.getTask(current.id());
            if (stored != null && stored.status().state().isFinal()) {
                return;
            }
            try {
                taskManager.failTask(current, reason);
            } catch (IllegalTaskStateTransitionException e) {
                // the agent finished the task concurrently
                LOGGER.debug("Task {} already finished: {}", current.id(), e.getMessage());
            } catch (RuntimeException e) {
                LOGGER.warn("Could not fail abandoned task {}", current.id(), e);
            }
        }
    }
}
