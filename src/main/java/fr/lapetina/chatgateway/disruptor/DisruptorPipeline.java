package fr.lapetina.chatgateway.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.chatgateway.disruptor.exception.BackpressureException;
import fr.lapetina.chatgateway.disruptor.handlers.CompletionHandler;
import fr.lapetina.chatgateway.disruptor.handlers.DispatchHandler;
import fr.lapetina.chatgateway.disruptor.handlers.MetricsHandler;
import fr.lapetina.chatgateway.disruptor.handlers.TranslationHandler;
import fr.lapetina.chatgateway.disruptor.handlers.ValidationHandler;
import fr.lapetina.chatgateway.dispatch.DispatchResult;
import fr.lapetina.chatgateway.dispatch.Dispatcher;
import fr.lapetina.chatgateway.domain.event.ChatRequestEvent;
import fr.lapetina.chatgateway.domain.event.ChatRequestEventFactory;
import fr.lapetina.chatgateway.domain.model.ChatRequest;
import fr.lapetina.chatgateway.domain.model.ErrorKind;
import fr.lapetina.chatgateway.domain.translate.RequestTranslator;
import fr.lapetina.chatgateway.infrastructure.config.GatewayConfig;
import fr.lapetina.chatgateway.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Intake pipeline for chat requests, built on the LMAX Disruptor.
 *
 * Handlers run in sequence: validation, translation, dispatch hand-off,
 * metrics, completion. The ring buffer is pre-allocated and bounded, so a
 * burst beyond its capacity is rejected immediately with a
 * {@link BackpressureException} instead of queueing without limit.
 *
 * PRODUCER TYPE: MULTI, since every HTTP handler thread publishes directly.
 *
 * WAIT STRATEGY: configurable. {@code blocking} (default) is CPU friendly;
 * {@code yielding} and {@code busy-spin} trade CPU for latency.
 *
 * Upstream calls never run on the consumer threads: the dispatch stage hands
 * each request to a {@code dispatch-worker} thread and moves on.
 */
public final class DisruptorPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DisruptorPipeline.class);

    private final Disruptor<ChatRequestEvent> disruptor;
    private final RingBuffer<ChatRequestEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final ExecutorService workerExecutor;
    private final boolean ownsWorkerExecutor;

    private DisruptorPipeline(Builder builder) {
        ThreadFactory threadFactory = new NamedThreadFactory("disruptor-handler", false);
        WaitStrategy waitStrategy = createWaitStrategy(builder.waitStrategy);

        this.disruptor = new Disruptor<>(
                new ChatRequestEventFactory(),
                builder.ringBufferSize,
                threadFactory,
                ProducerType.MULTI,
                waitStrategy
        );

        this.ownsWorkerExecutor = builder.workerExecutor == null;
        this.workerExecutor = ownsWorkerExecutor
                ? Executors.newCachedThreadPool(new NamedThreadFactory("dispatch-worker", true))
                : builder.workerExecutor;

        ValidationHandler validationHandler = new ValidationHandler(builder.maxPromptLength);
        TranslationHandler translationHandler = new TranslationHandler(builder.translator);
        DispatchHandler dispatchHandler = new DispatchHandler(builder.dispatcher, workerExecutor, builder.metricsRegistry);
        MetricsHandler metricsHandler = new MetricsHandler(builder.metricsRegistry);
        CompletionHandler completionHandler = new CompletionHandler();

        // Order: Validation -> Translation -> Dispatch -> Metrics -> Completion
        disruptor
                .handleEventsWith(validationHandler)
                .then(translationHandler)
                .then(dispatchHandler)
                .then(metricsHandler)
                .then(completionHandler);

        disruptor.setDefaultExceptionHandler(new DisruptorExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("DisruptorPipeline created: ringBufferSize={}, waitStrategy={}",
                builder.ringBufferSize, builder.waitStrategy);
    }

    /**
     * Starts the Disruptor processing.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("DisruptorPipeline started");
        }
    }

    /**
     * Submits a request for processing.
     *
     * @param request The chat request
     * @return future completed with the dispatch result; never completed exceptionally
     *         except by an internal handler failure
     * @throws BackpressureException if the ring buffer is full or the pipeline is stopped
     */
    public CompletableFuture<DispatchResult> submit(ChatRequest request) {
        if (!running.get()) {
            throw new BackpressureException(BackpressureException.BackpressureReason.PIPELINE_STOPPED);
        }

        CompletableFuture<DispatchResult> resultFuture = new CompletableFuture<>();

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            throw new BackpressureException(
                    BackpressureException.BackpressureReason.RING_BUFFER_FULL,
                    "Ring buffer full, remaining capacity: " + ringBuffer.remainingCapacity()
            );
        }

        try {
            ChatRequestEvent event = ringBuffer.get(sequence);
            event.initialize(request, resultFuture);
        } finally {
            ringBuffer.publish(sequence);
        }

        log.debug("Request submitted: requestId={}, sequence={}", request.requestId(), sequence);

        return resultFuture;
    }

    /**
     * Returns current ring buffer remaining capacity.
     */
    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Gracefully shuts down the pipeline.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down DisruptorPipeline...");
            try {
                disruptor.shutdown(30, TimeUnit.SECONDS);
                log.info("DisruptorPipeline shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("DisruptorPipeline shutdown timed out, halting...");
                disruptor.halt();
            }
        }
        if (ownsWorkerExecutor) {
            workerExecutor.shutdown();
            try {
                if (!workerExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                    workerExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                workerExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Thread factory naming its threads {@code <prefix>-<n>}.
     */
    static final class NamedThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final boolean daemon;
        private final AtomicInteger counter = new AtomicInteger(0);

        NamedThreadFactory(String namePrefix, boolean daemon) {
            this.namePrefix = namePrefix;
            this.daemon = daemon;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(daemon);
            return t;
        }
    }

    /**
     * Exception handler for Disruptor.
     */
    private static class DisruptorExceptionHandler implements ExceptionHandler<ChatRequestEvent> {

        private static final Logger log = LoggerFactory.getLogger(DisruptorExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, ChatRequestEvent event) {
            log.error("Exception in event handler: sequence={}, event={}", sequence, event, ex);

            CompletableFuture<DispatchResult> future = event.getResultFuture();
            if (future != null && !future.isDone()) {
                future.complete(DispatchResult.rejected(ErrorKind.INTERNAL_ERROR, "Internal error: " + ex.getMessage()));
            }
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during Disruptor start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during Disruptor shutdown", ex);
        }
    }

    /**
     * Builder for DisruptorPipeline.
     */
    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private int maxPromptLength = 100_000;
        private RequestTranslator translator;
        private Dispatcher dispatcher;
        private MetricsRegistry metricsRegistry;
        private ExecutorService workerExecutor;

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder maxPromptLength(int maxLength) {
            this.maxPromptLength = maxLength;
            return this;
        }

        public Builder translator(RequestTranslator translator) {
            this.translator = translator;
            return this;
        }

        public Builder dispatcher(Dispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        /**
         * Executor running the dispatches. When not set, the pipeline creates
         * and owns a cached pool.
         */
        public Builder workerExecutor(ExecutorService executor) {
            this.workerExecutor = executor;
            return this;
        }

        public Builder fromConfig(GatewayConfig config) {
            ringBufferSize(config.getDisruptor().getRingBufferSize());
            this.waitStrategy = config.getDisruptor().getWaitStrategy();
            this.maxPromptLength = config.getValidation().getMaxPromptLength();
            return this;
        }

        public DisruptorPipeline build() {
            if (translator == null) {
                throw new IllegalStateException("RequestTranslator is required");
            }
            if (dispatcher == null) {
                throw new IllegalStateException("Dispatcher is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new DisruptorPipeline(this);
        }
    }
}
