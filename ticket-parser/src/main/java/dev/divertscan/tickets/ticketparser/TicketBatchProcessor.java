package dev.divertscan.tickets.ticketparser;

import dev.divertscan.tickets.model.TicketExtractionResult;
import dev.divertscan.tickets.model.TicketSource;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@link TicketExtractionEngine} over a list of images with a bounded number of tickets in
 * flight. Results come back in input order and a failing ticket never fails the batch.
 *
 * <p>The processor owns its executor and shuts it down on {@link #close()}.
 */
public class TicketBatchProcessor implements AutoCloseable {

    public static final int DEFAULT_CONCURRENCY = 3;

    private static final Logger LOGGER = LoggerFactory.getLogger(TicketBatchProcessor.class);

    private final TicketExtractionEngine engine;
    private final ExecutorService executor;
    private final int defaultConcurrency;

    public TicketBatchProcessor(TicketExtractionEngine engine, ExecutorService executor) {
        this(engine, executor, DEFAULT_CONCURRENCY);
    }

    public TicketBatchProcessor(TicketExtractionEngine engine, ExecutorService executor, int defaultConcurrency) {
        if (defaultConcurrency < 1) {
            throw new IllegalArgumentException("defaultConcurrency must be at least 1 but was " + defaultConcurrency);
        }
        this.engine = Objects.requireNonNull(engine, "engine");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.defaultConcurrency = defaultConcurrency;
    }

    public int defaultConcurrency() {
        return defaultConcurrency;
    }

    public List<TicketExtractionResult> processBatch(List<TicketImage> images) {
        return processBatch(images, null, defaultConcurrency);
    }

    public List<TicketExtractionResult> processBatch(List<TicketImage> images, TicketSource sourceHint) {
        return processBatch(images, sourceHint, defaultConcurrency);
    }

    /**
     * Extracts every image, at most {@code concurrency} at a time.
     *
     * @return one result per image, in input order; failed tickets carry a zero-confidence result
     *     with a note naming the error
     */
    public List<TicketExtractionResult> processBatch(List<TicketImage> images, TicketSource sourceHint,
        int concurrency) {

        if (images == null) {
            throw new IllegalArgumentException("images must not be null");
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1 but was " + concurrency);
        }
        if (images.isEmpty()) {
            return List.of();
        }

        LOGGER.info("Processing batch of {} ticket(s) with concurrency {}", images.size(), concurrency);
        Semaphore gate = new Semaphore(concurrency);
        List<CompletableFuture<TicketExtractionResult>> slots = new ArrayList<>(images.size());
        for (int index = 0; index < images.size(); index++) {
            try {
                gate.acquire();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                slots.add(CompletableFuture.completedFuture(failure(index, ex, "Interrupted before extraction started")));
                continue;
            }
            int position = index;
            TicketImage image = images.get(index);
            Supplier<TicketExtractionResult> task = TicketProcessingMdc.propagate(() -> {
                try {
                    return processItem(position, image, sourceHint);
                } finally {
                    gate.release();
                }
            });
            try {
                slots.add(CompletableFuture.supplyAsync(task, executor));
            } catch (RejectedExecutionException ex) {
                gate.release();
                slots.add(CompletableFuture.completedFuture(failure(index, ex, ex.getMessage())));
            }
        }

        List<TicketExtractionResult> results = new ArrayList<>(slots.size());
        for (CompletableFuture<TicketExtractionResult> slot : slots) {
            results.add(slot.join());
        }
        long failed = results.stream().filter(result -> result.populatedFieldCount() == 0).count();
        LOGGER.info("Finished batch of {} ticket(s), {} without extracted fields", results.size(), failed);
        return Collections.unmodifiableList(results);
    }

    @Override
    public void close() {
        executor.shutdown();
    }

    private TicketExtractionResult processItem(int index, TicketImage image, TicketSource sourceHint) {
        TicketProcessingMdc.setBatchIndex(index);
        try {
            if (image == null) {
                throw new IllegalArgumentException("Ticket image is missing");
            }
            return engine.process(image, sourceHint, true);
        } catch (RuntimeException ex) {
            return failure(index, ex, describe(ex));
        }
    }

    private static TicketExtractionResult failure(int index, Exception ex, String message) {
        LOGGER.warn("Batch item {} failed: {}", index, message, ex);
        return TicketExtractionResult.failed("Extraction failed: " + message);
    }

    private static String describe(RuntimeException ex) {
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }
}
