package dev.divertscan.tickets.ticketparser;

import dev.divertscan.tickets.model.TicketExtractionResult;
import dev.divertscan.tickets.model.TicketSource;
import dev.divertscan.tickets.ticketparser.AttemptOutcome.Done;
import dev.divertscan.tickets.ticketparser.AttemptOutcome.Failed;
import dev.divertscan.tickets.ticketparser.AttemptOutcome.Retry;
import dev.divertscan.tickets.ticketparser.AttemptOutcome.RetryState;
import dev.divertscan.tickets.ticketparser.detection.SourceDetection;
import dev.divertscan.tickets.ticketparser.detection.TicketSourceDetector;
import dev.divertscan.tickets.ticketparser.extraction.TicketExtractor;
import dev.divertscan.tickets.ticketparser.extraction.TicketExtractors;
import dev.divertscan.tickets.ticketparser.provider.VisionProvider;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the ticket extraction pipeline. Resolves the ticket layout, picks the matching
 * extractor and runs it under a confidence-gated retry policy.
 *
 * <p>Low-confidence results are returned with explanatory notes once attempts run out; only
 * repeated provider or parsing errors end in a {@link TicketExtractionException}.
 *
 * <p>The provider and the per-source extractors are created lazily and shared by concurrent
 * callers. {@link #switchProvider(VisionProvider)} replaces the provider and drops the cached
 * extractors; calls already running finish on the provider they started with.
 */
public class TicketExtractionEngine implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TicketExtractionEngine.class);

    private final Supplier<VisionProvider> providerFactory;
    private final ExtractionPolicy policy;
    private final BackoffSleeper sleeper;
    private final Object bindingLock = new Object();

    private volatile ProviderBinding binding;
    private volatile boolean closed;

    public TicketExtractionEngine(Supplier<VisionProvider> providerFactory, ExtractionPolicy policy) {
        this(providerFactory, policy, BackoffSleeper.THREAD_SLEEP);
    }

    public TicketExtractionEngine(Supplier<VisionProvider> providerFactory, ExtractionPolicy policy,
        BackoffSleeper sleeper) {
        this.providerFactory = Objects.requireNonNull(providerFactory, "providerFactory");
        this.policy = policy != null ? policy : ExtractionPolicy.defaults();
        this.sleeper = sleeper != null ? sleeper : BackoffSleeper.THREAD_SLEEP;
    }

    /**
     * Extracts a ticket, detecting its layout automatically.
     */
    public TicketExtractionResult process(byte[] image, String mimeType) {
        return process(image, mimeType, null, true);
    }

    public TicketExtractionResult process(TicketImage image, TicketSource sourceHint, boolean autoDetect) {
        Objects.requireNonNull(image, "image");
        return process(image.data(), image.mimeType(), sourceHint, autoDetect);
    }

    /**
     * Extracts a ticket.
     *
     * @param image      raw image bytes
     * @param mimeType   image MIME type, {@code image/jpeg} when blank
     * @param sourceHint layout to use without detection; must be an automatic source when given
     * @param autoDetect whether to detect the layout when no hint is given; generic otherwise
     * @return the accepted result, or the last result with a low-confidence note
     * @throws TicketExtractionException when every attempt failed with an error
     */
    public TicketExtractionResult process(byte[] image, String mimeType, TicketSource sourceHint,
        boolean autoDetect) {

        if (image == null || image.length == 0) {
            throw new IllegalArgumentException("Cannot extract a ticket from an empty image");
        }
        if (sourceHint != null && !sourceHint.isAutomatic()) {
            throw new IllegalArgumentException("Source '" + sourceHint.code() + "' is not extracted automatically");
        }
        String resolvedMimeType = mimeType != null && !mimeType.isBlank() ? mimeType : TicketImage.DEFAULT_MIME_TYPE;

        ProviderBinding current = acquireBinding();
        try (TicketProcessingMdc.Context ignored = TicketProcessingMdc.open(UUID.randomUUID().toString())) {
            List<String> notes = new ArrayList<>();
            TicketSource source = resolveSource(current, image, resolvedMimeType, sourceHint, autoDetect, notes);
            TicketProcessingMdc.setSource(source);
            LOGGER.info("Extracting {} ticket ({} bytes, {})", source.code(), image.length, resolvedMimeType);
            return runAttempts(current.extractor(source), image, resolvedMimeType, RetryState.initial(notes));
        } finally {
            current.release();
        }
    }

    /**
     * Replaces the vision provider. Cached extractors are dropped and the previous provider is
     * closed as soon as no running call uses it.
     */
    public void switchProvider(VisionProvider provider) {
        Objects.requireNonNull(provider, "provider");
        ProviderBinding previous;
        synchronized (bindingLock) {
            ensureOpen();
            previous = binding;
            binding = new ProviderBinding(provider);
        }
        LOGGER.info("Switched vision provider to {}", provider.type().id());
        if (previous != null) {
            previous.retire(previous.provider != provider);
        }
    }

    @Override
    public void close() {
        ProviderBinding previous;
        synchronized (bindingLock) {
            closed = true;
            previous = binding;
            binding = null;
        }
        if (previous != null) {
            previous.retire(true);
        }
    }

    Set<TicketSource> cachedExtractorSources() {
        ProviderBinding current = binding;
        return current != null ? Set.copyOf(current.extractors.keySet()) : Set.of();
    }

    private TicketExtractionResult runAttempts(TicketExtractor extractor, byte[] image, String mimeType,
        RetryState initial) {

        RetryState state = initial;
        while (true) {
            TicketProcessingMdc.setAttempt(state.attempt());
            AttemptOutcome outcome = attempt(state, extractor, image, mimeType);
            if (outcome instanceof Done done) {
                return done.result();
            }
            if (outcome instanceof Failed failed) {
                LOGGER.error("Ticket extraction failed after {} attempt(s)", failed.error().getAttempts(),
                    failed.error().getCause());
                throw failed.error();
            }
            Retry retry = (Retry) outcome;
            backOff(retry.backoff(), retry.next().lastError());
            state = retry.next();
        }
    }

    /**
     * One step of the retry loop: runs the extractor once and decides what happens next.
     */
    AttemptOutcome attempt(RetryState state, TicketExtractor extractor, byte[] image, String mimeType) {
        int attempt = state.attempt();
        int maxRetries = policy.maxRetries();
        boolean attemptsRemain = attempt < maxRetries;

        TicketExtractionResult result;
        try {
            result = extractor.extract(image, mimeType);
        } catch (RuntimeException ex) {
            LOGGER.warn("Extraction attempt {} of {} failed: {}", attempt, maxRetries, ex.getMessage());
            if (attemptsRemain) {
                String note = format("Attempt %d of %d failed: %s", attempt, maxRetries, ex.getMessage());
                return new Retry(state.next(note, ex), policy.backoffAfter(attempt));
            }
            return new Failed(new TicketExtractionException(
                format("Ticket extraction failed after %d attempts: %s", maxRetries, ex.getMessage()), ex, attempt));
        }

        double confidence = result.overallConfidence();
        if (confidence >= policy.confidenceThreshold()) {
            LOGGER.info("Accepted extraction on attempt {} with confidence {}", attempt, format("%.2f", confidence));
            return new Done(result.withLeadingNotes(state.notes()));
        }
        if (attemptsRemain) {
            LOGGER.info("Extraction confidence {} below threshold {} on attempt {}, retrying",
                format("%.2f", confidence), policy.confidenceThreshold(), attempt);
            String note = format("Low confidence (%.2f) on attempt %d of %d, retrying", confidence, attempt, maxRetries);
            return new Retry(state.next(note, null), Duration.ZERO);
        }
        LOGGER.warn("Returning low confidence extraction ({}) after {} attempts", format("%.2f", confidence), maxRetries);
        return new Done(result.withLeadingNotes(state.notes())
            .withAdditionalNotes(List.of(format("Low confidence (%.2f) after %d attempts", confidence, maxRetries))));
    }

    private TicketSource resolveSource(ProviderBinding current, byte[] image, String mimeType, TicketSource sourceHint,
        boolean autoDetect, List<String> notes) {

        if (sourceHint != null) {
            return sourceHint;
        }
        if (!autoDetect) {
            return TicketSource.GENERIC_DIGITAL;
        }
        SourceDetection detection = current.detector.detect(image, mimeType);
        if (detection.isFallback()) {
            notes.add("Source detection fell back to " + detection.source().code() + ": " + detection.fallbackReason());
        } else {
            notes.add(format("Detected source %s (confidence %.2f)", detection.source().code(), detection.confidence()));
        }
        return detection.source();
    }

    private void backOff(Duration backoff, RuntimeException lastError) {
        if (backoff.isZero()) {
            return;
        }
        LOGGER.info("Backing off for {} ms before the next attempt", backoff.toMillis());
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            TicketExtractionException interrupted =
                new TicketExtractionException("Interrupted while waiting to retry ticket extraction", ex);
            if (lastError != null) {
                interrupted.addSuppressed(lastError);
            }
            throw interrupted;
        }
    }

    private ProviderBinding acquireBinding() {
        while (true) {
            ProviderBinding current = binding();
            if (current.tryAcquire()) {
                return current;
            }
        }
    }

    private ProviderBinding binding() {
        ProviderBinding current = binding;
        if (current != null) {
            return current;
        }
        synchronized (bindingLock) {
            ensureOpen();
            if (binding == null) {
                VisionProvider provider;
                try {
                    provider = providerFactory.get();
                } catch (RuntimeException ex) {
                    throw new TicketExtractionException("No usable vision provider: " + ex.getMessage(), ex);
                }
                if (provider == null) {
                    throw new TicketExtractionException("No vision provider configured");
                }
                binding = new ProviderBinding(provider);
            }
            return binding;
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Ticket extraction engine has been closed");
        }
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }

    private static final class ProviderBinding {

        private final VisionProvider provider;
        private final TicketSourceDetector detector;
        private final ConcurrentMap<TicketSource, TicketExtractor> extractors = new ConcurrentHashMap<>();
        private final AtomicInteger inFlight = new AtomicInteger();
        private final AtomicBoolean providerClosed = new AtomicBoolean();

        private volatile boolean retired;
        private volatile boolean closeOnRetire;

        private ProviderBinding(VisionProvider provider) {
            this.provider = provider;
            this.detector = new TicketSourceDetector(provider);
        }

        // a caller that loses the race with retire() backs out and reads the new binding
        private boolean tryAcquire() {
            inFlight.incrementAndGet();
            if (retired) {
                release();
                return false;
            }
            return true;
        }

        private void release() {
            if (inFlight.decrementAndGet() == 0 && retired) {
                closeProvider();
            }
        }

        private void retire(boolean closeProvider) {
            closeOnRetire = closeProvider;
            retired = true;
            if (inFlight.get() == 0) {
                closeProvider();
            }
        }

        private void closeProvider() {
            if (closeOnRetire && providerClosed.compareAndSet(false, true)) {
                LOGGER.debug("Closing retired vision provider");
                provider.close();
            }
        }

        private TicketExtractor extractor(TicketSource source) {
            return extractors.computeIfAbsent(source, key -> TicketExtractors.create(key, provider));
        }
    }
}
