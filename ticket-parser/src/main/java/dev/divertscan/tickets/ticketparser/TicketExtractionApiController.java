package dev.divertscan.tickets.ticketparser;

import dev.divertscan.tickets.materials.MaterialClassification;
import dev.divertscan.tickets.materials.MaterialClassifier;
import dev.divertscan.tickets.model.TicketExtractionResult;
import dev.divertscan.tickets.model.TicketSource;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

/**
 * REST API for ad-hoc ticket extraction. Uploaded photos are run through the extraction engine
 * and the structured result is returned without being stored.
 */
@RestController
public class TicketExtractionApiController {

    private static final Logger LOGGER = LoggerFactory.getLogger(TicketExtractionApiController.class);

    private static final Map<String, String> IMAGE_EXTENSIONS = Map.of(
        "jpg", "image/jpeg",
        "jpeg", "image/jpeg",
        "png", "image/png",
        "gif", "image/gif",
        "webp", "image/webp");

    private final TicketExtractionEngine engine;
    private final TicketBatchProcessor batchProcessor;

    public TicketExtractionApiController(TicketExtractionEngine engine, TicketBatchProcessor batchProcessor) {
        this.engine = engine;
        this.batchProcessor = batchProcessor;
    }

    @GetMapping(path = "/api/tickets/sources", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<SourceDescriptor> listSources() {
        return Arrays.stream(TicketSource.values())
            .filter(TicketSource::isAutomatic)
            .map(source -> new SourceDescriptor(source.code(), source.displayName()))
            .toList();
    }

    @PostMapping(path = "/api/tickets/extract", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> extractTicket(@RequestPart("file") MultipartFile file,
        @RequestParam(name = "source", required = false) String source,
        @RequestParam(name = "autoDetect", defaultValue = "true") boolean autoDetect) throws IOException {

        TicketSource sourceHint = resolveSource(source);
        String mimeType = requireImage(file);
        LOGGER.info("Extracting ticket '{}' (source hint: {}, autoDetect: {})", file.getOriginalFilename(),
            sourceHint != null ? sourceHint.code() : "(none)", autoDetect);

        TicketExtractionResult result = engine.process(file.getBytes(), mimeType, sourceHint, autoDetect);
        LOGGER.info("Extracted {} field(s) with overall confidence {}", result.populatedFieldCount(),
            result.overallConfidence());
        return result.toMap();
    }

    @PostMapping(path = "/api/tickets/extract/batch", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public List<Map<String, Object>> extractBatch(@RequestPart("files") List<MultipartFile> files,
        @RequestParam(name = "source", required = false) String source,
        @RequestParam(name = "concurrency", required = false) Integer concurrency) throws IOException {

        TicketSource sourceHint = resolveSource(source);
        int resolvedConcurrency = concurrency != null ? concurrency : batchProcessor.defaultConcurrency();
        if (resolvedConcurrency < 1) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "concurrency must be at least 1");
        }
        // unusable uploads keep their position as failed entries instead of rejecting the batch
        List<TicketImage> images = new ArrayList<>(files.size());
        List<Integer> positions = new ArrayList<>(files.size());
        TicketExtractionResult[] results = new TicketExtractionResult[files.size()];
        for (int i = 0; i < files.size(); i++) {
            MultipartFile file = files.get(i);
            String rejection = rejectionReason(file);
            if (rejection != null) {
                LOGGER.warn("Skipping batch upload {} ('{}'): {}", i,
                    file != null ? file.getOriginalFilename() : null, rejection);
                results[i] = TicketExtractionResult.failed("Extraction failed: " + rejection);
                continue;
            }
            images.add(new TicketImage(file.getBytes(), imageMimeType(file)));
            positions.add(i);
        }

        LOGGER.info("Extracting batch of {} ticket(s) with concurrency {} ({} rejected upload(s))", images.size(),
            resolvedConcurrency, files.size() - images.size());
        List<TicketExtractionResult> extracted = images.isEmpty()
            ? List.of()
            : batchProcessor.processBatch(images, sourceHint, resolvedConcurrency);
        for (int i = 0; i < extracted.size(); i++) {
            results[positions.get(i)] = extracted.get(i);
        }
        return Arrays.stream(results)
            .map(TicketExtractionResult::toMap)
            .toList();
    }

    @PostMapping(path = "/api/materials/classify", consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public ClassificationResponse classifyMaterial(@RequestBody ClassificationRequest request) {
        MaterialClassification classification = MaterialClassifier.classify(request != null ? request.description() : null);
        return new ClassificationResponse(classification.materialType().code(),
            classification.materialType().displayName(), classification.confidence());
    }

    @ExceptionHandler(TicketExtractionException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleExtractionException(TicketExtractionException exception) {
        LOGGER.warn("Ticket extraction failed: {}", exception.getMessage());
        return Map.of("error", exception.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidArgument(IllegalArgumentException exception) {
        LOGGER.warn("Rejected ticket request: {}", exception.getMessage());
        return Map.of("error", exception.getMessage());
    }

    private static TicketSource resolveSource(String source) {
        if (!StringUtils.hasText(source)) {
            return null;
        }
        TicketSource resolved = TicketSource.fromCode(source)
            .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown ticket source: " + source));
        if (!resolved.isAutomatic()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "Ticket source '" + resolved.code() + "' cannot be extracted automatically");
        }
        return resolved;
    }

    private static String requireImage(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "A non-empty image must be provided as the 'file' part");
        }
        String mimeType = imageMimeType(file);
        if (mimeType == null) {
            throw new ResponseStatusException(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Only image uploads are supported");
        }
        return mimeType;
    }

    private static String rejectionReason(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            return "Uploaded file is empty";
        }
        return imageMimeType(file) == null ? "Only image uploads are supported" : null;
    }

    private static String imageMimeType(MultipartFile file) {
        String contentType = file.getContentType();
        if (StringUtils.hasText(contentType)) {
            String normalised = contentType.toLowerCase(Locale.ROOT);
            if (normalised.startsWith("image/")) {
                return normalised;
            }
        }
        String extension = StringUtils.getFilenameExtension(file.getOriginalFilename());
        return extension != null ? IMAGE_EXTENSIONS.get(extension.toLowerCase(Locale.ROOT)) : null;
    }

    public record SourceDescriptor(String code, String displayName) { }

    public record ClassificationRequest(String description) { }

    public record ClassificationResponse(String materialType, String displayName, double confidence) { }
}
