package net.proxymachine.service.fetch;

import net.proxymachine.config.FetchProperties;
import net.proxymachine.exception.FetchBatchValidationException;
import net.proxymachine.exception.RemoteFetchException;
import net.proxymachine.exception.StorageUnavailableException;
import net.proxymachine.model.fetch.FetchEstimate;
import net.proxymachine.model.fetch.FetchJob;
import net.proxymachine.model.fetch.FetchOptions;
import net.proxymachine.model.fetch.FetchResult;
import net.proxymachine.model.fetch.FetchSummary;
import net.proxymachine.support.io.AtomicFileWriter;
import net.proxymachine.support.retry.FetchFailureClassifier;
import net.proxymachine.support.retry.FetchRetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Downloads batches of images with bounded concurrency.
 * <p>
 * Each job streams its body into a temporary sibling and is renamed into place only when
 * complete. Transient failures are retried by the shared {@link FetchRetryPolicy}; every
 * other failure is recorded on the job's result and never affects sibling jobs. Only a
 * malformed batch or an output location without space aborts the whole batch.
 */
@Service
public class FetchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(FetchOrchestrator.class);

    /** Rough size of a full-resolution card PNG, used for pre-flight estimates. */
    static final long AVERAGE_IMAGE_BYTES = 1_200_000L;

    private final WebClient webClient;
    private final FetchRetryPolicy retryPolicy;
    private final FetchProperties properties;

    public FetchOrchestrator(WebClient fetchWebClient, FetchRetryPolicy retryPolicy, FetchProperties properties) {
        this.webClient = fetchWebClient;
        this.retryPolicy = retryPolicy;
        this.properties = properties;
    }

    // ── Entry points ──

    /**
     * Runs the batch with the configured defaults and blocks until it finishes.
     */
    public FetchSummary run(List<FetchJob> jobs) {
        return run(jobs, properties.defaultOptions());
    }

    public FetchSummary run(List<FetchJob> jobs, FetchOptions options) {
        return submit(jobs, options).await();
    }

    /**
     * Validates the batch and starts it in the background.
     *
     * @throws FetchBatchValidationException when jobs are incomplete or destinations collide
     * @throws StorageUnavailableException when the output file store lacks free space
     */
    public FetchBatch submit(List<FetchJob> jobs, FetchOptions options) {
        validate(jobs);

        List<FetchResult> skipped = new ArrayList<>();
        List<FetchJob> pending = new ArrayList<>();
        for (FetchJob job : jobs) {
            if (options.skipExisting() && Files.exists(job.destinationPath())) {
                skipped.add(FetchResult.skipped(job));
            } else {
                pending.add(job);
            }
        }
        if (!pending.isEmpty()) {
            ensureStorage(pending.get(0).destinationPath());
        }

        FetchBatch batch = new FetchBatch(jobs.size());
        long started = System.nanoTime();
        log.info("Starting fetch batch: total={} pending={} skipped={} concurrency={}",
            jobs.size(), pending.size(), skipped.size(), options.concurrency());

        Mono<FetchSummary> pipeline = Flux.fromIterable(pending)
            .takeWhile(job -> !batch.isCancelled())
            .flatMap(this::fetchOne, options.concurrency())
            .collectList()
            .map(completed -> {
                List<FetchResult> all = new ArrayList<>(jobs.size());
                all.addAll(skipped);
                all.addAll(completed);
                Set<FetchJob> finished = new HashSet<>();
                completed.forEach(result -> finished.add(result.job()));
                int cancelled = 0;
                for (FetchJob job : pending) {
                    if (!finished.contains(job)) {
                        all.add(FetchResult.cancelled(job));
                        cancelled++;
                    }
                }
                if (cancelled > 0) {
                    log.warn("Fetch batch cancelled: {} job(s) never started", cancelled);
                }
                return FetchSummary.aggregate(all, Duration.ofNanos(System.nanoTime() - started));
            })
            .doOnNext(summary -> log.info(
                "Fetch batch finished: total={} success={} failed={} skipped={} bytes={} elapsedMs={}",
                summary.totalRequested(), summary.successful(), summary.failed(), summary.skipped(),
                summary.totalBytes(), summary.elapsed().toMillis()));

        batch.start(pipeline);
        return batch;
    }

    /**
     * How much of the batch would download, without touching the network.
     */
    public FetchEstimate estimate(List<FetchJob> jobs, FetchOptions options) {
        int present = 0;
        for (FetchJob job : jobs) {
            if (options.skipExisting() && job.destinationPath() != null && Files.exists(job.destinationPath())) {
                present++;
            }
        }
        int toDownload = jobs.size() - present;
        return new FetchEstimate(jobs.size(), present, toDownload, toDownload * AVERAGE_IMAGE_BYTES);
    }

    // ── Validation ──

    /**
     * Rejects batches that cannot run as a unit: missing jobs, print ids or destinations,
     * and two jobs writing the same file. Source URIs are checked per job at run time.
     */
    public static void validate(List<FetchJob> jobs) {
        if (jobs == null) {
            throw new FetchBatchValidationException(List.of("job list is null"));
        }
        List<String> issues = new ArrayList<>();
        Map<Path, Integer> firstIndexByDestination = new HashMap<>();
        for (int i = 0; i < jobs.size(); i++) {
            FetchJob job = jobs.get(i);
            if (job == null) {
                issues.add("job #" + i + " is null");
                continue;
            }
            if (!StringUtils.hasText(job.printId())) {
                issues.add("job #" + i + " has no print id");
            }
            if (job.destinationPath() == null) {
                issues.add("job #" + i + " (" + job.printId() + ") has no destination");
                continue;
            }
            Path normalized = job.destinationPath().toAbsolutePath().normalize();
            Integer previous = firstIndexByDestination.putIfAbsent(normalized, i);
            if (previous != null) {
                issues.add("jobs #" + previous + " and #" + i + " both write " + normalized);
            }
        }
        if (!issues.isEmpty()) {
            throw new FetchBatchValidationException(issues);
        }
    }

    private void ensureStorage(Path sampleDestination) {
        Path probe = sampleDestination.toAbsolutePath().getParent();
        while (probe != null && !Files.exists(probe)) {
            probe = probe.getParent();
        }
        if (probe == null) {
            throw new StorageUnavailableException(sampleDestination, "no existing ancestor directory");
        }
        long required = properties.getMinFreeSpace().toBytes();
        try {
            long usable = Files.getFileStore(probe).getUsableSpace();
            if (usable < required) {
                throw new StorageUnavailableException(probe,
                    "only " + usable + " bytes free, at least " + required + " required");
            }
        } catch (IOException ex) {
            throw new StorageUnavailableException(probe, "cannot inspect file store: " + ex.getMessage(), ex);
        }
    }

    // ── Single job ──

    Mono<FetchResult> fetchOne(FetchJob job) {
        long started = System.nanoTime();
        AtomicInteger attempts = new AtomicInteger();
        String subject = "print " + job.printId();

        return Mono.defer(() -> {
                URI uri = parseSourceUri(job);
                return Mono.fromCallable(() -> Files.createDirectories(job.destinationPath().toAbsolutePath().getParent()))
                    .subscribeOn(Schedulers.boundedElastic())
                    .then(Mono.defer(() -> {
                            attempts.incrementAndGet();
                            return download(uri, job.destinationPath());
                        })
                        .timeout(properties.getRequestTimeout())
                        .onErrorMap(error -> FetchFailureClassifier.classify(error, subject, job.sourceUri()))
                        .retryWhen(retryPolicy.toReactorRetry(subject, log)));
            })
            .map(bytes -> FetchResult.success(job, bytes, elapsedSince(started), attempts.get()))
            .onErrorResume(error -> {
                RemoteFetchException failure = FetchFailureClassifier.classify(error, subject, job.sourceUri());
                log.warn("Fetch failed for {} after {} attempt(s) [code={}]: {}",
                    job.displayName(), attempts.get(), failure.getErrorClass(), failure.getMessage());
                return Mono.just(FetchResult.failure(job, elapsedSince(started), attempts.get(),
                    failure.getErrorClass(), failure.getMessage()));
            });
    }

    private Mono<Long> download(URI uri, Path destination) {
        Flux<DataBuffer> body = webClient.get()
            .uri(uri)
            .retrieve()
            .bodyToFlux(DataBuffer.class);
        return AtomicFileWriter.write(body, destination);
    }

    static URI parseSourceUri(FetchJob job) {
        String raw = job.sourceUri();
        if (!StringUtils.hasText(raw)) {
            throw RemoteFetchException.invalidUri("print " + job.printId(), raw, "missing");
        }
        try {
            URI uri = new URI(raw.trim());
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                throw RemoteFetchException.invalidUri("print " + job.printId(), raw, "scheme must be http or https");
            }
            if (!StringUtils.hasText(uri.getHost())) {
                throw RemoteFetchException.invalidUri("print " + job.printId(), raw, "missing host");
            }
            return uri;
        } catch (URISyntaxException ex) {
            throw RemoteFetchException.invalidUri("print " + job.printId(), raw, ex.getReason());
        }
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
