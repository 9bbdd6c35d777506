package net.proxymachine.service.catalog;

import net.proxymachine.config.FetchProperties;
import net.proxymachine.exception.RemoteFetchException;
import net.proxymachine.model.fetch.FetchErrorClass;
import net.proxymachine.support.io.AtomicFileWriter;
import net.proxymachine.support.retry.FetchFailureClassifier;
import net.proxymachine.support.retry.FetchRetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Downloads the upstream bulk catalog dump. The bulk-data descriptor names the current
 * dump URI; the last seen ETag is kept in a {@code .etag} sidecar so an unchanged dump
 * is not downloaded again.
 */
@Service
public class BulkCatalogDownloader {

    private static final Logger log = LoggerFactory.getLogger(BulkCatalogDownloader.class);

    private static final String ETAG_SUFFIX = ".etag";

    public enum Outcome {
        DOWNLOADED,
        NOT_MODIFIED
    }

    /**
     * @param outcome whether new content was written
     * @param path    dump location
     * @param etag    ETag of the dump on disk, when the server sent one
     * @param bytes   bytes written; zero when not modified
     */
    public record DownloadResult(Outcome outcome, Path path, String etag, long bytes) {
    }

    private final WebClient webClient;
    private final FetchRetryPolicy retryPolicy;
    private final FetchProperties properties;
    private final ObjectMapper objectMapper;

    public BulkCatalogDownloader(WebClient fetchWebClient,
                                 FetchRetryPolicy retryPolicy,
                                 FetchProperties properties,
                                 ObjectMapper objectMapper) {
        this.webClient = fetchWebClient;
        this.retryPolicy = retryPolicy;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public DownloadResult download(Path destination) {
        return download(properties.getBulkType(), destination);
    }

    /**
     * Fetches the dump of the given bulk type into {@code destination}.
     *
     * @throws RemoteFetchException when the descriptor or the dump cannot be fetched
     *         within the retry budget
     */
    public DownloadResult download(String bulkType, Path destination) {
        String subject = "bulk " + bulkType;
        String downloadUri = resolveDownloadUri(bulkType, subject);
        Optional<String> knownEtag = readEtag(destination);
        ensureParent(destination);

        DownloadResult result = Mono.defer(() -> webClient.get()
                .uri(downloadUri)
                .headers(headers -> knownEtag.filter(etag -> Files.exists(destination)).ifPresent(headers::setIfNoneMatch))
                .exchangeToMono(response -> {
                    if (response.statusCode().value() == HttpStatus.NOT_MODIFIED.value()) {
                        return response.releaseBody()
                            .thenReturn(new DownloadResult(Outcome.NOT_MODIFIED, destination, knownEtag.orElse(null), 0L));
                    }
                    if (!response.statusCode().is2xxSuccessful()) {
                        return response.<DownloadResult>createError();
                    }
                    String etag = response.headers().asHttpHeaders().getFirst(HttpHeaders.ETAG);
                    return AtomicFileWriter.write(response.bodyToFlux(DataBuffer.class), destination)
                        .map(bytes -> new DownloadResult(Outcome.DOWNLOADED, destination, etag, bytes));
                }))
            .onErrorMap(error -> FetchFailureClassifier.classify(error, subject, downloadUri))
            .retryWhen(retryPolicy.toReactorRetry(subject, log))
            .block();

        if (result == null) {
            throw new RemoteFetchException(subject, downloadUri, FetchErrorClass.UNKNOWN, null,
                "Empty response fetching " + subject, null);
        }
        if (result.outcome() == Outcome.DOWNLOADED) {
            writeEtag(destination, result.etag());
            log.info("Downloaded {} to {} ({} bytes, etag={})", subject, destination, result.bytes(), result.etag());
        } else {
            log.info("{} unchanged since last download (etag={})", subject, result.etag());
        }
        return result;
    }

    private String resolveDownloadUri(String bulkType, String subject) {
        String descriptorUri = trimTrailingSlash(properties.getBulkApiBaseUrl()) + "/bulk-data/" + bulkType;
        String body = webClient.get()
            .uri(descriptorUri)
            .retrieve()
            .bodyToMono(String.class)
            .timeout(properties.getRequestTimeout())
            .onErrorMap(error -> FetchFailureClassifier.classify(error, subject, descriptorUri))
            .retryWhen(retryPolicy.toReactorRetry(subject + " descriptor", log))
            .block();
        try {
            JsonNode descriptor = objectMapper.readTree(body == null ? "" : body);
            JsonNode uriNode = descriptor.path("download_uri");
            String downloadUri = uriNode.isString() ? uriNode.asString() : null;
            if (!StringUtils.hasText(downloadUri)) {
                throw new RemoteFetchException(subject, descriptorUri, FetchErrorClass.UNKNOWN, null,
                    "Bulk-data descriptor for " + bulkType + " has no download_uri", null);
            }
            return downloadUri;
        } catch (JacksonException ex) {
            throw new RemoteFetchException(subject, descriptorUri, FetchErrorClass.UNKNOWN, null,
                "Bulk-data descriptor for " + bulkType + " is not valid JSON", ex);
        }
    }

    // ── ETag sidecar ──

    static Path etagPath(Path destination) {
        return destination.resolveSibling(destination.getFileName() + ETAG_SUFFIX);
    }

    private static Optional<String> readEtag(Path destination) {
        Path sidecar = etagPath(destination);
        if (!Files.isRegularFile(sidecar)) {
            return Optional.empty();
        }
        try {
            String etag = Files.readString(sidecar, StandardCharsets.UTF_8).trim();
            return etag.isEmpty() ? Optional.empty() : Optional.of(etag);
        } catch (IOException ex) {
            log.warn("Ignoring unreadable ETag sidecar {}: {}", sidecar, ex.getMessage());
            return Optional.empty();
        }
    }

    private static void writeEtag(Path destination, String etag) {
        Path sidecar = etagPath(destination);
        try {
            if (StringUtils.hasText(etag)) {
                Files.writeString(sidecar, etag, StandardCharsets.UTF_8);
            } else {
                Files.deleteIfExists(sidecar);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to record ETag for " + destination, ex);
        }
    }

    private static void ensureParent(Path destination) {
        Path parent = destination.toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot create directory for " + destination, ex);
        }
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
