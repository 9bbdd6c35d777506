package net.proxymachine.support.retry;

import io.netty.handler.timeout.TimeoutException;
import net.proxymachine.exception.RemoteFetchException;
import net.proxymachine.model.fetch.FetchErrorClass;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.nio.file.FileSystemException;
import java.util.Locale;

/**
 * Maps raw failures from the HTTP client and the file system onto
 * {@link RemoteFetchException}, so the retry policy can decide on the error class alone.
 */
public final class FetchFailureClassifier {

    private FetchFailureClassifier() {
    }

    public static RemoteFetchException classify(Throwable failure, String subject, String sourceUri) {
        if (failure instanceof RemoteFetchException remote) {
            return remote;
        }
        if (failure instanceof WebClientResponseException response) {
            return RemoteFetchException.httpStatus(subject, sourceUri, response.getStatusCode().value(), failure);
        }
        FetchErrorClass errorClass = classifyCauseChain(failure);
        return new RemoteFetchException(subject, sourceUri, errorClass, null,
            errorClass.name().toLowerCase(Locale.ROOT) + " fetching " + subject + " from " + sourceUri + ": " + summarize(failure),
            failure);
    }

    private static FetchErrorClass classifyCauseChain(Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof java.util.concurrent.TimeoutException || current instanceof TimeoutException) {
                return FetchErrorClass.TIMEOUT;
            }
            // Local disk problems are not worth retrying
            if (current instanceof FileSystemException) {
                return FetchErrorClass.IO;
            }
            if (current instanceof ConnectException || current instanceof UnknownHostException) {
                return FetchErrorClass.CONNECTION;
            }
            current = current.getCause();
        }
        if (failure instanceof WebClientRequestException || failure instanceof IOException) {
            return FetchErrorClass.CONNECTION;
        }
        return FetchErrorClass.UNKNOWN;
    }

    /**
     * One-line description of a failure: exception type and message of the root cause.
     */
    public static String summarize(Throwable failure) {
        Throwable root = failure;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        return root.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
