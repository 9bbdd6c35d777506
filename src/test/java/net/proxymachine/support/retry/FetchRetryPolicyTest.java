package net.proxymachine.support.retry;

import net.proxymachine.exception.RemoteFetchException;
import net.proxymachine.model.fetch.FetchErrorClass;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.nio.file.AccessDeniedException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FetchRetryPolicyTest {

    private static final Logger log = LoggerFactory.getLogger(FetchRetryPolicyTest.class);

    private final FetchRetryPolicy policy = new FetchRetryPolicy(
        new FetchRetryPolicy.RetryConfig(3, Duration.ofMillis(1), Duration.ofMillis(4), 0.5d));

    @Test
    void shouldStopAfterMaxAttemptsAndSurfaceLastFailure() {
        AtomicInteger attempts = new AtomicInteger();
        Mono<String> failing = Mono.defer(() -> {
            attempts.incrementAndGet();
            return Mono.<String>error(RemoteFetchException.httpStatus("print p1", "https://x.test/p1.png", 503, null));
        });

        StepVerifier.create(failing.retryWhen(policy.toReactorRetry("print p1", log)))
            .expectErrorSatisfies(error -> {
                assertThat(error).isInstanceOf(RemoteFetchException.class);
                assertThat(((RemoteFetchException) error).getStatusCode()).isEqualTo(503);
            })
            .verify();

        assertThat(attempts.get()).isEqualTo(policy.maxAttempts()).isEqualTo(4);
    }

    @Test
    void shouldNotRetryPermanentFailures() {
        AtomicInteger attempts = new AtomicInteger();
        Mono<String> failing = Mono.defer(() -> {
            attempts.incrementAndGet();
            return Mono.<String>error(RemoteFetchException.invalidUri("print p1", "nope", "missing host"));
        });

        StepVerifier.create(failing.retryWhen(policy.toReactorRetry("print p1", log)))
            .expectError(RemoteFetchException.class)
            .verify();

        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void shouldRejectInvalidConfiguration() {
        assertThatThrownBy(() -> new FetchRetryPolicy.RetryConfig(-1, Duration.ZERO, Duration.ZERO, 0d))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FetchRetryPolicy.RetryConfig(1, Duration.ZERO, Duration.ZERO, 1.5d))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @CsvSource({
        "429,HTTP_RETRYABLE",
        "500,HTTP_RETRYABLE",
        "503,HTTP_RETRYABLE",
        "400,HTTP_CLIENT",
        "403,HTTP_CLIENT",
        "404,HTTP_CLIENT"
    })
    void classify_mapsHttpStatus(int status, FetchErrorClass expected) {
        WebClientResponseException response = WebClientResponseException.create(
            HttpStatusCode.valueOf(status), "status " + status, new HttpHeaders(), new byte[0], null, null);

        RemoteFetchException classified = FetchFailureClassifier.classify(response, "print p1", "https://x.test/p1.png");

        assertThat(classified.getErrorClass()).isEqualTo(expected);
        assertThat(classified.getStatusCode()).isEqualTo(status);
        assertThat(FetchRetryPolicy.isRetryable(classified)).isEqualTo(expected.isRetryable());
    }

    @Test
    void classify_walksCauseChain() {
        assertThat(classify(new TimeoutException("took too long"))).isEqualTo(FetchErrorClass.TIMEOUT);
        assertThat(classify(new IllegalStateException(new ConnectException("refused")))).isEqualTo(FetchErrorClass.CONNECTION);
        assertThat(classify(new UnknownHostException("img.example.test"))).isEqualTo(FetchErrorClass.CONNECTION);
        assertThat(classify(new AccessDeniedException("/out/card.png"))).isEqualTo(FetchErrorClass.IO);
        assertThat(classify(new IllegalArgumentException("odd"))).isEqualTo(FetchErrorClass.UNKNOWN);
    }

    @Test
    void classify_keepsAlreadyClassifiedFailures() {
        RemoteFetchException original = RemoteFetchException.invalidUri("print p1", "ftp://x", "scheme");

        assertThat(FetchFailureClassifier.classify(original, "print p1", "ftp://x")).isSameAs(original);
        assertThat(FetchRetryPolicy.isRetryable(new IllegalStateException("plain"))).isFalse();
    }

    @Test
    void summarize_reportsRootCause() {
        String summary = FetchFailureClassifier.summarize(new IllegalStateException("outer", new ConnectException("refused")));

        assertThat(summary).isEqualTo("ConnectException: refused");
    }

    private static FetchErrorClass classify(Throwable failure) {
        return FetchFailureClassifier.classify(failure, "print p1", "https://x.test/p1.png").getErrorClass();
    }
}
