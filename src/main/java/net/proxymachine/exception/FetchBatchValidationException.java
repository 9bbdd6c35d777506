package net.proxymachine.exception;

import java.util.List;

/**
 * A fetch batch failed pre-flight validation (duplicate destinations, missing fields).
 * Nothing was downloaded.
 * RETRYABLE: No
 */
public class FetchBatchValidationException extends ValidationException {

    public FetchBatchValidationException(List<String> issues) {
        super("Fetch batch rejected with " + issues.size() + " issue(s): " + String.join("; ", issues),
              issues, null);
    }
}
