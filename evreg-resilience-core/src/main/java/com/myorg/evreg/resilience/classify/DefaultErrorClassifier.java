package com.myorg.evreg.resilience.classify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.myorg.evreg.contracts.core.exception.DeliveryException;
import com.myorg.evreg.contracts.core.exception.ErrorKind;

import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Walks the cause chain and returns the kind of the first exception it recognizes.
 * Unknown failures are treated as {@link ErrorKind#TRANSIENT}: retried, then dead-lettered.
 */
public class DefaultErrorClassifier implements ErrorClassifier {

    private static final int MAX_DEPTH = 16;

    @Override
    public ErrorKind classify(Throwable error) {
        Throwable cur = error;
        for (int i = 0; cur != null && i < MAX_DEPTH; i++) {
            ErrorKind kind = classifyKnown(cur);
            if (kind != null) return kind;

            Throwable next = cur.getCause();
            if (next == cur) break;
            cur = next;
        }
        return ErrorKind.TRANSIENT;
    }

    /**
     * Kind of this exception alone, or {@code null} to keep looking at its cause.
     * Subclasses add broker-specific types and fall back to {@code super.classifyKnown}.
     */
    protected ErrorKind classifyKnown(Throwable t) {
        if (t instanceof DeliveryException de) return de.getKind();
        if (t instanceof InterruptedException) return ErrorKind.CANCELLED;

        // wrappers
        if (t instanceof ExecutionException || t instanceof CompletionException) return null;

        if (t instanceof TimeoutException) return ErrorKind.TRANSIENT;
        if (t instanceof JsonProcessingException) return ErrorKind.PERMANENT;
        if (t instanceof IOException) return ErrorKind.TRANSIENT;
        if (t instanceof IllegalArgumentException || t instanceof ClassCastException) return ErrorKind.PERMANENT;
        return null;
    }
}
