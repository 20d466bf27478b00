package com.myorg.evreg.resilience.classify;

import com.myorg.evreg.contracts.core.exception.ErrorKind;

/**
 * Maps a failure of the wrapped call to an {@link ErrorKind}. The retry policy retries
 * {@link ErrorKind#TRANSIENT} only.
 */
@FunctionalInterface
public interface ErrorClassifier {
    ErrorKind classify(Throwable error);
}
