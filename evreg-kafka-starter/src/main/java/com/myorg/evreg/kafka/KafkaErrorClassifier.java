package com.myorg.evreg.kafka;

import com.myorg.evreg.contracts.core.exception.ErrorKind;
import com.myorg.evreg.resilience.classify.DefaultErrorClassifier;
import org.apache.kafka.common.errors.AuthenticationException;
import org.apache.kafka.common.errors.AuthorizationException;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.InvalidTopicException;
import org.apache.kafka.common.errors.RecordTooLargeException;
import org.apache.kafka.common.errors.RetriableException;
import org.apache.kafka.common.errors.SerializationException;

// A record that cannot be serialized, is too large or is refused by ACLs fails the same way on every
// attempt: send it to the dead-letter path at once. Errors the Kafka client marks retriable get backoff.
public class KafkaErrorClassifier extends DefaultErrorClassifier {

    @Override
    protected ErrorKind classifyKnown(Throwable t) {
        if (t instanceof InterruptException) return ErrorKind.CANCELLED;

        if (t instanceof SerializationException
                || t instanceof RecordTooLargeException
                || t instanceof InvalidTopicException
                || t instanceof AuthorizationException
                || t instanceof AuthenticationException) {
            return ErrorKind.PERMANENT;
        }
        if (t instanceof RetriableException) return ErrorKind.TRANSIENT;

        // plain KafkaException / KafkaProducerException are wrappers: null keeps walking to the cause
        return super.classifyKnown(t);
    }
}
