package com.myorg.evreg.delivery.reprocess;

import com.fasterxml.jackson.databind.JsonNode;

import java.lang.annotation.*;

/**
 * Marks a bean method as the recovery handler of one original topic. Supported signatures:
 * {@code (Payload)} and {@code (DeadLetterRecord, Payload)}.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface DeadLetterRecovery {
    // topic gốc, vd RegistrationTopics.EVENT_CREATED
    String value();

    // payload được convert sang type này trước khi gọi
    Class<?> payload() default JsonNode.class;
}
