package com.myorg.evreg.contracts.registration;

public final class RegistrationTopics {
    private RegistrationTopics() {}

    public static final String EVENT_CREATED = "event.created";
}
