package com.myorg.evreg.delivery.reprocess;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.evreg.contracts.core.envelope.DeadLetterRecord;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;

/** Adapts a {@link DeadLetterRecovery} method to {@link RecoveryHandler}. */
public class RecoveryMethodInvoker implements RecoveryHandler {

    private final Object target;
    private final Method method;
    private final Class<?> payloadClass;
    private final ObjectMapper mapper;

    public RecoveryMethodInvoker(Object target, Method method, Class<?> payloadClass, ObjectMapper mapper) {
        int params = method.getParameterCount();
        if (params != 1 && params != 2) {
            throw new IllegalStateException("Recovery method must have 1 or 2 params: (payload) or (record,payload): " + method);
        }
        if (params == 2 && !DeadLetterRecord.class.isAssignableFrom(method.getParameterTypes()[0])) {
            throw new IllegalStateException("First param of a 2-param recovery method must be DeadLetterRecord: " + method);
        }
        this.target = target;
        this.method = method;
        this.payloadClass = payloadClass;
        this.mapper = mapper;
    }

    @Override
    public void recover(JsonNode payload, DeadLetterRecord record) throws Exception {
        Object payloadObj = JsonNode.class.isAssignableFrom(payloadClass)
                ? payload
                : mapper.treeToValue(payload, payloadClass);
        try {
            if (method.getParameterCount() == 1) {
                method.invoke(target, payloadObj);
            } else {
                method.invoke(target, record, payloadObj);
            }
        } catch (InvocationTargetException e) {
            Throwable cause = e.getTargetException();
            if (cause instanceof Exception ex) throw ex;
            throw e;
        }
    }

    public Method getMethod() {
        return method;
    }
}
