package com.myorg.evreg.delivery.reprocess;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.framework.AopProxyUtils;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.context.ApplicationContext;
import org.springframework.core.MethodIntrospector;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.util.Map;

/**
 * Registers every {@link DeadLetterRecovery} method of the context's components once all singletons exist.
 * Annotations are read from the target class, so proxied beans (AOP, transactions, tracing) are found too.
 */
@Slf4j
public class DeadLetterRecoveryScanner implements SmartInitializingSingleton {

    private final ApplicationContext ctx;
    private final RecoveryHandlerRegistry registry;
    private final ObjectMapper mapper;

    public DeadLetterRecoveryScanner(ApplicationContext ctx, RecoveryHandlerRegistry registry, ObjectMapper mapper) {
        this.ctx = ctx;
        this.registry = registry;
        this.mapper = mapper;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = ctx.getBeansWithAnnotation(Component.class);

        beans.values().forEach(bean -> {
            Class<?> targetClass = AopProxyUtils.ultimateTargetClass(bean);

            Map<Method, DeadLetterRecovery> methods = MethodIntrospector.selectMethods(
                    targetClass,
                    (MethodIntrospector.MetadataLookup<DeadLetterRecovery>) m ->
                            AnnotatedElementUtils.findMergedAnnotation(m, DeadLetterRecovery.class)
            );

            methods.forEach((method, ann) -> {
                // gọi qua proxy, không gọi thẳng target (để @Transactional... vẫn chạy)
                Method invocable = AopUtils.selectInvocableMethod(method, bean.getClass());
                registry.register(ann.value(), new RecoveryMethodInvoker(bean, invocable, ann.payload(), mapper));
                log.info("Registered dead-letter recovery topic={} method={}.{}",
                        ann.value(), targetClass.getSimpleName(), method.getName());
            });
        });
    }
}
