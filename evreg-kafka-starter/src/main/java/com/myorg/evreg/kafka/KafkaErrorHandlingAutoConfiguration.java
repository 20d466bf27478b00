package com.myorg.evreg.kafka;

import com.myorg.evreg.resilience.classify.ErrorClassifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
public class KafkaErrorHandlingAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(ErrorClassifier.class)
    public KafkaErrorClassifier kafkaErrorClassifier() {
        return new KafkaErrorClassifier();
    }
}
