package com.myorg.evreg.observability;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "evreg.observability")
public class ObservabilityProperties {
    private boolean enabled = true;

    private boolean mdcEnabled = true;
    private boolean metricsEnabled = true;

    // topic ít và cố định; corrId thì không bao giờ làm tag (cardinality)
    private boolean tagTopic = true;
}
