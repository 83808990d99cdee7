package com.stratum.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Model selection for annotation and transformation calls. A non-blank {@code model}
 * becomes the default option of every {@link LlmService} request.
 */
@Component
@ConfigurationProperties(prefix = "stratum.llm")
public class LlmProperties {

    private String provider = "openai";
    private String model = "";
    private Double temperature = 0.0;

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public Double getTemperature() {
        return temperature;
    }

    public void setTemperature(Double temperature) {
        this.temperature = temperature;
    }
}
