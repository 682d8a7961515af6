package com.juno.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "juno.llm")
public class LlmProperties {

    private String provider = "openai";
    private String model = "gpt-4o";
    private double temperature = 0.2;

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

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    /** Provider-qualified model name, e.g. {@code openai/gpt-4o}. */
    public String qualifiedModel() {
        return provider + "/" + model;
    }
}
