package com.foreman.core.scheduler;

import com.foreman.core.model.SchedulerConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "foreman.scheduler")
public class SchedulerProperties {

    private int perTaskTimeoutSeconds = 300;
    private int maxRetries = 2;
    private int maxTotalIterations = 50;
    private int maxParallel = 3;

    public int getPerTaskTimeoutSeconds() { return perTaskTimeoutSeconds; }
    public void setPerTaskTimeoutSeconds(int perTaskTimeoutSeconds) { this.perTaskTimeoutSeconds = perTaskTimeoutSeconds; }
    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    public int getMaxTotalIterations() { return maxTotalIterations; }
    public void setMaxTotalIterations(int maxTotalIterations) { this.maxTotalIterations = maxTotalIterations; }
    public int getMaxParallel() { return maxParallel; }
    public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }

    public SchedulerConfig toConfig() {
        return new SchedulerConfig(Duration.ofSeconds(perTaskTimeoutSeconds), maxRetries,
                maxTotalIterations, maxParallel);
    }
}
