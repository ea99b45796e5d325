package com.foreman.core.delegate;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "foreman.workers")
public class WorkerProperties {

    private Simulated simulated = new Simulated();

    public Simulated getSimulated() { return simulated; }
    public void setSimulated(Simulated simulated) { this.simulated = simulated; }

    public static class Simulated {
        private long latencyMs = 200;
        private List<String> owners = new ArrayList<>(List.of(
                "Architect", "Permitting", "Mason", "Carpenter", "Roofer",
                "Electrician", "Plumber", "HVAC", "Painter"));
        private List<String> failingOwners = new ArrayList<>();

        public long getLatencyMs() { return latencyMs; }
        public void setLatencyMs(long latencyMs) { this.latencyMs = latencyMs; }
        public List<String> getOwners() { return owners; }
        public void setOwners(List<String> owners) { this.owners = owners; }
        public List<String> getFailingOwners() { return failingOwners; }
        public void setFailingOwners(List<String> failingOwners) { this.failingOwners = failingOwners; }
    }
}
