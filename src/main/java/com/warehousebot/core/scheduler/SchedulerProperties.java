package com.warehousebot.core.scheduler;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "warehousebot.scheduler")
public class SchedulerProperties {

    private int maxQueueSize = 100;
    private double replanWeight = 0.1;
    /** Dispatches between two distance-based replans; 0 disables replanning. */
    private int replanInterval = 5;

    public int getMaxQueueSize() { return maxQueueSize; }
    public void setMaxQueueSize(int maxQueueSize) { this.maxQueueSize = maxQueueSize; }
    public double getReplanWeight() { return replanWeight; }
    public void setReplanWeight(double replanWeight) { this.replanWeight = replanWeight; }
    public int getReplanInterval() { return replanInterval; }
    public void setReplanInterval(int replanInterval) { this.replanInterval = replanInterval; }
}
