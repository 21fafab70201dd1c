package com.warehousebot.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "warehousebot.simulation")
public class SimulationProperties {

    private long seed = 42L;
    private int taskCount = 20;
    /** Planning attempts per task before it is canceled as unreachable. */
    private int moveAttempts = 3;
    /** Battery percentage under which charge tasks become urgent. */
    private double lowBatteryPercent = 20.0;

    public long getSeed() { return seed; }
    public void setSeed(long seed) { this.seed = seed; }
    public int getTaskCount() { return taskCount; }
    public void setTaskCount(int taskCount) { this.taskCount = taskCount; }
    public int getMoveAttempts() { return moveAttempts; }
    public void setMoveAttempts(int moveAttempts) { this.moveAttempts = moveAttempts; }
    public double getLowBatteryPercent() { return lowBatteryPercent; }
    public void setLowBatteryPercent(double lowBatteryPercent) { this.lowBatteryPercent = lowBatteryPercent; }
}
