package com.warehousebot.core.planning;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "warehousebot.planner")
public class PlannerProperties {

    /** Meters per grid cell. */
    private double resolution = 0.1;

    /** Upper bound on A* expansions per query; 0 disables the bound. */
    private int maxExpansions = 250_000;

    /** Collapse the grid path into line-of-sight waypoints. */
    private boolean simplify = true;

    public double getResolution() { return resolution; }
    public void setResolution(double resolution) { this.resolution = resolution; }
    public int getMaxExpansions() { return maxExpansions; }
    public void setMaxExpansions(int maxExpansions) { this.maxExpansions = maxExpansions; }
    public boolean isSimplify() { return simplify; }
    public void setSimplify(boolean simplify) { this.simplify = simplify; }
}
