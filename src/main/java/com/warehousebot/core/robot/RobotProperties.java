package com.warehousebot.core.robot;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "warehousebot.robot")
public class RobotProperties {

    /** Meters per simulation step. */
    private double maxSpeed = 1.5;
    private double batteryCapacity = 10_000;
    /** Charge drained per step at full speed. */
    private double batteryDischargeRate = 100;
    private Sensor sensor = new Sensor();
    /** Distance at which a waypoint counts as reached. */
    private double arrivalTolerance = 0.1;
    private int maxStepsPerWaypoint = 200;
    private double gripperCapacityKg = 5.0;

    public double getMaxSpeed() { return maxSpeed; }
    public void setMaxSpeed(double maxSpeed) { this.maxSpeed = maxSpeed; }
    public double getBatteryCapacity() { return batteryCapacity; }
    public void setBatteryCapacity(double batteryCapacity) { this.batteryCapacity = batteryCapacity; }
    public double getBatteryDischargeRate() { return batteryDischargeRate; }
    public void setBatteryDischargeRate(double batteryDischargeRate) { this.batteryDischargeRate = batteryDischargeRate; }
    public Sensor getSensor() { return sensor; }
    public void setSensor(Sensor sensor) { this.sensor = sensor; }
    public double getArrivalTolerance() { return arrivalTolerance; }
    public void setArrivalTolerance(double arrivalTolerance) { this.arrivalTolerance = arrivalTolerance; }
    public int getMaxStepsPerWaypoint() { return maxStepsPerWaypoint; }
    public void setMaxStepsPerWaypoint(int maxStepsPerWaypoint) { this.maxStepsPerWaypoint = maxStepsPerWaypoint; }

    public double getGripperCapacityKg() { return gripperCapacityKg; }
    public void setGripperCapacityKg(double gripperCapacityKg) { this.gripperCapacityKg = gripperCapacityKg; }

    public static class Sensor {
        private double range = 5.0;
        private double detectionProbability = 0.95;

        public double getRange() { return range; }
        public void setRange(double range) { this.range = range; }
        public double getDetectionProbability() { return detectionProbability; }
        public void setDetectionProbability(double detectionProbability) { this.detectionProbability = detectionProbability; }
    }
}
