package com.warehousebot.core.environment;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@ConfigurationProperties(prefix = "warehousebot.warehouse")
public class WarehouseProperties {

    private double width = 20.0;
    private double length = 30.0;
    private Racks racks = new Racks();
    private int numItems = 100;
    /** Fraction of free floor area covered by box obstacles. */
    private double obstacleDensity = 0.05;
    private int chargingStations = 2;
    private List<Double> startPosition = List.of(1.0, 1.0);

    public double getWidth() { return width; }
    public void setWidth(double width) { this.width = width; }
    public double getLength() { return length; }
    public void setLength(double length) { this.length = length; }
    public Racks getRacks() { return racks; }
    public void setRacks(Racks racks) { this.racks = racks; }
    public int getNumItems() { return numItems; }
    public void setNumItems(int numItems) { this.numItems = numItems; }
    public double getObstacleDensity() { return obstacleDensity; }
    public void setObstacleDensity(double obstacleDensity) { this.obstacleDensity = obstacleDensity; }
    public int getChargingStations() { return chargingStations; }
    public void setChargingStations(int chargingStations) { this.chargingStations = chargingStations; }
    public List<Double> getStartPosition() { return startPosition; }
    public void setStartPosition(List<Double> startPosition) { this.startPosition = startPosition; }

    public static class Racks {
        private int count = 10;
        private double length = 5.0;
        private double width = 1.0;
        private double aisleWidth = 2.0;

        public int getCount() { return count; }
        public void setCount(int count) { this.count = count; }
        public double getLength() { return length; }
        public void setLength(double length) { this.length = length; }
        public double getWidth() { return width; }
        public void setWidth(double width) { this.width = width; }
        public double getAisleWidth() { return aisleWidth; }
        public void setAisleWidth(double aisleWidth) { this.aisleWidth = aisleWidth; }
    }
}
