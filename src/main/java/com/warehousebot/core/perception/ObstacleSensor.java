package com.warehousebot.core.perception;

import com.warehousebot.core.environment.Obstacle;
import com.warehousebot.core.model.ObstacleDetection;
import com.warehousebot.core.model.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Random;

/**
 * Range-limited, noisy obstacle detector.
 * <p>
 * An obstacle at surface distance {@code d <= range} is seen with probability
 * {@code p * (1 - d / range)}; its box is shifted by Gaussian noise with a standard deviation of
 * 3% of {@code d}, and reported with confidence {@code 1 - d / range}.
 */
public class ObstacleSensor {

    private static final Logger log = LoggerFactory.getLogger(ObstacleSensor.class);

    static final double POSITION_NOISE_FACTOR = 0.03;

    private final double range;
    private final double detectionProbability;
    private final Random random;

    public ObstacleSensor(double range, double detectionProbability, Random random) {
        if (!(range > 0)) {
            throw new IllegalArgumentException("Sensor range must be positive: " + range);
        }
        this.range = range;
        this.detectionProbability = detectionProbability;
        this.random = random;
    }

    public List<ObstacleDetection> detect(Point robotPosition, Collection<Obstacle> obstacles) {
        var detections = new ArrayList<ObstacleDetection>();
        for (Obstacle obstacle : obstacles) {
            double distance = obstacle.distanceTo(robotPosition);
            if (distance > range) continue;

            double confidence = Math.max(0.0, 1.0 - distance / range);
            if (random.nextDouble() >= detectionProbability * confidence) continue;

            double sigma = distance * POSITION_NOISE_FACTOR;
            double dx = random.nextGaussian() * sigma;
            double dy = random.nextGaussian() * sigma;
            detections.add(new ObstacleDetection(
                    obstacle.min().plus(dx, dy),
                    obstacle.max().plus(dx, dy),
                    confidence));
        }
        log.debug("Detected {}/{} obstacles around ({}, {})", detections.size(), obstacles.size(),
                robotPosition.x(), robotPosition.y());
        return detections;
    }

    public double range() {
        return range;
    }
}
