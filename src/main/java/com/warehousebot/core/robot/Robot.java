package com.warehousebot.core.robot;

import com.warehousebot.core.model.Point;
import com.warehousebot.core.model.Task;
import com.warehousebot.core.planning.GridMap;
import com.warehousebot.core.planning.LineOfSight;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Kinematic point-mass robot.
 * <p>
 * Each {@link #step(Point)} moves at most {@code maxSpeed} meters straight toward a target and
 * drains the battery in proportion to the distance covered. The robot refuses a step whose
 * segment crosses a cell occupied in the static layout; it knows nothing about loose obstacles.
 * <p>
 * {@link #followPath(List)} checks each leg once, between the cells of consecutive waypoints, with
 * the same line test the planner simplifies with, so a planned path is never refused halfway.
 */
public class Robot {

    private static final Logger log = LoggerFactory.getLogger(Robot.class);

    private final RobotProperties properties;
    private final GridMap layout;

    private Point position;
    private RobotStatus status = RobotStatus.IDLE;
    private double battery;
    private double distanceTravelled;
    private double energyConsumed;
    private String load;
    private int tasksExecuted;

    public Robot(RobotProperties properties, GridMap layout, Point start) {
        this.properties = properties;
        this.layout = layout;
        this.position = start;
        this.battery = properties.getBatteryCapacity();
    }

    /**
     * Moves one step toward {@code target}.
     *
     * @return false if the step would cross an occupied cell; the robot does not move
     */
    public boolean step(Point target) {
        if (isAt(target)) {
            return true;
        }
        Point next = nextPosition(target);
        if (!LineOfSight.isClear(layout, layout.toCell(position), layout.toCell(next))) {
            block(target);
            return false;
        }
        advance(next);
        return true;
    }

    /**
     * Walks every waypoint in order. A leg is checked once, from the previous waypoint's cell
     * (the robot's own cell for the first leg) to the waypoint's cell, and then walked.
     *
     * @return false if a leg crosses an occupied cell or the robot ran out of steps on some
     *         waypoint; it stays where it stopped
     */
    public boolean followPath(List<Point> waypoints) {
        Point legStart = position;
        for (Point waypoint : waypoints) {
            if (!LineOfSight.isClear(layout, layout.toCell(legStart), layout.toCell(waypoint))) {
                block(waypoint);
                return false;
            }
            int steps = 0;
            while (!isAt(waypoint)) {
                if (steps++ >= properties.getMaxStepsPerWaypoint()) {
                    return false;
                }
                advance(nextPosition(waypoint));
            }
            legStart = waypoint;
        }
        status = RobotStatus.IDLE;
        return true;
    }

    private Point nextPosition(Point target) {
        double distance = position.distanceTo(target);
        double ratio = Math.min(properties.getMaxSpeed(), distance) / distance;
        return position.plus((target.x() - position.x()) * ratio, (target.y() - position.y()) * ratio);
    }

    private void advance(Point next) {
        double speed = position.distanceTo(next);
        double energy = properties.getBatteryDischargeRate() * (speed / properties.getMaxSpeed());
        energyConsumed += energy;
        battery = Math.max(0.0, battery - energy);
        distanceTravelled += speed;
        position = next;
        status = RobotStatus.MOVING;
    }

    private void block(Point target) {
        status = RobotStatus.BLOCKED;
        log.debug("Blocked at ({}, {}) heading to ({}, {})", position.x(), position.y(), target.x(), target.y());
    }

    public boolean isAt(Point target) {
        return position.distanceTo(target) <= properties.getArrivalTolerance();
    }

    /**
     * Performs the task's action at the current position.
     *
     * @return false if the action had no effect (picking while loaded or an item heavier than
     *         the gripper capacity, placing while empty)
     */
    public boolean execute(Task task) {
        boolean done = switch (task.type()) {
            case PICK -> {
                status = RobotStatus.PICKING;
                if (load != null) yield false;
                if (!canLift(task)) {
                    log.debug("{} weighs {} kg, gripper holds {} kg", task.itemId(), task.weightKg(),
                            properties.getGripperCapacityKg());
                    yield false;
                }
                load = task.itemId();
                yield true;
            }
            case PLACE -> {
                status = RobotStatus.PLACING;
                boolean holding = load != null;
                load = null;
                yield holding;
            }
            case CHARGE -> {
                status = RobotStatus.CHARGING;
                battery = properties.getBatteryCapacity();
                yield true;
            }
        };
        if (done) tasksExecuted++;
        status = RobotStatus.IDLE;
        return done;
    }

    public boolean canLift(Task task) {
        return task.weightKg() <= properties.getGripperCapacityKg();
    }

    public Point position() { return position; }
    public RobotStatus status() { return status; }
    public double battery() { return battery; }
    public double distanceTravelled() { return distanceTravelled; }
    public double energyConsumed() { return energyConsumed; }
    public String load() { return load; }
    public int tasksExecuted() { return tasksExecuted; }

    public double batteryPercent() {
        return battery / properties.getBatteryCapacity() * 100.0;
    }

    @Override
    public String toString() {
        return String.format("Robot(%.2f, %.2f, %s, battery=%.0f%%)", position.x(), position.y(), status, batteryPercent());
    }
}
