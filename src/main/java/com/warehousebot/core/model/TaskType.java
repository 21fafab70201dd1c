package com.warehousebot.core.model;

/**
 * Kind of work a task asks the robot to perform at its target position.
 */
public enum TaskType {
    PICK,
    PLACE,
    CHARGE
}
