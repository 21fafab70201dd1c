package com.warehousebot.core.robot;

public enum RobotStatus {
    IDLE,
    MOVING,
    BLOCKED,
    PICKING,
    PLACING,
    CHARGING
}
