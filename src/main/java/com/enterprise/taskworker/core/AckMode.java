package com.enterprise.taskworker.core;

/**
 * When the broker message of a task is acknowledged
 */
public enum AckMode {
    EARLY,      // acknowledged at dispatch; at-most-once if the worker crashes
    LATE        // acknowledged after the terminal outcome; at-least-once
}
