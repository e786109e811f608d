package com.enterprise.jobscheduler.core;

/**
 * How a schedule repeats
 */
public enum RecurrenceType {
    ONCE,
    INTERVAL,
    DAILY,
    WEEKLY,
    MONTHLY,
    CRON
}
