package com.cronflow.cronflow_backend;

import java.time.temporal.ChronoUnit;

public enum ScheduleUnit {
    SECONDS(60, ChronoUnit.SECONDS),
    MINUTES(60, ChronoUnit.MINUTES),
    HOURS(24, ChronoUnit.HOURS),
    DAYS(7, ChronoUnit.DAYS);

    // Natural cycle of the unit's cron field: seconds/minutes per hour, hours per day, days per week
    private final int modulus;
    private final ChronoUnit chronoUnit;

    ScheduleUnit(int modulus, ChronoUnit chronoUnit) {
        this.modulus = modulus;
        this.chronoUnit = chronoUnit;
    }

    public int modulus() {
        return modulus;
    }

    public ChronoUnit chronoUnit() {
        return chronoUnit;
    }
}
