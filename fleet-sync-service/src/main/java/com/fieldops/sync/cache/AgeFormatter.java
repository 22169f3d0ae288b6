package com.fieldops.sync.cache;

import java.time.Duration;

final class AgeFormatter {

    private AgeFormatter() {}

    /** "42 minutes", "5 hours", "12 days". Negative ages read as zero. */
    static String describe(Duration age) {
        Duration positive = age.isNegative() ? Duration.ZERO : age;
        long hours = positive.toHours();
        if (hours < 1) {
            return positive.toMinutes() + " minutes";
        }
        if (hours < 24) {
            return hours + " hours";
        }
        return positive.toDays() + " days";
    }

    static String describeExpiry(Duration untilExpiry) {
        if (untilExpiry.isNegative() || untilExpiry.isZero()) {
            return "Expired";
        }
        return "Expires in " + describe(untilExpiry);
    }
}
