/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Aligns the query window of daily metrics to the days for which metrics are already published. S3 storage metrics
 * are published once a day, just before midnight in the region's local time.
 */
@Component
@Slf4j
public class TimeWindowBuilder {
    /**
     * @param days number of complete days to cover, ending with yesterday
     */
    public Instant[] getDailyMetricTimeWindow(String region, int days) {
        ZonedDateTime start, end;

        // End is 23:59 PM of yesterday
        ZonedDateTime now = getZonedDateTime(region);
        ZonedDateTime previousDay = now.minusDays(1);
        ZonedDateTime firstDay = previousDay.minusDays(Math.max(days, 1) - 1);
        end = ZonedDateTime.of(previousDay.getYear(), previousDay.getMonthValue(), previousDay.getDayOfMonth(),
                23, 59, 0, 0, now.getZone());
        start = ZonedDateTime.of(firstDay.getYear(), firstDay.getMonthValue(), firstDay.getDayOfMonth(),
                0, 0, 0, 0, now.getZone());
        return new Instant[]{start.toInstant(), end.toInstant()};
    }

    public ZonedDateTime getZonedDateTime(String region) {
        String timeZoneId = "America/Los_Angeles";
        if (region.startsWith("us-east-") || region.startsWith("ca-") || region.startsWith("sa-")) {
            timeZoneId = "America/New_York";
        } else if (region.startsWith("eu-") || region.startsWith("af-") || region.startsWith("me-")
                || region.startsWith("il-")) {
            timeZoneId = "Europe/Berlin";
        } else if (region.startsWith("ap-")) {
            timeZoneId = "Asia/Singapore";
        }
        return ZonedDateTime.now(ZoneId.of(timeZoneId));
    }
}
