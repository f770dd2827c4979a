package com.eainde.workout.workout;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Replaces model-hallucinated years in {@code date}. The completion time is derived from
 * the message timestamp, so it is trusted over whatever year the model wrote.
 */
@Slf4j
public final class WorkoutDateCorrector {

    public static final String DATE_FLAG = "date";

    private WorkoutDateCorrector() {
    }

    /**
     * @param completedAt ISO-8601 date-time with offset, as produced by extraction
     * @return true when the date was rewritten
     */
    public static boolean correct(ObjectNode workout, String completedAt, Clock clock) {
        String date = WorkoutFields.text(workout, "date");
        if (date == null || completedAt == null) {
            return false;
        }

        LocalDate workoutDate;
        LocalDate completedDate;
        try {
            workoutDate = LocalDate.parse(date.length() > 10 ? date.substring(0, 10) : date);
            completedDate = OffsetDateTime.parse(completedAt).toLocalDate();
        } catch (DateTimeParseException e) {
            log.debug("Skipping date correction, unparseable date '{}' or completedAt '{}'", date, completedAt);
            return false;
        }

        int currentYear = LocalDate.now(clock).getYear();
        int year = workoutDate.getYear();
        boolean invalidYear = year < currentYear - 1
                || year > currentYear + 1
                || Math.abs(year - completedDate.getYear()) > 1;
        if (!invalidYear) {
            return false;
        }

        log.warn("Correcting workout date {} to {} (year {} is implausible)", date, completedDate, year);
        workout.put("date", completedDate.toString());
        WorkoutFields.addFlag(workout, DATE_FLAG);
        return true;
    }
}
