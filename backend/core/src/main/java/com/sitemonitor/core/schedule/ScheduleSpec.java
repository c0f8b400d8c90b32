package com.sitemonitor.core.schedule;

import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Parsed form of a site's schedule text. See {@link ScheduleParser} for the accepted grammar.
 */
public interface ScheduleSpec {
    /**
     * The text this schedule was parsed from.
     */
    String expression();

    /**
     * First firing strictly after {@code after}, or empty when the schedule never fires again.
     */
    Optional<ZonedDateTime> nextFireAfter(ZonedDateTime after);
}
