package com.openforge.chronicle.memory.retrieval;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Default query builder: explicit query text wins, otherwise weather, time of day
 * and month are combined, e.g. {@code "weather: rainy time: evening month: November"}.
 */
@Component
public class SituationalQueryBuilder implements ContextQueryBuilder {

    static final String DEFAULT_QUERY = "recent observations";

    @Override
    public String build(QueryContext context) {
        if (context == null) {
            return DEFAULT_QUERY;
        }
        if (context.queryText() != null && !context.queryText().isBlank()) {
            return context.queryText().strip();
        }

        List<String> parts = new ArrayList<>();
        String weather = context.attribute("weather");
        if (weather != null && !weather.isBlank()) {
            parts.add("weather: " + weather.strip());
        }
        String timeOfDay = context.attribute("time_of_day");
        if (timeOfDay != null && !timeOfDay.isBlank()) {
            parts.add("time: " + timeOfDay.strip());
        }
        String month = month(context.attribute("date"));
        if (month != null) {
            parts.add("month: " + month);
        }
        return parts.isEmpty() ? DEFAULT_QUERY : String.join(" ", parts);
    }

    private static String month(String isoDate) {
        if (isoDate == null || isoDate.isBlank()) return null;
        String datePart = isoDate.strip();
        if (datePart.length() > 10) datePart = datePart.substring(0, 10);
        try {
            return LocalDate.parse(datePart).getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
