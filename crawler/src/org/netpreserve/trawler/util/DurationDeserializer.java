package org.netpreserve.trawler.util;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Reads durations written as {@code 1s}, {@code 2m}, {@code 500ms}, ISO-8601 ({@code PT1S}) or a bare number of
 * milliseconds.
 */
public class DurationDeserializer extends JsonDeserializer<Duration> {
    @Override
    public Duration deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException, JacksonException {
        if (jsonParser.currentToken().isNumeric()) return Duration.ofMillis(jsonParser.getLongValue());
        return parse(jsonParser.getText());
    }

    public static Duration parse(String text) throws IOException {
        String value = text.strip().toUpperCase(Locale.ROOT);
        try {
            if (!value.isEmpty() && value.chars().allMatch(Character::isDigit)) {
                return Duration.ofMillis(Long.parseLong(value));
            }
            if (value.endsWith("MS")) {
                return Duration.ofMillis(Long.parseLong(value.substring(0, value.length() - 2).strip()));
            }
            if (value.startsWith("PT")) return Duration.parse(value);
            return Duration.parse("PT" + value);
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new IOException("Invalid duration: " + text, e);
        }
    }
}
