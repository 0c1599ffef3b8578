package org.netpreserve.trawler.util;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reads sizes such as {@code 5MB}, {@code 512k} or a bare number of bytes. Units are binary (1K = 1024 bytes).
 */
public class ByteSizeDeserializer extends JsonDeserializer<Long> {
    private static final Pattern SIZE_PATTERN =
            Pattern.compile("(?i)\\s*(\\d+(?:\\.\\d+)?)\\s*([KMG]?)(?:I?B)?\\s*");

    @Override
    public Long deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException, JacksonException {
        if (jsonParser.currentToken().isNumeric()) return jsonParser.getLongValue();
        return parse(jsonParser.getText());
    }

    public static long parse(String text) throws IOException {
        var matcher = SIZE_PATTERN.matcher(text);
        if (!matcher.matches()) {
            throw new IOException("Invalid byte size: " + text);
        }
        int shift = switch (matcher.group(2).toUpperCase(Locale.ROOT)) {
            case "K" -> 10;
            case "M" -> 20;
            case "G" -> 30;
            default -> 0;
        };
        return (long) (Double.parseDouble(matcher.group(1)) * (1L << shift));
    }
}
