/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane.config;

import java.io.IOException;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import com.fasterxml.jackson.databind.ser.std.StdScalarSerializer;

/**
 * Reads and writes durations in the compact form {@code 1h30m}, {@code 10s} or {@code 500ms}.
 */
public class DurationSerde {

    private DurationSerde() {
    }

    private record Unit(ChronoUnit unit, String groupName, String suffix) {}

    private static final List<Unit> UNITS = List.of(
            new Unit(ChronoUnit.HOURS, "hours", "h"),
            new Unit(ChronoUnit.MINUTES, "minutes", "m"),
            new Unit(ChronoUnit.SECONDS, "seconds", "s"),
            new Unit(ChronoUnit.MILLIS, "millis", "ms"));

    private static final Pattern PATTERN = Pattern.compile("(?:(?<hours>\\d+)h)?(?:(?<minutes>\\d+)m)?(?:(?<seconds>\\d+)s)?(?:(?<millis>\\d+)ms)?");

    private static final String USAGE = "Expected a duration such as \"1h30m\", \"10s\" or \"500ms\"; supported units are h, m, s and ms.";

    public static Duration parse(String text) {
        Matcher matcher = PATTERN.matcher(text);
        if (text.isBlank() || !matcher.matches()) {
            throw new IllegalArgumentException("Invalid duration '" + text + "'. " + USAGE);
        }
        Duration result = Duration.ZERO;
        for (Unit unit : UNITS) {
            String amount = matcher.group(unit.groupName());
            if (amount != null) {
                try {
                    result = result.plus(Duration.of(Long.parseLong(amount), unit.unit()));
                }
                catch (NumberFormatException | ArithmeticException e) {
                    throw new IllegalArgumentException("Invalid duration '" + text + "', it is too large", e);
                }
            }
        }
        return result;
    }

    public static String format(Duration duration) {
        if (duration.isZero()) {
            return "0s";
        }
        StringBuilder builder = new StringBuilder();
        Duration remaining = duration;
        for (Unit unit : UNITS) {
            long amount = remaining.dividedBy(unit.unit().getDuration());
            if (amount > 0) {
                builder.append(amount).append(unit.suffix());
                remaining = remaining.minus(unit.unit().getDuration().multipliedBy(amount));
            }
        }
        return builder.toString();
    }

    public static class Deserializer extends StdScalarDeserializer<Duration> {

        public Deserializer() {
            super(Duration.class);
        }

        @Override
        public Duration deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (!p.hasToken(JsonToken.VALUE_STRING)) {
                throw new JsonParseException(p, "Invalid serialized duration. Expected a string value, but was " + p.currentToken());
            }
            try {
                return parse(p.getText());
            }
            catch (IllegalArgumentException e) {
                throw new JsonParseException(p, e.getMessage(), e);
            }
        }
    }

    public static class Serializer extends StdScalarSerializer<Duration> {

        public Serializer() {
            super(Duration.class);
        }

        @Override
        public void serialize(Duration value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(format(value));
        }
    }
}
