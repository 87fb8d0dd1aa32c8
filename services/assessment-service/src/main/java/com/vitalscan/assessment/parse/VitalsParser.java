package com.vitalscan.assessment.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.vitalscan.assessment.domain.BloodPressureReading;
import com.vitalscan.assessment.domain.ParsedVitals;
import com.vitalscan.assessment.domain.PatientRecord;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Lenient conversion of raw vitals into numbers. None of these methods throw: anything that
 * cannot be read comes back as an empty optional.
 *
 * <p>Numeric strings are read by their leading numeric prefix, so {@code "98.6F"} is 98.6 and
 * {@code "45 years"} is 45. Booleans, objects, arrays and non-finite values are rejected.
 */
@Component
public class VitalsParser {

    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern DECIMAL_PREFIX =
        Pattern.compile("^[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?");
    private static final Pattern INTEGER_PREFIX = Pattern.compile("^[+-]?\\d+");

    public ParsedVitals parse(PatientRecord record) {
        BloodPressureReading bp = parseBloodPressure(record.bloodPressure());
        return new ParsedVitals(
            bp.systolic(),
            bp.diastolic(),
            parseTemperature(record.temperature()),
            parseAge(record.age())
        );
    }

    public BloodPressureReading parseBloodPressure(JsonNode raw) {
        if (raw == null || !raw.isTextual()) {
            return BloodPressureReading.invalid();
        }
        String value = raw.asText();
        int slash = value.indexOf('/');
        if (slash < 0 || value.indexOf('/', slash + 1) >= 0) {
            return BloodPressureReading.invalid();
        }
        return new BloodPressureReading(
            digitsOnly(value.substring(0, slash)),
            digitsOnly(value.substring(slash + 1))
        );
    }

    public OptionalDouble parseTemperature(JsonNode raw) {
        if (raw == null) {
            return OptionalDouble.empty();
        }
        if (raw.isNumber()) {
            return finite(raw.doubleValue());
        }
        if (!raw.isTextual()) {
            return OptionalDouble.empty();
        }
        Matcher matcher = DECIMAL_PREFIX.matcher(raw.asText().strip());
        if (!matcher.find()) {
            return OptionalDouble.empty();
        }
        try {
            return finite(Double.parseDouble(matcher.group()));
        } catch (NumberFormatException ex) {
            return OptionalDouble.empty();
        }
    }

    public OptionalInt parseAge(JsonNode raw) {
        if (raw == null) {
            return OptionalInt.empty();
        }
        if (raw.isNumber()) {
            double value = raw.doubleValue();
            if (!Double.isFinite(value) || value >= Integer.MAX_VALUE || value <= Integer.MIN_VALUE) {
                return OptionalInt.empty();
            }
            return OptionalInt.of((int) value);
        }
        if (!raw.isTextual()) {
            return OptionalInt.empty();
        }
        Matcher matcher = INTEGER_PREFIX.matcher(raw.asText().strip());
        if (!matcher.find()) {
            return OptionalInt.empty();
        }
        return toInt(matcher.group());
    }

    private OptionalInt digitsOnly(String side) {
        if (!DIGITS.matcher(side).matches()) {
            return OptionalInt.empty();
        }
        return toInt(side);
    }

    private OptionalInt toInt(String digits) {
        try {
            return OptionalInt.of(Integer.parseInt(digits));
        } catch (NumberFormatException ex) {
            // out of int range
            return OptionalInt.empty();
        }
    }

    private OptionalDouble finite(double value) {
        return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }
}
