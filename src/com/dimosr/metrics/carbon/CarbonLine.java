package com.dimosr.metrics.carbon;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * A single sample of the Carbon plaintext protocol: {@code <path> <value> <timestamp>\n}
 *
 * The path is a dot-delimited name, the value is a plain decimal number
 * and the timestamp is expressed in epoch seconds.
 */
public final class CarbonLine {
    private static final Splitter FIELD_SPLITTER = Splitter.on(' ').omitEmptyStrings();

    private final String path;
    private final double value;
    private final long timestamp;

    public CarbonLine(final String path, final double value, final long timestamp) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(path), "The path of a line cannot be empty");
        Preconditions.checkArgument(CharMatcher.whitespace().matchesNoneOf(path),
                "The path of a line cannot contain whitespace, but it was: '%s'", path);
        Preconditions.checkArgument(Double.isFinite(value), "The value of %s has to be finite, but it was: %s", path, value);
        this.path = path;
        this.value = value;
        this.timestamp = timestamp;
    }

    /**
     * Parses a line of the plaintext protocol, with or without the trailing newline
     * @throws IllegalArgumentException if the line is malformed
     */
    public static CarbonLine parse(final String line) {
        final List<String> fields = FIELD_SPLITTER.splitToList(CharMatcher.anyOf("\r\n").trimTrailingFrom(line));
        Preconditions.checkArgument(fields.size() == 3, "Expected 3 fields in line, but it was: '%s'", line);
        try {
            return new CarbonLine(fields.get(0), Double.parseDouble(fields.get(1)), Long.parseLong(fields.get(2)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Malformed number in line: '%s'", line), e);
        }
    }

    public String path() {
        return path;
    }

    public double value() {
        return value;
    }

    public long timestamp() {
        return timestamp;
    }

    /**
     * @return the line in the wire format, including the terminating newline
     */
    public String format() {
        return path + ' ' + formatValue(value) + ' ' + timestamp + '\n';
    }

    static String formatValue(final double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CarbonLine that = (CarbonLine) o;
        return Double.compare(that.value, value) == 0 && timestamp == that.timestamp && path.equals(that.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, value, timestamp);
    }

    @Override
    public String toString() {
        return format().trim();
    }
}
