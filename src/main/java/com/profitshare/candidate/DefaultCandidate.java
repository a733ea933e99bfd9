package com.profitshare.candidate;

import com.profitshare.exception.MalformedValueException;
import com.profitshare.exception.MissingFieldException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Default implementation of Candidate.
 * Immutable after construction.
 */
public final class DefaultCandidate implements Candidate {

    private final Map<String, Object> fields;

    private DefaultCandidate(Builder builder) {
        this.fields = Collections.unmodifiableMap(new HashMap<>(builder.fields));
    }

    @Override
    public Optional<Object> find(String key) {
        return Optional.ofNullable(fields.get(key));
    }

    @Override
    public Map<String, Object> getFields() {
        return fields;
    }

    @Override
    public String getString(String key) {
        Object value = require(key);
        return value instanceof String s ? s : String.valueOf(value);
    }

    @Override
    public BigDecimal getDecimal(String key) {
        Object value = require(key);
        if (value instanceof BigDecimal d) {
            return d;
        }
        if (value instanceof BigInteger i) {
            return new BigDecimal(i);
        }
        if (value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        try {
            // Double/Float go through their shortest decimal form, so 5225.0 stays exact
            if (value instanceof Number || value instanceof String) {
                return new BigDecimal(value.toString().trim());
            }
        } catch (NumberFormatException e) {
            throw new MalformedValueException(key, value, "decimal", e);
        }
        throw new MalformedValueException(key, value, "decimal");
    }

    @Override
    public LocalDate getDate(String key) {
        Object value = require(key);
        if (value instanceof LocalDate d) {
            return d;
        }
        if (value instanceof LocalDateTime dt) {
            return dt.toLocalDate();
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toLocalDate();
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toLocalDate();
        }
        if (value instanceof String s) {
            return parseDate(key, s.trim());
        }
        throw new MalformedValueException(key, value, "date");
    }

    private Object require(String key) {
        Object value = fields.get(key);
        if (value == null) {
            throw new MissingFieldException(key);
        }
        return value;
    }

    private static LocalDate parseDate(String key, String text) {
        try {
            if (text.indexOf('T') < 0) {
                return LocalDate.parse(text);
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            return LocalDate.from(parsed);
        } catch (DateTimeParseException e) {
            throw new MalformedValueException(key, text, "date", e);
        }
    }

    @Override
    public String toString() {
        return "Candidate" + fields;
    }

    /**
     * Builder for DefaultCandidate.
     */
    public static class Builder implements Candidate.Builder {
        private final Map<String, Object> fields = new HashMap<>();

        @Override
        public Builder field(String key, Object value) {
            if (key != null && value != null) {
                this.fields.put(key, value);
            }
            return this;
        }

        @Override
        public Builder field(CandidateField field, Object value) {
            return field(field.key(), value);
        }

        @Override
        public Builder fields(Map<String, ?> fields) {
            if (fields != null) {
                fields.forEach(this::field);
            }
            return this;
        }

        @Override
        public Candidate build() {
            return new DefaultCandidate(this);
        }
    }
}
