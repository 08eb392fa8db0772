package com.tapas.superstore.etl.normalize;

import com.tapas.superstore.etl.domain.CompositeKey;
import com.tapas.superstore.etl.domain.EntityFrame;
import com.tapas.superstore.etl.domain.NormalizedBatch;
import com.tapas.superstore.etl.domain.TableColumn;
import com.tapas.superstore.etl.exception.MalformedRecordException;
import com.tapas.superstore.etl.schema.EntityDefinition;
import com.tapas.superstore.etl.schema.EtlSchema;
import com.tapas.superstore.etl.schema.FieldDefinition;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Splits flat sales records into the entity frames declared by the schema.
 * <p>
 * Every record of the batch is validated before any frame is built, so one bad
 * record rejects the whole batch.
 */
@Slf4j
public class RecordNormalizer {

    private final EtlSchema schema;
    private final List<DateTimeFormatter> dateFormatters;
    private final Set<String> keyFields;

    public RecordNormalizer(EtlSchema schema) {
        this.schema = schema;
        this.dateFormatters = schema.dateFormatters();
        this.keyFields = schema.keyFields();
    }

    public NormalizedBatch normalize(List<Map<String, Object>> records) {
        if (records == null || records.isEmpty()) {
            throw new MalformedRecordException("Input batch contains no records");
        }

        var typedRecords = new ArrayList<Map<String, Object>>(records.size());
        for (int i = 0; i < records.size(); i++) {
            typedRecords.add(parseRecord(i, records.get(i)));
        }

        var frames = new LinkedHashMap<String, EntityFrame>();
        for (EntityDefinition entity : schema.entities()) {
            EntityFrame frame = project(entity, typedRecords);
            log.debug("Projected {} record(s) onto {}", typedRecords.size(), frame);
            frames.put(entity.name(), frame);
        }
        return new NormalizedBatch(frames);
    }

    /**
     * Validates one record against the field list and converts every value to
     * its schema type.
     */
    Map<String, Object> parseRecord(int position, Map<String, Object> record) {
        if (record == null) {
            throw new MalformedRecordException("Record " + position + " is null");
        }
        var typed = new LinkedHashMap<String, Object>();
        for (FieldDefinition field : schema.fields()) {
            Object raw = record.get(field.name());
            if (raw == null) {
                throw new MalformedRecordException(
                        String.format("Record %d: missing required field '%s'", position, field.name()));
            }
            typed.put(field.name(), convert(position, field, raw));
        }
        if (log.isDebugEnabled() && record.size() > typed.size()) {
            record.keySet().stream()
                    .filter(k -> !typed.containsKey(k))
                    .forEach(k -> log.debug("Record {}: ignoring unknown field '{}'", position, k));
        }
        return typed;
    }

    private Object convert(int position, FieldDefinition field, Object raw) {
        Object value = switch (field.type()) {
            case STRING -> toText(raw);
            case INTEGER -> toLong(raw);
            case DECIMAL -> toDecimal(raw);
            case DATE -> toDate(raw);
            case KEY -> null;
        };
        if (value == null) {
            throw new MalformedRecordException(String.format(
                    "Record %d: field '%s' expects %s but got %s '%s'",
                    position, field.name(), field.type(), raw.getClass().getSimpleName(), raw));
        }
        if (value instanceof String text && text.isBlank() && keyFields.contains(field.name())) {
            throw new MalformedRecordException(
                    String.format("Record %d: key field '%s' is blank", position, field.name()));
        }
        return value;
    }

    private static String toText(Object raw) {
        if (raw instanceof CharSequence text) {
            return text.toString();
        }
        if (raw instanceof Number number) {
            BigDecimal decimal = toBigDecimal(number);
            if (decimal != null && isIntegral(decimal)) {
                return decimal.toBigInteger().toString();
            }
        }
        return null;
    }

    private static Long toLong(Object raw) {
        if (raw instanceof Number number) {
            BigDecimal decimal = toBigDecimal(number);
            if (decimal != null && isIntegral(decimal)) {
                try {
                    return decimal.toBigInteger().longValueExact();
                } catch (ArithmeticException e) {
                    return null;
                }
            }
        }
        return null;
    }

    private static BigDecimal toDecimal(Object raw) {
        return raw instanceof Number number ? toBigDecimal(number) : null;
    }

    private LocalDate toDate(Object raw) {
        if (raw instanceof LocalDate date) {
            return date;
        }
        if (!(raw instanceof CharSequence)) {
            return null;
        }
        String text = raw.toString().trim();
        for (DateTimeFormatter formatter : dateFormatters) {
            try {
                TemporalAccessor parsed = formatter.parseBest(text, LocalDateTime::from, LocalDate::from);
                return parsed instanceof LocalDateTime dateTime ? dateTime.toLocalDate() : (LocalDate) parsed;
            } catch (DateTimeParseException e) {
                log.trace("'{}' does not match {}", text, formatter);
            }
        }
        return null;
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (number instanceof Integer || number instanceof Long
                || number instanceof Short || number instanceof Byte) {
            return BigDecimal.valueOf(number.longValue());
        }
        try {
            return new BigDecimal(number.toString());
        } catch (NumberFormatException e) {
            // NaN and infinities
            return null;
        }
    }

    private static boolean isIntegral(BigDecimal decimal) {
        return decimal.signum() == 0 || decimal.stripTrailingZeros().scale() <= 0;
    }

    private EntityFrame project(EntityDefinition entity, List<Map<String, Object>> records) {
        var columns = new ArrayList<TableColumn>();
        for (String column : entity.columns()) {
            columns.add(TableColumn.of(column, schema.field(column).type()));
        }
        if (entity.hasSyntheticIndex()) {
            columns.add(TableColumn.internal(entity.index()));
        }

        var seen = new HashSet<Object>();
        var rows = new ArrayList<Map<String, Object>>();
        int duplicates = 0;
        for (Map<String, Object> record : records) {
            var row = new LinkedHashMap<String, Object>();
            for (String column : entity.columns()) {
                row.put(column, record.get(column));
            }
            if (entity.hasSyntheticIndex()) {
                row.put(entity.index(), new CompositeKey(
                        entity.compositeKey().stream().map(record::get).toList()));
            }

            Object dedupKey = switch (entity.dedup()) {
                case INDEX -> row.get(entity.index());
                case FULL_ROW -> new ArrayList<>(row.values());
            };
            if (seen.add(dedupKey)) {
                rows.add(row);
            } else {
                duplicates++;
            }
        }
        if (duplicates > 0) {
            log.debug("Dropped {} duplicate {} row(s)", duplicates, entity.name());
        }
        return new EntityFrame(entity.name(), entity.index(), columns, rows);
    }
}
