package com.autotask.simpleSDK.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.List;

/**
 * One entry of an Autotask query filter. Grouping predicates ({@code and}/{@code or}) carry child
 * {@code items} instead of a field and value.
 *
 * <p>On the wire a field predicate always carries {@code value}, even when it is {@code null}
 * ({@code {"op":"eq","field":"assignedResourceID","value":null}} matches unassigned records).
 */
@JsonSerialize(using = FilterPredicate.WireSerializer.class)
public record FilterPredicate(
    @JsonProperty("op") String op,
    @JsonProperty("field") String field,
    @JsonProperty("value") Object value,
    @JsonProperty("udf") Boolean udf,
    @JsonProperty("items") List<FilterPredicate> items
) {
    public static final String EQ = "eq";
    public static final String GTE = "gte";

    public FilterPredicate {
        if (op == null || op.isBlank()) {
            throw new IllegalArgumentException("Filter operator is required");
        }
        items = items == null ? null : List.copyOf(items);
    }

    public static FilterPredicate of(String op, String field, Object value) {
        return new FilterPredicate(op, field, value, null, null);
    }

    public static FilterPredicate eq(String field, Object value) {
        return of(EQ, field, value);
    }

    public static FilterPredicate gte(String field, Object value) {
        return of(GTE, field, value);
    }

    public static FilterPredicate userDefined(String op, String field, Object value) {
        return new FilterPredicate(op, field, value, Boolean.TRUE, null);
    }

    public static FilterPredicate and(FilterPredicate... items) {
        return new FilterPredicate("and", null, null, null, List.of(items));
    }

    public static FilterPredicate or(FilterPredicate... items) {
        return new FilterPredicate("or", null, null, null, List.of(items));
    }

    /** The predicate sent when a list query has no filter: every record with a non-negative id. */
    public static FilterPredicate matchAll() {
        return gte("id", 0);
    }

    public boolean isGroup() {
        return items != null;
    }

    static class WireSerializer extends StdSerializer<FilterPredicate> {
        WireSerializer() {
            super(FilterPredicate.class);
        }

        @Override
        public void serialize(FilterPredicate predicate, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            gen.writeStringField("op", predicate.op());
            if (predicate.field() != null) {
                gen.writeStringField("field", predicate.field());
            }
            if (!predicate.isGroup()) {
                provider.defaultSerializeField("value", predicate.value(), gen);
            }
            if (predicate.udf() != null) {
                gen.writeBooleanField("udf", predicate.udf());
            }
            if (predicate.isGroup()) {
                provider.defaultSerializeField("items", predicate.items(), gen);
            }
            gen.writeEndObject();
        }
    }
}
