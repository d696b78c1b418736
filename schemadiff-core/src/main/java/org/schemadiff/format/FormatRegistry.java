package org.schemadiff.format;

import org.schemadiff.exception.InvalidFormatException;
import org.schemadiff.format.jsonschema.JsonSchemaAdapter;
import org.schemadiff.format.openapi.OpenApiAdapter;
import org.schemadiff.format.protobuf.ProtobufAdapter;
import org.schemadiff.format.sql.SqlDdlAdapter;
import org.schemadiff.model.SchemaFormat;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Lookup table from {@link SchemaFormat} to its adapter.
 */
public class FormatRegistry {

    private final Map<SchemaFormat, FormatAdapter> adapters;

    public FormatRegistry(List<FormatAdapter> adapters) {
        Map<SchemaFormat, FormatAdapter> map = new EnumMap<>(SchemaFormat.class);
        for (FormatAdapter adapter : adapters) {
            if (map.putIfAbsent(adapter.format(), adapter) != null) {
                throw new IllegalArgumentException("Duplicate adapter for format " + adapter.format());
            }
        }
        this.adapters = Collections.unmodifiableMap(map);
    }

    public static FormatRegistry defaults() {
        return new FormatRegistry(List.of(
                new JsonSchemaAdapter(),
                new OpenApiAdapter(),
                new ProtobufAdapter(),
                new SqlDdlAdapter()
        ));
    }

    public FormatAdapter adapter(SchemaFormat format) throws InvalidFormatException {
        FormatAdapter adapter = format == null ? null : adapters.get(format);
        if (adapter == null) {
            throw new InvalidFormatException("Unsupported schema format: " + format);
        }
        return adapter;
    }

    public boolean supports(SchemaFormat format) {
        return adapters.containsKey(format);
    }

    public Collection<FormatAdapter> adapters() {
        return adapters.values();
    }
}
