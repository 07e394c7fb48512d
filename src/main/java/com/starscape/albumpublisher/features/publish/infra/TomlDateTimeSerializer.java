package com.starscape.albumpublisher.features.publish.infra;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fasterxml.jackson.dataformat.toml.TomlGenerator;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Writes an offset date-time as a native TOML datetime ({@code 2020-01-02T03:04:05Z}),
 * always with seconds, which TOML requires. Other formats get an ISO-8601 string.
 *
 * The raw write relies on the value sitting in an inline table, as every image
 * entry of the manifest does.
 */
class TomlDateTimeSerializer extends StdSerializer<OffsetDateTime> {

    public TomlDateTimeSerializer() {
        super(OffsetDateTime.class);
    }

    @Override
    public void serialize(OffsetDateTime value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        String text = DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(value);
        if (gen instanceof TomlGenerator) {
            gen.writeRawValue(text);
        } else {
            gen.writeString(text);
        }
    }
}
