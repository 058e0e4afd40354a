package org.dxworks.astdoc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.astdoc.model.DocumentReport;

/**
 * Pretty-printed JSON with snake_case keys.
 */
public final class ReportWriter {

    public static final ObjectMapper MAPPER = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private ReportWriter() {
    }

    public static String toJson(DocumentReport report) throws JsonProcessingException {
        return MAPPER.writeValueAsString(report);
    }
}
