package org.assemblerflow.qc.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.assemblerflow.qc.exceptions.UserException;
import org.assemblerflow.qc.utils.Utils;
import org.assemblerflow.qc.utils.io.IOUtils;

import java.nio.file.Path;

/**
 * Serializes report objects to compact JSON.
 */
public final class JsonReportWriter {

    private static final JsonMapper MAPPER = JsonMapper.builder()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .build();

    private JsonReportWriter(){}

    public static String toJson(final Object report) {
        Utils.nonNull(report);
        try {
            return MAPPER.writeValueAsString(report);
        } catch (final JsonProcessingException e) {
            throw new UserException("Could not serialize " + report.getClass().getSimpleName() + " to JSON", e);
        }
    }

    public static void write(final Path output, final Object report) {
        IOUtils.writeString(output, toJson(report));
    }
}
