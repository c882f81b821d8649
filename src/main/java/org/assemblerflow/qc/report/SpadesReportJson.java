package org.assemblerflow.qc.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.assemblerflow.qc.assembly.health.HealthVerdict;
import org.assemblerflow.qc.utils.Utils;

import java.util.Collections;
import java.util.List;

/**
 * {@code {"warnings":{"process":"Spades","value":[...]},"fail":{"process":"Spades","value":[...]}}}; the fail entry
 * is present only for a failing verdict.
 */
@JsonPropertyOrder({"warnings", "fail"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SpadesReportJson {

    public static final String PROCESS_NAME = "Spades";

    @JsonPropertyOrder({"process", "value"})
    public static final class ProcessEntry {
        @JsonProperty("process")
        private final String process;

        @JsonProperty("value")
        private final List<String> value;

        public ProcessEntry(final String process, final List<String> value) {
            this.process = Utils.nonNull(process);
            this.value = Collections.unmodifiableList(Utils.nonNull(value));
        }

        public String getProcess() {
            return process;
        }

        public List<String> getValue() {
            return value;
        }
    }

    @JsonProperty("warnings")
    private final ProcessEntry warnings;

    @JsonProperty("fail")
    private final ProcessEntry fail;

    public SpadesReportJson(final ProcessEntry warnings, final ProcessEntry fail) {
        this.warnings = Utils.nonNull(warnings);
        this.fail = fail;
    }

    public static SpadesReportJson fromVerdict(final HealthVerdict verdict) {
        Utils.nonNull(verdict);
        final ProcessEntry warnings = new ProcessEntry(PROCESS_NAME, verdict.getWarningTags());
        final ProcessEntry fail = verdict.getFailureReason()
                .map(reason -> new ProcessEntry(PROCESS_NAME, Collections.singletonList(reason)))
                .orElse(null);
        return new SpadesReportJson(warnings, fail);
    }

    public ProcessEntry getWarnings() {
        return warnings;
    }

    public ProcessEntry getFail() {
        return fail;
    }
}
