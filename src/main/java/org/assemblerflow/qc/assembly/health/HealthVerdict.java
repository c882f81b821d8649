package org.assemblerflow.qc.assembly.health;

import org.assemblerflow.qc.utils.Utils;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Outcome of one assembly health evaluation. Warnings are kept in the order the checks ran and may accompany either
 * a passing or a failing verdict.
 */
public final class HealthVerdict {

    public static final String ASSEMBLY_TOO_SMALL = "assembly too small";

    private final boolean passed;
    private final Set<HealthWarning> warnings;
    private final String failureReason;

    private HealthVerdict(final boolean passed, final Collection<HealthWarning> warnings, final String failureReason) {
        this.passed = passed;
        this.warnings = Collections.unmodifiableSet(new LinkedHashSet<>(warnings));
        this.failureReason = failureReason;
    }

    public static HealthVerdict pass(final Collection<HealthWarning> warnings) {
        Utils.nonNull(warnings);
        return new HealthVerdict(true, warnings, null);
    }

    public static HealthVerdict fail(final String reason, final Collection<HealthWarning> warnings) {
        Utils.nonEmpty(reason, "a failing verdict needs a reason");
        Utils.nonNull(warnings);
        return new HealthVerdict(false, warnings, reason);
    }

    public boolean isPassed() {
        return passed;
    }

    public Set<HealthWarning> getWarnings() {
        return warnings;
    }

    public boolean hasWarning(final HealthWarning warning) {
        return warnings.contains(warning);
    }

    public Optional<String> getFailureReason() {
        return Optional.ofNullable(failureReason);
    }

    public List<String> getWarningTags() {
        return warnings.stream().map(HealthWarning::getTag).collect(Collectors.toList());
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final HealthVerdict that = (HealthVerdict) o;
        return passed == that.passed && new ArrayList<>(warnings).equals(new ArrayList<>(that.warnings))
                && Objects.equals(failureReason, that.failureReason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(passed, new ArrayList<>(warnings), failureReason);
    }

    @Override
    public String toString() {
        return (passed ? "PASS" : "FAIL (" + failureReason + ")") + (warnings.isEmpty() ? "" : " warnings " + getWarningTags());
    }
}
