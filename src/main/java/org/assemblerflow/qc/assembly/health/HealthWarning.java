package org.assemblerflow.qc.assembly.health;

/**
 * Non-fatal findings of {@link AssemblyHealthClassifier}.
 */
public enum HealthWarning {
    ASSEMBLY_LARGER_THAN_EXPECTED("assembly larger than expected"),
    EXCESSIVE_CONTIG_COUNT("excessive contig count");

    private final String tag;

    HealthWarning(final String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    @Override
    public String toString() {
        return tag;
    }
}
