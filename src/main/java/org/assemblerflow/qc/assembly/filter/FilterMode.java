package org.assemblerflow.qc.assembly.filter;

/**
 * How the caller-supplied rules of a filter combine.
 */
public enum FilterMode {
    /**
     * A contig is rejected by the first rule it fails.
     */
    ALL,

    /**
     * A contig is rejected only when it fails every rule; the reported reason is the first failure.
     */
    ANY
}
