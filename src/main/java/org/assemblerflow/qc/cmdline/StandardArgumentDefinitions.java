package org.assemblerflow.qc.cmdline;

/**
 * A set of String constants in which the name of the constant (minus the _SHORT_NAME suffix)
 * is the standard long Option name, and the value of the constant is the standard shortName.
 */
public final class StandardArgumentDefinitions {

    private StandardArgumentDefinitions(){}

    public static final String INPUT_LONG_NAME = "input";
    public static final String OUTPUT_LONG_NAME = "output";
    public static final String OUTPUT_DIRECTORY_LONG_NAME = "output-directory";
    public static final String SAMPLE_ID_LONG_NAME = "sample-id";
    public static final String STATUS_FILE_LONG_NAME = "status-file";
    public static final String GENOME_SIZE_LONG_NAME = "genome-size";
    public static final String MIN_COVERAGE_LONG_NAME = "min-coverage";
    public static final String METRICS_FILE_LONG_NAME = "metrics-file";
    public static final String VERBOSITY_NAME = "verbosity";
    public static final String QUIET_NAME = "QUIET";

    public static final String INPUT_SHORT_NAME = "I";
    public static final String OUTPUT_SHORT_NAME = "O";
    public static final String OUTPUT_DIRECTORY_SHORT_NAME = "D";
    public static final String SAMPLE_ID_SHORT_NAME = "S";
    public static final String GENOME_SIZE_SHORT_NAME = "G";

    public static final String QC_CONFIG_FILE_OPTION = "qc-config-file";
}
