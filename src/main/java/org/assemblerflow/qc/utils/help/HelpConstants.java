package org.assemblerflow.qc.utils.help;

public final class HelpConstants {

    private HelpConstants() {};

    public static final String PROJECT_SITE = "https://github.com/assemblerflow/assemblerflow";

    /**
     * Definition of the group names / descriptions for help purposes.
     */
    public final static String DOC_CAT_READ_QC = "Read QC";
    public final static String DOC_CAT_READ_QC_SUMMARY = "Tools that check the integrity, quality encoding and coverage of raw reads";

    public final static String DOC_CAT_ASSEMBLY_QC = "Assembly QC";
    public final static String DOC_CAT_ASSEMBLY_QC_SUMMARY = "Tools that summarize, filter and classify de novo assemblies";
}
