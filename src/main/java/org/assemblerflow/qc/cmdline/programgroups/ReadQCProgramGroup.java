package org.assemblerflow.qc.cmdline.programgroups;

import org.assemblerflow.qc.utils.help.HelpConstants;
import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;

/**
 * Tools that check raw sequencing reads before assembly
 */
public final class ReadQCProgramGroup implements CommandLineProgramGroup {

    @Override
    public String getName() { return HelpConstants.DOC_CAT_READ_QC; }

    @Override
    public String getDescription() { return HelpConstants.DOC_CAT_READ_QC_SUMMARY; }
}
