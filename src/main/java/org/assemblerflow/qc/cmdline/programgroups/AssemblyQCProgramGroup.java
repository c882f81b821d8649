package org.assemblerflow.qc.cmdline.programgroups;

import org.assemblerflow.qc.utils.help.HelpConstants;
import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;

/**
 * Tools that process assemblies
 */
public final class AssemblyQCProgramGroup implements CommandLineProgramGroup {

    @Override
    public String getName() { return HelpConstants.DOC_CAT_ASSEMBLY_QC; }

    @Override
    public String getDescription() { return HelpConstants.DOC_CAT_ASSEMBLY_QC_SUMMARY; }
}
