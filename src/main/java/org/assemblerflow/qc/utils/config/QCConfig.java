package org.assemblerflow.qc.utils.config;

import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Config.LoadPolicy;
import org.aeonbits.owner.Config.LoadType;
import org.aeonbits.owner.Config.Sources;
import org.aeonbits.owner.Mutable;

/**
 * Configuration file for assembly QC options.
 * All specified {@code Sources} will be loaded.
 * The {@link LoadPolicy} is set to {@link LoadType#MERGE}, which specifies that if a configuration option is not found
 * in the first source, the option will be sought in all following sources until a definition is found.
 * If the option is not specified in any file, the coded default value will be used (as defined by @DefaultValue).
 *
 * The load order is:
 *        1)   "file:${" + QCConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
 *        2)   "file:QCConfig.properties",
 *        3)   "classpath:org/assemblerflow/qc/utils/config/QCConfig.properties"
 *        4)   hard-coded values specified by @DefaultValue
 */
@LoadPolicy(LoadType.MERGE)
@Sources({
        "file:${" + QCConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",          // Variable for file loading
        "file:QCConfig.properties",                                         // Default path
        "classpath:org/assemblerflow/qc/utils/config/QCConfig.properties"   // Class path
})
public interface QCConfig extends Mutable, Accessible {

    /**
     * Name of the configuration file variable to be used in the {@link Sources} annotation for {@link QCConfig}
     * as a place to find the configuration file corresponding to this interface.
     */
    String CONFIG_FILE_VARIABLE_FILE_NAME = "QCConfig.pathToQCConfig";

    // ----------------------------------------------------------
    // Assembly statistics:
    // ----------------------------------------------------------

    @Key("sliding_window.size")
    @DefaultValue("2000")
    int sliding_window_size();

    // ----------------------------------------------------------
    // Contig filtering:
    // ----------------------------------------------------------

    /**
     * Contigs whose GC proportion is below this value or above one minus this value are always filtered out.
     */
    @Key("filter.gc_bound")
    @DefaultValue("0.05")
    double filter_gc_bound();

    @Key("coverage.auto_factor")
    @DefaultValue("0.3")
    double coverage_auto_factor();

    @Key("coverage.auto_floor")
    @DefaultValue("10")
    double coverage_auto_floor();

    // ----------------------------------------------------------
    // Assembly health:
    // ----------------------------------------------------------

    @Key("health.max_contigs_per_1_5mb")
    @DefaultValue("100")
    int health_max_contigs_per_1_5mb();

    @Key("health.min_length_fraction")
    @DefaultValue("0.8")
    double health_min_length_fraction();

    @Key("health.max_length_fraction")
    @DefaultValue("1.5")
    double health_max_length_fraction();

    // ----------------------------------------------------------
    // Pipeline signalling:
    // ----------------------------------------------------------

    @Key("status.file_name")
    @DefaultValue(".status")
    String status_file_name();
}
