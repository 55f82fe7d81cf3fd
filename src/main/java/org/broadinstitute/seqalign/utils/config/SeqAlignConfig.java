package org.broadinstitute.seqalign.utils.config;

import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Config.LoadPolicy;
import org.aeonbits.owner.Config.LoadType;
import org.aeonbits.owner.Config.Sources;
import org.aeonbits.owner.Mutable;
import org.broadinstitute.seqalign.utils.pairwise.GapModel;

/**
 * Configuration file for the default alignment options.
 * All specified {@code Sources} will be loaded.
 * The {@link LoadPolicy} is set to {@link LoadType#MERGE}, which specifies that if a configuration option is not found
 * in the first source, the option will be sought in all following sources until a definition is found.
 * If the option is not specified in any file, the coded default value will be used (as defined by @DefaultValue).
 *
 * The load order is always resolved "top-down" by declaration order in the @Sources annotation.
 *
 * In this case, the load order is:
 *        1)   "file:${" + SeqAlignConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
 *        2)   "classpath:${" + SeqAlignConfig.CONFIG_FILE_VARIABLE_CLASS_PATH + "}",
 *        3)   "file:SeqAlignConfig.properties",
 *        4)   "classpath:org/broadinstitute/seqalign/utils/config/SeqAlignConfig.properties"
 *        5)   hard-coded values specified by @DefaultValue
 *
 */
@LoadPolicy(LoadType.MERGE)
@Sources({
        "file:${" + SeqAlignConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",                      // Variable for file loading
        "classpath:${" + SeqAlignConfig.CONFIG_FILE_VARIABLE_CLASS_PATH + "}",                // Variable for class path loading
        "file:SeqAlignConfig.properties",                                                     // Default path
        "classpath:org/broadinstitute/seqalign/utils/config/SeqAlignConfig.properties"        // Class path
})
public interface SeqAlignConfig extends Mutable, Accessible {

    // =================================================================================================================
    // Meta Options:
    // =================================================================================================================

    /**
     * Name of the configuration file variable to be used in the {@link Sources} annotation for {@link SeqAlignConfig}
     * as a place to find the configuration file corresponding to this interface.
     */
    String CONFIG_FILE_VARIABLE_FILE_NAME = "SeqAlignConfig.pathToConfig";

    /**
     * Name of the class path variable to be used in the {@link Sources} annotation for {@link SeqAlignConfig}
     * as a place to find the configuration file corresponding to this interface.
     */
    String CONFIG_FILE_VARIABLE_CLASS_PATH = "SeqAlignConfig.classPathToConfig";

    // =================================================================================================================
    // Scoring Options:
    // =================================================================================================================

    @Key("default_scoring_matrix")
    @DefaultValue("BLOSUM62")
    String default_scoring_matrix();

    @Key("default_gap_open")
    @DefaultValue("-10")
    double default_gap_open();

    @Key("default_gap_extend")
    @DefaultValue("-1")
    double default_gap_extend();

    /**
     * Linear per-position gap cost used by the space-efficient aligner when no options are given.
     */
    @Key("space_efficient_default_gap_penalty")
    @DefaultValue("-1")
    double space_efficient_default_gap_penalty();

    // =================================================================================================================
    // Variant Options:
    // =================================================================================================================

    @Key("default_bandwidth")
    @DefaultValue("10")
    int default_bandwidth();

    @Key("default_min_score")
    @DefaultValue("0")
    double default_min_score();

    @Key("default_case_normalize")
    @ConverterClass(CustomBooleanConverter.class)
    @DefaultValue("true")
    Boolean default_case_normalize();

    @Key("default_score_normalize")
    @ConverterClass(CustomBooleanConverter.class)
    @DefaultValue("false")
    Boolean default_score_normalize();

    @Key("default_gap_model")
    @DefaultValue("AFFINE")
    GapModel default_gap_model();
}
