package org.assemblerflow.qc.testutils;

import org.apache.commons.lang3.StringUtils;
import org.assemblerflow.qc.cmdline.StandardArgumentDefinitions;
import org.assemblerflow.qc.utils.Utils;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builder for command line argument lists with convenience methods for the standard arguments shared by the QC tools
 * such as input, sample id, output directory and genome size.
 *
 * Use this only in test code.
 */
public final class ArgumentsBuilder {
    private final List<String> args = new ArrayList<>();

    public ArgumentsBuilder(){}

    /**
     * Add a string to the arguments list, split on whitespace.
     *
     * NOTE: In general this method should be avoided in favor of other methods that handle adding dashes.
     */
    public ArgumentsBuilder addRaw(String arg){
        args.addAll(Arrays.asList(StringUtils.split(arg.trim())));
        return this;
    }

    /**
     * Add any object's string representation to the arguments list
     */
    public ArgumentsBuilder addRaw(Object arg) {
        args.add(arg.toString());
        return this;
    }

    /**
     * add an argument with a given value to this builder.
     *
     * This is the fundamental add method that others invoke.  It adds dashes to the argument name.
     */
    public ArgumentsBuilder add(final String argumentName, final String argumentValue) {
        Utils.nonNull(argumentValue);
        Utils.nonNull(argumentName);
        args.add("--" + argumentName);
        args.add(argumentValue);
        return this;
    }

    public ArgumentsBuilder add(final String argumentName, final File file){
        Utils.nonNull(file);
        return add(argumentName, file.getAbsolutePath());
    }

    public ArgumentsBuilder add(final String argumentName, final Path path){
        Utils.nonNull(path);
        return add(argumentName, path.toString());
    }

    public ArgumentsBuilder add(final String argumentName, final Number value){
        Utils.nonNull(value);
        return add(argumentName, value.toString());
    }

    public ArgumentsBuilder addInput(final File input) {
        return add(StandardArgumentDefinitions.INPUT_LONG_NAME, input);
    }

    public ArgumentsBuilder addInput(final String input) {
        return add(StandardArgumentDefinitions.INPUT_LONG_NAME, input);
    }

    public ArgumentsBuilder addInput(final Path input) {
        return add(StandardArgumentDefinitions.INPUT_LONG_NAME, input);
    }

    public ArgumentsBuilder addSampleId(final String sampleId) {
        return add(StandardArgumentDefinitions.SAMPLE_ID_LONG_NAME, sampleId);
    }

    public ArgumentsBuilder addOutputDirectory(final File directory) {
        return add(StandardArgumentDefinitions.OUTPUT_DIRECTORY_LONG_NAME, directory);
    }

    public ArgumentsBuilder addGenomeSize(final double genomeSizeMb) {
        return add(StandardArgumentDefinitions.GENOME_SIZE_LONG_NAME, genomeSizeMb);
    }

    public ArgumentsBuilder addFlag(final String argumentName) {
        Utils.nonNull(argumentName);
        args.add("--" + argumentName);
        return this;
    }

    /**
     * @return the arguments as List
     */
    public List<String> getArgsList(){
        return args;
    }

    /**
     * @return the arguments as String[]
     */
    public String[] getArgsArray(){
        return args.toArray(new String[0]);
    }

    /**
     * @return the arguments as a single String
     */
    public String getString() {
        return String.join(" ", args);
    }

    @Override
    public String toString(){
        return getString();
    }
}
