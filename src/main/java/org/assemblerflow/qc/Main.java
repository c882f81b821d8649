package org.assemblerflow.qc;

import htsjdk.samtools.util.StringUtil;
import org.assemblerflow.qc.cmdline.CommandLineProgram;
import org.assemblerflow.qc.cmdline.StandardArgumentDefinitions;
import org.assemblerflow.qc.exceptions.UserException;
import org.assemblerflow.qc.utils.ClassUtils;
import org.assemblerflow.qc.utils.Utils;
import org.assemblerflow.qc.utils.config.ConfigFactory;
import org.assemblerflow.qc.utils.runtime.RuntimeUtils;
import org.broadinstitute.barclay.argparser.ClassFinder;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;

import java.io.PrintStream;
import java.lang.reflect.InvocationTargetException;
import java.util.*;

/**
 * Entry point of the assembly QC toolkit. The first argument names one of the {@link CommandLineProgram}s found in
 * {@link #getPackageList()}; the remaining arguments are handed to that tool.
 *
 * The {@code --qc-config-file} option is read before any tool is created, so that every tool sees the same
 * {@link org.assemblerflow.qc.utils.config.QCConfig}.
 */
public class Main {

    static {
        // Number formatting in the reports assumes a '.' decimal separator.
        Utils.forceJVMLocaleToUSEnglish();
    }

    public static final int COMMANDLINE_EXCEPTION_EXIT_VALUE = 1;
    public static final int USER_EXCEPTION_EXIT_VALUE = 2;
    public static final int ANY_OTHER_EXCEPTION_EXIT_VALUE = 3;

    private static final String STACK_TRACE_ON_USER_EXCEPTION_PROPERTY = "QC_STACKTRACE_ON_USER_EXCEPTION";

    private static final String COMMAND_LINE_NAME = "assembly-qc";

    // a command at most this far from a tool name gets that tool suggested
    private static final int HELP_SIMILARITY_FLOOR = 7;
    private static final int MINIMUM_SUBSTRING_LENGTH = 5;

    protected List<String> getPackageList() {
        return Collections.singletonList("org.assemblerflow.qc.tools");
    }

    /**
     * Runs the tool named by {@code args[0]}.
     * @return the tool's result, or {@code null} when only the usage was printed
     */
    public Object instanceMain(final String[] args) {
        ConfigFactory.getInstance().initializeConfigurationsFromCommandLineArgs(args, "--" + StandardArgumentDefinitions.QC_CONFIG_FILE_OPTION);
        final CommandLineProgram program = extractCommandLineProgram(args);
        if (program == null) {
            return null;
        }
        return program.instanceMain(Arrays.copyOfRange(args, 1, args.length));
    }

    /**
     * Command line entry: runs the tool and exits with a status that tells command line errors, user errors and
     * anything else apart. This is the only method allowed to call {@link System#exit(int)}.
     */
    protected final void mainEntry(final String[] args) {
        try {
            final Object result = instanceMain(args);
            if (result != null) {
                System.out.println("Tool returned:\n" + result);
            }
        } catch (final CommandLineException e) {
            handleUserException(e);
            System.exit(COMMANDLINE_EXCEPTION_EXIT_VALUE);
        } catch (final UserException e) {
            handleUserException(e);
            System.exit(USER_EXCEPTION_EXIT_VALUE);
        } catch (final Exception e) {
            e.printStackTrace();
            System.exit(ANY_OTHER_EXCEPTION_EXIT_VALUE);
        }
    }

    private static void handleUserException(final Exception e) {
        System.err.println("A USER ERROR has occurred: " + e.getMessage());
        if ("true".equals(System.getenv(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY)) || Boolean.getBoolean(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY)) {
            e.printStackTrace();
        } else {
            System.err.println(String.format("Set the system property %s (-D%s=true) to print the stack trace.",
                    STACK_TRACE_ON_USER_EXCEPTION_PROPERTY, STACK_TRACE_ON_USER_EXCEPTION_PROPERTY));
        }
    }

    public static void main(final String[] args) {
        new Main().mainEntry(args);
    }

    private CommandLineProgram extractCommandLineProgram(final String[] args) {
        final Map<String, Class<?>> simpleNameToClass = findCommandLinePrograms(getPackageList());
        final Set<Class<?>> classes = new LinkedHashSet<>(simpleNameToClass.values());

        if (args.length < 1 || args[0].equals("-h") || args[0].equals("--help")) {
            printUsage(System.out, classes);
            return null;
        }
        final Class<?> clazz = simpleNameToClass.get(args[0]);
        if (clazz == null) {
            printUsage(System.err, classes);
            throw new UserException(getSuggestedAlternateCommand(classes, args[0]));
        }
        try {
            return (CommandLineProgram) clazz.getDeclaredConstructor().newInstance();
        } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
            throw new IllegalStateException("Cannot create " + clazz.getName(), e);
        }
    }

    /**
     * @return the instantiable {@link CommandLineProgram} classes of the given packages, by simple name
     * @throws IllegalStateException if a tool lacks {@link CommandLineProgramProperties} or two tools share a simple name
     */
    static Map<String, Class<?>> findCommandLinePrograms(final List<String> packageList) {
        final ClassFinder classFinder = new ClassFinder();
        for (final String pkg : packageList) {
            classFinder.find(pkg, CommandLineProgram.class);
        }
        final List<String> missingAnnotation = new ArrayList<>();
        final Map<String, Class<?>> simpleNameToClass = new TreeMap<>();
        for (final Class<?> clazz : classFinder.getClasses()) {
            if (!ClassUtils.canMakeInstances(clazz)) {
                continue;
            }
            if (getProgramProperty(clazz) == null) {
                missingAnnotation.add(clazz.getSimpleName());
            } else if (simpleNameToClass.put(clazz.getSimpleName(), clazz) != null) {
                throw new IllegalStateException("Simple class name collision: " + clazz.getName());
            }
        }
        if (!missingAnnotation.isEmpty()) {
            throw new IllegalStateException("The following classes are missing the required CommandLineProgramProperties annotation: "
                    + String.join(", ", missingAnnotation));
        }
        return simpleNameToClass;
    }

    public static CommandLineProgramProperties getProgramProperty(final Class<?> clazz) {
        return clazz.getAnnotation(CommandLineProgramProperties.class);
    }

    private static void printUsage(final PrintStream destinationStream, final Set<Class<?>> classes) {
        final Map<CommandLineProgramGroup, List<Class<?>>> programsByGroup = new TreeMap<>(CommandLineProgramGroup.comparator);
        final Map<Class<? extends CommandLineProgramGroup>, CommandLineProgramGroup> groups = new HashMap<>();
        for (final Class<?> clazz : classes) {
            final CommandLineProgramProperties property = getProgramProperty(clazz);
            if (property.omitFromCommandLine()) {
                continue;
            }
            final CommandLineProgramGroup group = groups.computeIfAbsent(property.programGroup(), Main::newProgramGroup);
            programsByGroup.computeIfAbsent(group, g -> new ArrayList<>()).add(clazz);
        }

        final StringBuilder builder = new StringBuilder("USAGE: " + COMMAND_LINE_NAME + " <program name> [-h]\n\nAvailable Programs:\n");
        for (final Map.Entry<CommandLineProgramGroup, List<Class<?>>> entry : programsByGroup.entrySet()) {
            builder.append(String.format("%-48s %s\n", entry.getKey().getName() + ":", entry.getKey().getDescription()));
            entry.getValue().sort(Comparator.comparing(RuntimeUtils::toolDisplayName));
            for (final Class<?> clazz : entry.getValue()) {
                builder.append(String.format("    %-45s%s\n", RuntimeUtils.toolDisplayName(clazz), getProgramProperty(clazz).oneLineSummary()));
            }
            builder.append('\n');
        }
        destinationStream.print(builder);
    }

    private static CommandLineProgramGroup newProgramGroup(final Class<? extends CommandLineProgramGroup> groupClass) {
        try {
            return groupClass.getDeclaredConstructor().newInstance();
        } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
            throw new IllegalStateException("Cannot create program group " + groupClass.getName(), e);
        }
    }

    /**
     * Builds the error for an unknown command, naming the closest tools by prefix, substring or edit distance.
     */
    public String getSuggestedAlternateCommand(final Set<Class<?>> classes, final String command) {
        final Map<Class<?>, Integer> distances = new LinkedHashMap<>();
        int bestDistance = Integer.MAX_VALUE;
        int bestN = 0;
        for (final Class<?> clazz : classes) {
            final String name = clazz.getSimpleName();
            final int distance = name.startsWith(command) || (MINIMUM_SUBSTRING_LENGTH <= command.length() && name.contains(command))
                    ? 0
                    : StringUtil.levenshteinDistance(command, name, 0, 2, 1, 4);
            distances.put(clazz, distance);
            if (distance < bestDistance) {
                bestDistance = distance;
                bestN = 1;
            } else if (distance == bestDistance) {
                bestN++;
            }
        }
        // a command matching every tool equally suggests nothing
        if (bestDistance == 0 && bestN == classes.size()) {
            bestDistance = HELP_SIMILARITY_FLOOR + 1;
        }

        final StringBuilder message = new StringBuilder(String.format("'%s' is not a valid command.", command))
                .append(System.lineSeparator());
        if (bestDistance < HELP_SIMILARITY_FLOOR) {
            message.append(String.format("Did you mean %s?", bestN < 2 ? "this" : "one of these")).append(System.lineSeparator());
            for (final Map.Entry<Class<?>, Integer> entry : distances.entrySet()) {
                if (entry.getValue() == bestDistance) {
                    message.append("        ").append(entry.getKey().getSimpleName());
                }
            }
        }
        return message.toString();
    }
}
