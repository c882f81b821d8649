package org.assemblerflow.qc.utils.config;

import com.google.common.annotations.VisibleForTesting;
import htsjdk.samtools.util.Log;
import org.aeonbits.owner.Config;
import org.aeonbits.owner.ConfigCache;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.assemblerflow.qc.exceptions.QCException;
import org.assemblerflow.qc.exceptions.UserException;
import org.assemblerflow.qc.utils.ClassUtils;
import org.assemblerflow.qc.utils.LoggingUtils;
import org.assemblerflow.qc.utils.Utils;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads the {@link QCConfig} through {@link org.aeonbits.owner}. The user configuration file named by
 * {@link QCConfig#CONFIG_FILE_VARIABLE_FILE_NAME} is optional; when nothing sets that variable it points at
 * {@link #NO_USER_CONFIG_FILE} and only the packaged defaults apply.
 */
public final class ConfigFactory {

    private static final Logger logger = LogManager.getLogger(ConfigFactory.class);

    private static final ConfigFactory instance = new ConfigFactory();

    public static ConfigFactory getInstance() {
        return instance;
    }

    private ConfigFactory() {}

    @VisibleForTesting
    static final String NO_USER_CONFIG_FILE = "/dev/null";

    /**
     * Points the user configuration file variable at {@link #NO_USER_CONFIG_FILE} unless the environment, a system
     * property or the command line already set it.
     */
    private synchronized void resolveUserConfigFile() {
        final String variable = QCConfig.CONFIG_FILE_VARIABLE_FILE_NAME;
        if (System.getenv(variable) != null || System.getProperty(variable) != null
                || org.aeonbits.owner.ConfigFactory.getProperty(variable) != null) {
            return;
        }
        logger.debug("No user configuration file given, using the packaged defaults");
        org.aeonbits.owner.ConfigFactory.setProperty(variable, NO_USER_CONFIG_FILE);
    }

    /**
     * @return the cached {@link QCConfig}, created on first use
     */
    public QCConfig getQCConfig() {
        resolveUserConfigFile();
        return ConfigCache.getOrCreate(QCConfig.class);
    }

    /**
     * @return a new, uncached {@link QCConfig} reflecting the current user configuration file
     */
    public QCConfig createQCConfig() {
        resolveUserConfigFile();
        return org.aeonbits.owner.ConfigFactory.create(QCConfig.class);
    }

    /**
     * Get the configuration file name from the given arguments.
     *
     * NOTE: Does NOT validate that the resulting string is a valid configuration file.
     *
     * @param args Command-line arguments passed to this program.
     * @param configFileOption The command-line option indicating that the config file is next
     * @return The name of the configuration file for this program or {@code null}.
     */
    public static String getConfigFilenameFromArgs( final String[] args, final String configFileOption ) {

        Utils.nonNull(args);
        Utils.nonNull(configFileOption);

        String configFileName = null;

        for ( int i = 0 ; i < args.length ; ++i ) {
            if (args[i].equals(configFileOption)) {
                if ( ((i+1) < args.length) && (!args[i+1].startsWith("-")) ) {
                    configFileName = args[i+1];
                    break;
                }
                else {
                    // Option was provided, but no file was specified.
                    throw new UserException.BadInput("Configuration file not given after config file option specified: " + configFileOption);
                }
            }
        }

        return configFileName;
    }

    /**
     * Get the configuration filename from the command-line (if it exists) and create a {@link QCConfig} for it.
     * @param argList The list of arguments from which to read the config file.
     * @param configFileOption The command-line option specifying the main configuration file.
     */
    public synchronized void initializeConfigurationsFromCommandLineArgs(final String[] argList,
                                                                         final String configFileOption) {
        Utils.nonNull(argList);
        Utils.nonNull(configFileOption);

        final String configFileName = getConfigFilenameFromArgs( argList, configFileOption );

        if ( configFileName != null ){
            org.aeonbits.owner.ConfigFactory.setProperty( QCConfig.CONFIG_FILE_VARIABLE_FILE_NAME, configFileName );
        }

        getQCConfig();
    }

    /**
     * Logs all the parameters in the given {@link Config} object at the given {@link Log.LogLevel}
     * @param config A {@link Config} object from which to log all parameters and values.
     * @param logLevel The log {@link htsjdk.samtools.util.Log.LogLevel} at which to log the data in {@code config}
     */
    public static <T extends Config> void logConfigFields(final T config, final Log.LogLevel logLevel) {

        Utils.nonNull(config);
        Utils.nonNull(logLevel);

        final Level level = LoggingUtils.levelToLog4jLevel(logLevel);

        if ( !logger.isEnabled(level) ) {
            return;
        }

        logger.log(level, "Configuration file values: ");
        for ( final Map.Entry<String, Object> entry : getConfigMap(config).entrySet() ) {
            logger.log(level, "\t" + entry.getKey() + " = " + entry.getValue());
        }
    }

    @VisibleForTesting
    static <T extends Config> LinkedHashMap<String, Object> getConfigMap( final T config ) {
        final LinkedHashMap<String, Object> configMap = new LinkedHashMap<>();

        // The proxy implements a lot of methods we don't care about, so only look at the
        // interfaces that derive from the OWNER Config interface.
        for ( final Class<?> classInterface : ClassUtils.getClassesOfType(Config.class, Arrays.asList(config.getClass().getInterfaces())) ) {
            for (final Method propertyMethod : classInterface.getDeclaredMethods()) {

                String propertyName = propertyMethod.getName();

                final Config.Key key = propertyMethod.getAnnotation(Config.Key.class);
                if (key != null) {
                    propertyName = key.value();
                }

                try {
                    configMap.put(propertyName, propertyMethod.invoke(config));
                } catch (final IllegalAccessException ex) {
                    throw new QCException("Could not access the config getter: " +
                            config.getClass().getSimpleName() + "." + propertyMethod.getName(), ex);
                } catch (final InvocationTargetException ex) {
                    throw new QCException("Could not invoke the config getter: " +
                            config.getClass().getSimpleName() + "." + propertyMethod.getName(), ex);
                }
            }
        }

        return configMap;
    }
}
