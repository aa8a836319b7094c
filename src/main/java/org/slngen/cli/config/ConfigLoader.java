package org.slngen.cli.config;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.security.CodeSource;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Composes the HOCON configuration of the command line tool.
 * <p>
 * Precedence, highest first: Java system properties, environment variables, the discovered user
 * configuration file, {@code reference.conf} on the classpath. Substitutions are resolved only after
 * all layers are stacked, so user overrides reach every value that refers to them.
 */
public final class ConfigLoader {

    private static final String CONFIG_DIR = "config";
    private static final String CONFIG_FILE_NAME = "slngen.conf";

    private ConfigLoader() {
    }

    /**
     * Severity of a resolution message.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is discovered.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        /**
         * @param level   the severity of the message.
         * @param message the human-readable description.
         */
        void log(MessageLevel level, String message);
    }

    /**
     * Resolves configuration, using the first configuration file found in this order:
     * <ol>
     *   <li>the file given on the command line,</li>
     *   <li>the file named by {@code -Dconfig.file},</li>
     *   <li>{@code config/slngen.conf} in the working directory,</li>
     *   <li>{@code config/slngen.conf} beside the directory holding the application jar.</li>
     * </ol>
     * Without any of them only classpath defaults apply.
     *
     * @param explicitConfigFile config file from the {@code --config} option, or {@code null}.
     * @param handler            receives resolution messages.
     * @return the resolved configuration.
     * @throws IllegalArgumentException            if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                    "Using configuration file specified via --config: " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file specified via -Dconfig.file not found: " + systemConfigFile);
            }
            handler.log(MessageLevel.INFO, "Using configuration file specified via -Dconfig.file: " + systemConfigFile);
            return loadFromFile(systemConfigFile);
        }

        final File workingDirectoryFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (workingDirectoryFile.exists()) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file found in current directory: " + workingDirectoryFile.getAbsolutePath());
            return loadFromFile(workingDirectoryFile);
        }

        final File installationFile = detectInstallationConfigFile(handler);
        if (installationFile != null) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file from installation directory: " + installationFile.getAbsolutePath());
            return loadFromFile(installationFile);
        }

        handler.log(MessageLevel.WARN, "No '" + CONFIG_DIR + "/" + CONFIG_FILE_NAME
                + "' found in current or installation directory, using built-in defaults.");
        return loadDefaults();
    }

    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Looks for {@code config/slngen.conf} in the parent of the directory holding the running jar.
     *
     * @return the file, or {@code null} if the location is unknown or holds no configuration.
     */
    private static File detectInstallationConfigFile(final ConfigMessageHandler handler) {
        final CodeSource codeSource = ConfigLoader.class.getProtectionDomain().getCodeSource();
        if (codeSource == null || codeSource.getLocation() == null) {
            return null;
        }

        final File jarOrClasses;
        try {
            final URL location = codeSource.getLocation();
            jarOrClasses = new File(location.toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            handler.log(MessageLevel.WARN, "Cannot locate installation directory: " + e.getMessage());
            return null;
        }
        if (!jarOrClasses.isFile()) {
            return null;
        }

        final File libDir = jarOrClasses.getParentFile();
        final File appHome = libDir == null ? null : libDir.getParentFile();
        if (appHome == null) {
            return null;
        }
        final File configFile = new File(new File(appHome, CONFIG_DIR), CONFIG_FILE_NAME);
        return configFile.exists() ? configFile : null;
    }
}
