package org.blocksync.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.security.CodeSource;
import java.security.ProtectionDomain;

/**
 * Configuration loader for the command line.
 * <p>
 * Composes HOCON configuration from these sources, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dblocksync.compiler.indent=2})</li>
 *   <li>Environment variables</li>
 *   <li>The user configuration file, see {@link #resolve(File, ConfigMessageHandler)}</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Substitutions are resolved only after all layers are composed, so a user override of a
 * referenced value reaches every place that refers to it.
 */
public final class ConfigLoader {

    private static final String CONFIG_DIR = "config";
    private static final String CONFIG_FILE_NAME = "blocksync.conf";

    private ConfigLoader() {
    }

    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is being looked up.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        void log(MessageLevel level, String message);
    }

    /**
     * Finds the user configuration file and loads it. The first match wins:
     * <ol>
     *   <li>the file given by the {@code --config} option</li>
     *   <li>the file given by {@code -Dconfig.file}</li>
     *   <li>{@code config/blocksync.conf} in the working directory</li>
     *   <li>{@code config/blocksync.conf} in the installation directory, next to {@code lib/}</li>
     *   <li>no file: classpath defaults only</li>
     * </ol>
     *
     * @param explicitConfigFile file from the command line, or {@code null}.
     * @param handler            receives progress messages.
     * @return the resolved configuration.
     * @throws IllegalArgumentException                if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException     if the configuration cannot be parsed or resolved.
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
                        "Configuration file specified via -Dconfig.file not found: "
                                + systemConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                    "Using configuration file specified via -Dconfig.file: " + systemConfigFile.getAbsolutePath());
            return loadFromFile(systemConfigFile);
        }

        final File cwdConfigFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file found in current directory: " + cwdConfigFile.getAbsolutePath());
            return loadFromFile(cwdConfigFile);
        }

        final File installationConfigFile = detectInstallationConfigFile(handler);
        if (installationConfigFile != null) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file from installation directory: "
                            + installationConfigFile.getAbsolutePath());
            return loadFromFile(installationConfigFile);
        }

        handler.log(MessageLevel.INFO,
                "No '" + CONFIG_DIR + "/" + CONFIG_FILE_NAME + "' found, using defaults from classpath.");
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
     * Infers the installation directory from the location of the running jar, expected under
     * {@code APP_HOME/lib}, and returns {@code APP_HOME/config/blocksync.conf} if it exists.
     */
    private static File detectInstallationConfigFile(final ConfigMessageHandler handler) {
        final ProtectionDomain protectionDomain = ConfigLoader.class.getProtectionDomain();
        final CodeSource codeSource = protectionDomain == null ? null : protectionDomain.getCodeSource();
        if (codeSource == null || codeSource.getLocation() == null) {
            return null;
        }
        final URL location = codeSource.getLocation();
        final File jarOrClasses;
        try {
            jarOrClasses = new File(location.toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            handler.log(MessageLevel.WARN, "Cannot determine installation directory from " + location
                    + ": " + e.getMessage());
            return null;
        }
        final File appHome = jarOrClasses.isFile()
                ? parentOf(jarOrClasses.getParentFile())
                : jarOrClasses;
        if (appHome == null) {
            return null;
        }
        final File configFile = new File(new File(appHome, CONFIG_DIR), CONFIG_FILE_NAME);
        return configFile.exists() ? configFile : null;
    }

    private static File parentOf(File file) {
        return file == null ? null : file.getParentFile();
    }
}
