package com.ttennebkram.trackpipe;

import com.ttennebkram.trackpipe.cli.TrackpipeCli;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Filter;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Main class. Sets up logging and the OpenCV native library, then runs the
 * command line.
 */
public class TrackpipeLauncher {

    public static void main(String[] args) {
        configureLogging();

        // Suppress harmless JavaFX "Unsupported configuration" warning when running from classpath
        suppressJavaFXModuleWarning();

        // Load OpenCV native library
        nu.pattern.OpenCV.loadLocally();

        System.exit(new CommandLine(new TrackpipeCli()).execute(args));
    }

    private static void configureLogging() {
        try (InputStream in = TrackpipeLauncher.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Could not read logging.properties: " + e.getMessage());
        }
    }

    /**
     * Suppress the harmless "Unsupported JavaFX configuration" warning that occurs
     * when JavaFX is loaded from the classpath rather than as a proper module.
     */
    private static void suppressJavaFXModuleWarning() {
        Logger javafxLogger = Logger.getLogger("javafx");
        Filter existingFilter = javafxLogger.getFilter();
        javafxLogger.setFilter(record -> {
            String msg = record.getMessage();
            if (msg != null && msg.contains("Unsupported JavaFX configuration")) {
                return false;
            }
            return existingFilter == null || existingFilter.isLoggable(record);
        });
    }
}
