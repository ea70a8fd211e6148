package com.routermon.core;

import ch.qos.logback.classic.Level;

import ch.qos.logback.classic.Logger;

import ch.qos.logback.classic.LoggerContext;

import ch.qos.logback.classic.joran.JoranConfigurator;

import ch.qos.logback.core.joran.spi.JoranException;

import io.vertx.core.json.JsonObject;

import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * LoggingConfigurator - Configures application logging based on application.conf

 * Features:
 * - Enable/disable logging globally
 * - Set log level (TRACE, DEBUG, INFO, WARN, ERROR)
 * - Enable/disable file logging
 * - Enable/disable console logging
 * - Configure log file path

 * Configuration in application.conf:
 * logging {
 *   enabled = true                     # Enable/disable all logging
 *   level = "INFO"                     # Log level
 *   file.path = "logs/routermon.log"   # Log file path
 *   file.enabled = true                # Enable file logging
 *   console.enabled = true             # Enable console logging
 * }
 */
public class LoggingConfigurator
{

    private static final String APPLICATION_LOGGER = "com.routermon";

    /**
     * Configure logging based on application configuration
     *
     * @param config Application configuration JsonObject
     */
    public static void configure(JsonObject config)
    {
        var loggingConfig = config.getJsonObject("logging", new JsonObject());

        var fileConfig = loggingConfig.getJsonObject("file", new JsonObject());

        var consoleConfig = loggingConfig.getJsonObject("console", new JsonObject());

        var loggingEnabled = loggingConfig.getBoolean("enabled", true);

        var logLevel = loggingConfig.getString("level", "INFO");

        var fileEnabled = fileConfig.getBoolean("enabled", true);

        var consoleEnabled = consoleConfig.getBoolean("enabled", true);

        var filePath = fileConfig.getString("path", "logs/routermon.log");

        // System properties consumed by logback.xml
        System.setProperty("routermon.log.level", loggingEnabled ? logLevel : "OFF");

        System.setProperty("routermon.log.file.path", filePath);

        System.setProperty("routermon.log.console.appender", consoleEnabled ? "CONSOLE" : "NULL");

        System.setProperty("routermon.log.file.appender", fileEnabled ? "FILE" : "NULL");

        // Log directory must exist before the file appender starts
        if (fileEnabled && loggingEnabled)
        {
            var logDir = new File(filePath).getParentFile();

            if (logDir != null && !logDir.exists() && !logDir.mkdirs())
            {
                LoggerFactory.getLogger(LoggingConfigurator.class).warn("Could not create log directory {}", logDir);
            }
        }

        var loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();

        reload(loggerContext);

        var level = loggingEnabled ? Level.toLevel(logLevel, Level.INFO) : Level.OFF;

        loggerContext.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);

        loggerContext.getLogger(APPLICATION_LOGGER).setLevel(level);
    }

    /**
     * Re-reads logback.xml so the appender properties set above take effect.
     *
     * @param loggerContext active logback context
     */
    private static void reload(LoggerContext loggerContext)
    {
        var configuration = LoggingConfigurator.class.getResource("/logback.xml");

        if (configuration == null)
        {
            return;
        }

        try
        {
            var configurator = new JoranConfigurator();

            configurator.setContext(loggerContext);

            loggerContext.reset();

            configurator.doConfigure(configuration);
        }
        catch (JoranException exception)
        {
            LoggerFactory.getLogger(LoggingConfigurator.class).error("Error in reload: {}", exception.getMessage());
        }
    }

}
