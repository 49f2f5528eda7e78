package de.htwsaar.mediavault.cli.util;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.FileAppender;
import java.nio.file.Path;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Hängt zur Laufzeit einen Datei-Appender an den Logger {@code mediavault.file}.
 *
 * <p>Das Ziel ({@code <output>/mediavault.log}) ist erst nach dem Laden der Konfiguration bekannt
 * und kann deshalb nicht in {@code logback.xml} stehen. Ohne Logback als Backend passiert nichts.
 */
public final class FileLogSetup {

    public static final String LOGGER_NAME = "mediavault.file";
    public static final String LOG_FILE_NAME = "mediavault.log";

    private static final String APPENDER_NAME = "MEDIAVAULT_FILE";
    private static final String PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} %-5level [%X{task}] %msg%n";

    private FileLogSetup() {}

    /**
     * Schreibt ab jetzt die Zeilen von {@code mediavault.file} nach {@code <outputDir>/mediavault.log}.
     * Ein zuvor angehängter Appender wird ersetzt.
     *
     * @param outputDir Download-Wurzel
     * @return Pfad der Logdatei
     */
    public static synchronized Path attach(Path outputDir) {
        Path logFile = outputDir.resolve(LOG_FILE_NAME);
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext)) {
            return logFile;
        }
        LoggerContext context = (LoggerContext) factory;
        Logger logger = context.getLogger(LOGGER_NAME);
        detach(logger);

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(PATTERN);
        encoder.start();

        FileAppender<ILoggingEvent> appender = new FileAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setFile(logFile.toAbsolutePath().toString());
        appender.setAppend(true);
        appender.setEncoder(encoder);
        appender.start();

        logger.addAppender(appender);
        logger.setAdditive(false);
        return logFile;
    }

    /** Entfernt und stoppt den Datei-Appender (schließt die Logdatei). */
    public static synchronized void detach() {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext) {
            detach(((LoggerContext) factory).getLogger(LOGGER_NAME));
        }
    }

    private static void detach(Logger logger) {
        Appender<ILoggingEvent> old = logger.getAppender(APPENDER_NAME);
        if (old != null) {
            logger.detachAppender(old);
            old.stop();
        }
    }
}
