package org.symdbg;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.logging.Formatter;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/** One line per record: time, level, source, message, then the stack trace if there is one. */
public class LogFormat extends Formatter {
    private static final DateTimeFormatter TIME =
            DateTimeFormatter.ofPattern("HH:mm:ss.SSS").withZone(ZoneId.systemDefault());

    /** Use this format for every handler on the root logger. */
    public static void setRootFormat() {
        var root = Logger.getLogger("");
        for (var h : root.getHandlers()) h.setFormatter(new LogFormat());
    }

    @Override
    public String format(LogRecord record) {
        var source = record.getLoggerName();
        if (record.getSourceClassName() != null) {
            source = record.getSourceClassName();
            var dot = source.lastIndexOf('.');
            if (dot != -1) source = source.substring(dot + 1);
            if (record.getSourceMethodName() != null) source += "." + record.getSourceMethodName();
        }
        var line =
                String.format(
                        "%s %s %s %s%n",
                        TIME.format(Instant.ofEpochMilli(record.getMillis())),
                        record.getLevel().getName(),
                        source,
                        formatMessage(record));
        if (record.getThrown() == null) return line;
        var trace = new StringWriter();
        record.getThrown().printStackTrace(new PrintWriter(trace));
        return line + trace;
    }
}
