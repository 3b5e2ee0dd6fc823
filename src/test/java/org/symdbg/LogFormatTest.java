package org.symdbg;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.Test;

public class LogFormatTest {
    LogFormat format = new LogFormat();

    @Test
    public void oneLine() {
        var record = new LogRecord(Level.INFO, "Loaded %s");
        record.setSourceClassName("org.symdbg.symbols.ProcessSymbols");
        record.setSourceMethodName("setModules");
        var line = format.format(record);
        assertThat(line, containsString(" INFO ProcessSymbols.setModules Loaded %s"));
        assertThat(line, endsWith(System.lineSeparator()));
    }

    @Test
    public void stackTrace() {
        var record = new LogRecord(Level.SEVERE, "boom");
        record.setThrown(new IllegalStateException("broken"));
        assertThat(format.format(record), containsString("java.lang.IllegalStateException: broken"));
    }

    @Test
    public void rootHandlersUseFormat() {
        LogFormat.setRootFormat();
        for (var h : Logger.getLogger("").getHandlers()) {
            assertThat(h.getFormatter(), instanceOf(LogFormat.class));
        }
    }
}
