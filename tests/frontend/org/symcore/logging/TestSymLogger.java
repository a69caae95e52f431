/* This file is part of SymCalc.
 * Copyright (C) 2008-2022 Volt Active Data Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining
 * a copy of this software and associated documentation files (the
 * "Software"), to deal in the Software without restriction, including
 * without limitation the rights to use, copy, modify, merge, publish,
 * distribute, sublicense, and/or sell copies of the Software, and to
 * permit persons to whom the Software is furnished to do so, subject to
 * the following conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
 * EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF
 * MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT.
 * IN NO EVENT SHALL THE AUTHORS BE LIABLE FOR ANY CLAIM, DAMAGES OR
 * OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE,
 * ARISING FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR
 * OTHER DEALINGS IN THE SOFTWARE.
 */


package org.symcore.logging;

import java.util.ArrayList;
import java.util.List;

import junit.framework.TestCase;

public class TestSymLogger extends TestCase {

    /** Keeps every message at or above its level. */
    static class RecordingLogger implements SymLogger.CoreSymLogger {
        Level m_level = Level.INFO;
        final List<Level> m_levels = new ArrayList<>();
        final List<String> m_messages = new ArrayList<>();
        final List<Throwable> m_throwables = new ArrayList<>();

        @Override
        public boolean isEnabledFor(Level level) {
            return level.ordinal() <= m_level.ordinal();
        }

        @Override
        public void log(Level level, Object message, Throwable t) {
            m_levels.add(level);
            m_messages.add(String.valueOf(message));
            m_throwables.add(t);
        }

        @Override
        public void setLevel(Level level) {
            m_level = level;
        }
    }

    static class RecordingSymLogger extends SymLogger {
        RecordingSymLogger(RecordingLogger core) {
            super(core);
        }
    }

    public void testFormattedMessages() {
        RecordingLogger core = new RecordingLogger();
        SymLogger log = new RecordingSymLogger(core);

        log.infoFmt("integrated %s in %d steps", "sin(x)", 3);
        log.infoFmt("no arguments");

        assertEquals(2, core.m_messages.size());
        assertEquals("integrated sin(x) in 3 steps", core.m_messages.get(0));
        assertEquals(Level.INFO, core.m_levels.get(0));
        assertNull(core.m_throwables.get(0));
        assertEquals("no arguments", core.m_messages.get(1));
    }

    public void testLevelFiltering() {
        RecordingLogger core = new RecordingLogger();
        SymLogger log = new RecordingSymLogger(core);

        log.debugFmt("hidden %s", "value");
        log.traceFmt("hidden %s", "too");
        assertTrue(core.m_messages.isEmpty());
        assertFalse(log.isDebugEnabled());
        assertFalse(log.isTraceEnabled());
        assertTrue(log.isEnabledFor(Level.INFO));

        log.setLevel(Level.TRACE);
        assertTrue(log.isTraceEnabled());
        log.traceFmt("now %s", "visible");
        assertEquals(1, core.m_messages.size());
        assertEquals("now visible", core.m_messages.get(0));
    }

    public void testBadFormatDoesNotThrow() {
        RecordingLogger core = new RecordingLogger();
        SymLogger log = new RecordingSymLogger(core);

        // %d with a string argument cannot be formatted
        log.infoFmt("count %d", "not a number");

        // the formatting error is reported, then the raw format is logged
        assertEquals(2, core.m_messages.size());
        assertEquals(Level.ERROR, core.m_levels.get(0));
        assertNotNull(core.m_throwables.get(0));
        assertEquals("count %d", core.m_messages.get(1));
    }

    public void testNullLoggerIsSilent() {
        SymLogger log = new SymNullLogger();
        assertFalse(log.isEnabledFor(Level.INFO));
        assertFalse(log.isEnabledFor(Level.FATAL));
        log.infoFmt("nothing %s", "happens");
    }

    public void testNoLoggingProperty() {
        String old = System.getProperty(SymLogger.NO_LOGGING_PROPERTY);
        System.setProperty(SymLogger.NO_LOGGING_PROPERTY, "true");
        try {
            SymLogger log = new SymLogger("TEST");
            assertTrue(log.m_logger instanceof SymNullLogger.CoreNullLogger);
        }
        finally {
            if (old == null) {
                System.clearProperty(SymLogger.NO_LOGGING_PROPERTY);
            }
            else {
                System.setProperty(SymLogger.NO_LOGGING_PROPERTY, old);
            }
        }
    }

    public void testLog4jIsPreferred() {
        SymLogger log = new SymLogger("TEST");
        if (!"true".equals(System.getProperty(SymLogger.NO_LOGGING_PROPERTY))) {
            assertTrue(log.m_logger instanceof SymLog4jLogger);
        }
    }
}
