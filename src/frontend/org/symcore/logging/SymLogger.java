/* This file is part of SymCalc.
 * Copyright (C) 2008-2022 Volt Active Data Inc.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with SymCalc.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.symcore.logging;

import java.lang.reflect.Constructor;
import java.util.Arrays;

/**
 * Class that implements the core functionality of a Log4j logger
 * or a java.util.logging logger. The point is that it should work
 * whether log4j is in the classpath or not.
 *
 * All logging happens synchronously on the caller's thread. The calculus
 * code never blocks or hands work to other threads, so there is no message
 * ordering to preserve beyond program order.
 */
public class SymLogger {
    final CoreSymLogger m_logger;

    static final String NO_LOGGING_PROPERTY = "symcalc_no_logging";

    /*
     * Abstraction of core functionality shared between Log4j and
     * java.util.logging.
     */
    static interface CoreSymLogger {
        public boolean isEnabledFor(Level level);
        public void log(Level level, Object message, Throwable t);
        public void setLevel(Level level);
    }

    private void log(Level level, String format, Object[] args) {
        if (!m_logger.isEnabledFor(level)) {
            return;
        }
        m_logger.log(level, formatString(format, args), null);
    }

    /*
     * Safe string formatter
     */
    private String formatString(String format, Object[] args) {
        try {
            return String.format(format, args);
        } catch (RuntimeException ex1) {
            String err = String.format("Error formatting log message '%s' with arguments '%s'",
                                       format, Arrays.toString(args));
            m_logger.log(Level.ERROR, err, ex1);
            return format; // skip the arguments, we've logged them already
        }
    }

    /**
     * Messages are a format plus arguments. Formatting is skipped when the
     * level is disabled.
     */
    public void infoFmt(String format, Object... args) {
        log(Level.INFO, format, args);
    }

    public void debugFmt(String format, Object... args) {
        log(Level.DEBUG, format, args);
    }

    public void traceFmt(String format, Object... args) {
        log(Level.TRACE, format, args);
    }

    /**
     * The logging methods check the level anyway, so these are only worth
     * calling when building the arguments is expensive, for instance
     * rendering a large expression tree.
     */
    public boolean isDebugEnabled() {
        return m_logger.isEnabledFor(Level.DEBUG);
    }

    public boolean isTraceEnabled() {
        return m_logger.isEnabledFor(Level.TRACE);
    }

    public boolean isEnabledFor(Level level) {
        return m_logger.isEnabledFor(level);
    }

    public void setLevel(Level level) {
        m_logger.setLevel(level);
    }

    /**
     * Try to load the Log4j logger without importing it. Falls back
     * to java.util.logging when log4j cannot be loaded.
     * @param classname The id of the logger.
     */
    public SymLogger(String classname) {
        // quick out for when we want no logging whatsoever
        if ("true".equals(System.getProperty(NO_LOGGING_PROPERTY))) {
            m_logger = new SymNullLogger.CoreNullLogger();
            return;
        }

        m_logger = loadCoreLogger(classname);
    }

    /**
     * Constructor used by SymNullLogger
     */
    protected SymLogger(CoreSymLogger logger) {
        assert(logger != null);
        m_logger = logger;
    }

    private static CoreSymLogger loadCoreLogger(String classname) {
        // any exception thrown here just means log4j is not usable
        try {
            Class<?> loggerClz = Class.forName("org.symcore.logging.SymLog4jLogger");
            Constructor<?> constructor = loggerClz.getConstructor(String.class);
            return (CoreSymLogger) constructor.newInstance(classname);
        }
        catch (ReflectiveOperationException | LinkageError e) {
            return new SymUtilLoggingLogger(classname);
        }
    }
}
