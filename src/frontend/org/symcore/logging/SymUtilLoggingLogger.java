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

import java.util.EnumMap;
import java.util.Map;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import org.symcore.logging.SymLogger.CoreSymLogger;

/**
 * java.util.logging backend for {@link SymLogger}, used when log4j cannot
 * be loaded.
 */
public class SymUtilLoggingLogger implements CoreSymLogger {

    private static final Map<Level, java.util.logging.Level> s_levels = new EnumMap<>(Level.class);
    static {
        s_levels.put(Level.FATAL, java.util.logging.Level.SEVERE);
        s_levels.put(Level.ERROR, java.util.logging.Level.SEVERE);
        s_levels.put(Level.WARN,  java.util.logging.Level.WARNING);
        s_levels.put(Level.INFO,  java.util.logging.Level.INFO);
        s_levels.put(Level.DEBUG, java.util.logging.Level.FINE);
        s_levels.put(Level.TRACE, java.util.logging.Level.FINEST);
        assert(s_levels.size() == Level.values().length);
    }

    private final Logger m_julLogger;

    SymUtilLoggingLogger(String category) {
        m_julLogger = Logger.getLogger(category);
    }

    @Override
    public boolean isEnabledFor(Level level) {
        return m_julLogger.isLoggable(s_levels.get(level));
    }

    @Override
    public void log(Level level, Object message, Throwable t) {
        LogRecord record = new LogRecord(s_levels.get(level), String.valueOf(message));
        record.setLoggerName(m_julLogger.getName());
        record.setThrown(t);
        m_julLogger.log(record);
    }

    @Override
    public void setLevel(Level level) {
        m_julLogger.setLevel(s_levels.get(level));
    }
}
