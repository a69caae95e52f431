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

import org.apache.log4j.Logger;
import org.symcore.logging.SymLogger.CoreSymLogger;

/**
 * log4j 1.x backend for {@link SymLogger}. Loaded by name so that the
 * facade still works when log4j is missing from the classpath.
 */
public class SymLog4jLogger implements CoreSymLogger {

    // reported as the caller boundary so %C and %L point at calculus code
    private static final String FACADE_FQCN = SymLogger.class.getName();

    private static final Map<Level, org.apache.log4j.Level> s_levels = new EnumMap<>(Level.class);
    static {
        s_levels.put(Level.FATAL, org.apache.log4j.Level.FATAL);
        s_levels.put(Level.ERROR, org.apache.log4j.Level.ERROR);
        s_levels.put(Level.WARN,  org.apache.log4j.Level.WARN);
        s_levels.put(Level.INFO,  org.apache.log4j.Level.INFO);
        s_levels.put(Level.DEBUG, org.apache.log4j.Level.DEBUG);
        s_levels.put(Level.TRACE, org.apache.log4j.Level.TRACE);
        assert(s_levels.size() == Level.values().length);
    }

    private final Logger m_log4j;

    public SymLog4jLogger(String category) {
        m_log4j = Logger.getLogger(category);
    }

    @Override
    public boolean isEnabledFor(Level level) {
        return m_log4j.isEnabledFor(s_levels.get(level));
    }

    @Override
    public void log(Level level, Object message, Throwable t) {
        m_log4j.log(FACADE_FQCN, s_levels.get(level), message, t);
    }

    @Override
    public void setLevel(Level level) {
        m_log4j.setLevel(s_levels.get(level));
    }
}
