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

/**
 * A SymLogger that doesn't log. Handy for callers that must pass a logger
 * but want the engine silent.
 */
public class SymNullLogger extends SymLogger {

    public SymNullLogger() {
        super(new CoreNullLogger());
    }

    static public class CoreNullLogger implements CoreSymLogger {
        @Override
        public boolean isEnabledFor(Level level) {
            return false;
        }

        @Override
        public void log(Level level, Object message, Throwable t) {}

        @Override
        public void setLevel(Level level) {}
    }
}
