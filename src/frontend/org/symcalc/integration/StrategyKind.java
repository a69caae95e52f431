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

package org.symcalc.integration;

import java.util.function.Function;

import org.symcalc.calculus.CalculusConfig;

import com.google.common.collect.ImmutableList;

/**
 * The integration strategies in priority order. Declaration order is the
 * order in which the pipeline tries them, so the specific single-term rules
 * come first and the sum rule, which splits a node and recurses on both
 * halves, comes last.
 */
public enum StrategyKind {
    POWER_RULE           (config -> new PowerRuleStrategy()),
    BASIC_TRIG           (config -> new BasicTrigStrategy()),
    EXPONENTIAL          (config -> new ExponentialStrategy()),
    CONSTANT_MULTIPLE    (config -> new ConstantMultipleStrategy()),
    SUBSTITUTION         (config -> new SubstitutionStrategy(new DerivativeMatcher(config))),
    INTEGRATION_BY_PARTS (config -> new IntegrationByPartsStrategy()),
    SUM_DIFFERENCE       (config -> new SumDifferenceStrategy());

    private final Function<CalculusConfig, IntegrationStrategy> m_factory;

    StrategyKind(Function<CalculusConfig, IntegrationStrategy> factory) {
        m_factory = factory;
    }

    public IntegrationStrategy create(CalculusConfig config) {
        return m_factory.apply(config);
    }

    /**
     * @return one instance of every strategy, in priority order
     */
    public static ImmutableList<IntegrationStrategy> createAll(CalculusConfig config) {
        ImmutableList.Builder<IntegrationStrategy> strategies = ImmutableList.builder();
        for (StrategyKind kind : values()) {
            strategies.add(kind.create(config));
        }
        return strategies.build();
    }
}
