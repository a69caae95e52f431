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

package org.symcalc.expressions;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

import org.symcalc.calculus.Differentiator;
import org.symcalc.exceptions.EvaluationException;
import org.symcalc.exceptions.ValidationError;
import org.symcalc.integration.SymbolicIntegration;
import org.symcalc.types.ExpressionType;

import com.google.common.collect.ImmutableSet;

/**
 * Base class of the expression tree. Nodes are immutable: every
 * transformation (simplification, differentiation, integration) builds
 * new nodes and may share unchanged subtrees with its input.
 */
public abstract class AbstractExpression {

    protected final ExpressionType m_type;
    protected final AbstractExpression m_left;
    protected final AbstractExpression m_right;

    protected AbstractExpression(ExpressionType type) {
        this(type, null, null);
    }

    protected AbstractExpression(ExpressionType type, AbstractExpression left, AbstractExpression right) {
        m_type = type;
        m_left = left;
        m_right = right;
    }

    public void validate() {
        //
        // Validate our children first
        //
        if (m_left != null) {
            m_left.validate();
        }
        if (m_right != null) {
            m_right.validate();
        }

        //
        // Expression Type
        //
        if (m_type == null) {
            throw new ValidationError("The ExpressionType for '%s' is NULL", explain());
        }

        if (m_type == ExpressionType.INVALID) {
            throw new ValidationError("The ExpressionType for '%s' is %s", explain(), m_type);
        }

        //
        // Since it is possible for an AbstractExpression to be built
        // with any ExpressionType, we do a simple check to make sure that it is the right class
        //
        Class<?> check_class = m_type.getExpressionClass();
        if (!check_class.isInstance(this)) {
            throw new ValidationError("Expression '%s' is class type '%s' but needs to be '%s'", explain(),
                    getClass().getSimpleName(), check_class.getSimpleName());
        }
    }

    /**
     * @return the type
     */
    public ExpressionType getExpressionType() {
        return m_type;
    }

    /**
     * @return the left
     */
    public AbstractExpression getLeft() {
        return m_left;
    }

    /**
     * @return the right
     */
    public AbstractExpression getRight() {
        return m_right;
    }

    /**
     * Compute the numeric value of this expression.
     * @param bindings values for the free variables, by name
     * @throws EvaluationException if a variable has no binding
     */
    public abstract double evaluate(Map<String, Double> bindings);

    /**
     * Evaluate with no variables bound. Only succeeds for expressions that
     * are constant.
     */
    public double evaluate() {
        return evaluate(Collections.<String, Double>emptyMap());
    }

    /**
     * Apply local algebraic identities bottom up: constant folding, additive
     * and multiplicative identities, and moving literal factors and negations
     * to the front of a product. Never changes the value of the expression.
     */
    public abstract AbstractExpression simplify();

    /**
     * @return the free variables reachable from this node
     */
    public Set<VariableExpression> getVariableTerms() {
        ImmutableSet.Builder<VariableExpression> builder = ImmutableSet.builder();
        collectVariableTerms(builder);
        return builder.build();
    }

    protected void collectVariableTerms(ImmutableSet.Builder<VariableExpression> builder) {
        if (m_left != null) {
            m_left.collectVariableTerms(builder);
        }
        if (m_right != null) {
            m_right.collectVariableTerms(builder);
        }
    }

    public boolean containsVariable(VariableExpression variable) {
        return getVariableTerms().contains(variable);
    }

    public AbstractExpression differentiate(VariableExpression variable) {
        return Differentiator.differentiate(this, variable);
    }

    /**
     * @throws org.symcalc.exceptions.UnsupportedExpressionException if
     *         no antiderivative can be found
     */
    public AbstractExpression integrate(VariableExpression variable) {
        return SymbolicIntegration.integrate(this, variable);
    }

    /**
     * Render this expression in the canonical infix form, fully
     * parenthesized, e.g. {@code ((2 * x) + sin(x))}.
     */
    public abstract String explain();

    @Override
    public String toString() {
        return explain();
    }

    private static final String INDENT = "  | ";

    /**
     * Multi-line dump of the tree with node classes and types, for debug logging.
     */
    public String toTreeString() {
        StringBuilder sb = new StringBuilder();
        toTreeStringHelper("", sb);
        return sb.toString();
    }

    /**
     * Return a node name to help out toTreeString. Subclasses
     * can chime in if they have a notion to.
     */
    protected String getExpressionNodeNameForToString() {
        return getClass().getSimpleName();
    }

    private void toTreeStringHelper(String linePrefix, StringBuilder sb) {
        sb.append(linePrefix);
        sb.append(getExpressionNodeNameForToString()).append(" [")
                .append(getExpressionType().toString()).append("]\n");

        if (m_left != null) {
            sb.append(linePrefix).append("Left:\n");
            m_left.toTreeStringHelper(linePrefix + INDENT, sb);
        }

        if (m_right != null) {
            sb.append(linePrefix).append("Right:\n");
            m_right.toTreeStringHelper(linePrefix + INDENT, sb);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (! (obj instanceof AbstractExpression)) {
            return false;
        }

        AbstractExpression expr = (AbstractExpression) obj;

        if (m_type != expr.m_type) {
            return false;
        }

        if (! hasEqualAttributes(expr)) {
            return false;
        }

        // The derived classes have verified that any added attributes are identical.

        // Check that the presence, or lack, of children is the same
        if ((m_left == null) != (expr.m_left == null)) {
            return false;
        }

        if ((m_right == null) != (expr.m_right == null)) {
            return false;
        }

        // Check that the children identify themselves as equal
        if (expr.m_left != null && ! expr.m_left.equals(m_left)) {
            return false;
        }
        if (expr.m_right != null && ! expr.m_right.equals(m_right)) {
            return false;
        }

        return true;
    }

    // Derived classes that define attributes should compare them in their
    // refinements of this method.
    // This implementation is provided as a convenience for Operators et. al.
    // that have no attributes that could differ.
    protected boolean hasEqualAttributes(AbstractExpression expr) {
        return true;
    }

    @Override
    public int hashCode() {
        // based on implementation of equals
        int result = 0;
        // hash the children
        if (m_left != null) {
            result += m_left.hashCode();
        }
        if (m_right != null) {
            result += 31 * m_right.hashCode();
        }
        if (m_type != null) {
            result += m_type.hashCode();
        }
        return result;
    }
}
