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

import java.util.List;

import org.symcalc.types.ExpressionType;
import org.symcalc.types.FunctionType;

import com.google.common.collect.ImmutableList;

/**
 * Static builders for expression trees, plus a few structural queries
 * shared by the calculus code.
 */
public final class ExpressionUtil {

    private ExpressionUtil() {}

    public static ConstantValueExpression constant(double value) {
        return new ConstantValueExpression(value);
    }

    public static VariableExpression variable(String name) {
        return new VariableExpression(name);
    }

    public static OperatorExpression add(AbstractExpression left, AbstractExpression right) {
        return new OperatorExpression(ExpressionType.OPERATOR_PLUS, left, right);
    }

    public static OperatorExpression subtract(AbstractExpression left, AbstractExpression right) {
        return new OperatorExpression(ExpressionType.OPERATOR_MINUS, left, right);
    }

    public static OperatorExpression multiply(AbstractExpression left, AbstractExpression right) {
        return new OperatorExpression(ExpressionType.OPERATOR_MULTIPLY, left, right);
    }

    public static OperatorExpression divide(AbstractExpression left, AbstractExpression right) {
        return new OperatorExpression(ExpressionType.OPERATOR_DIVIDE, left, right);
    }

    public static OperatorExpression pow(AbstractExpression base, AbstractExpression exponent) {
        return new OperatorExpression(ExpressionType.OPERATOR_POWER, base, exponent);
    }

    public static OperatorExpression pow(AbstractExpression base, double exponent) {
        return pow(base, constant(exponent));
    }

    public static OperatorExpression negate(AbstractExpression operand) {
        return new OperatorExpression(ExpressionType.OPERATOR_UNARY_MINUS, operand, null);
    }

    /**
     * Build the CASE WHEN node: {@code condition ? whenTrue : whenFalse}.
     */
    public static OperatorExpression conditional(AbstractExpression condition,
                                                 AbstractExpression whenTrue,
                                                 AbstractExpression whenFalse) {
        OperatorExpression alternative =
                new OperatorExpression(ExpressionType.OPERATOR_ALTERNATIVE, whenTrue, whenFalse);
        return new OperatorExpression(ExpressionType.OPERATOR_CASE_WHEN, condition, alternative);
    }

    public static ComparisonExpression compare(ExpressionType type,
                                               AbstractExpression left,
                                               AbstractExpression right) {
        return new ComparisonExpression(type, left, right);
    }

    public static FunctionExpression function(FunctionType function, AbstractExpression operand) {
        return new FunctionExpression(function, operand);
    }

    public static FunctionExpression sin(AbstractExpression operand) {
        return function(FunctionType.SIN, operand);
    }

    public static FunctionExpression cos(AbstractExpression operand) {
        return function(FunctionType.COS, operand);
    }

    public static FunctionExpression tan(AbstractExpression operand) {
        return function(FunctionType.TAN, operand);
    }

    public static FunctionExpression sec(AbstractExpression operand) {
        return function(FunctionType.SEC, operand);
    }

    public static FunctionExpression csc(AbstractExpression operand) {
        return function(FunctionType.CSC, operand);
    }

    public static FunctionExpression cot(AbstractExpression operand) {
        return function(FunctionType.COT, operand);
    }

    public static FunctionExpression exp(AbstractExpression operand) {
        return function(FunctionType.EXP, operand);
    }

    public static FunctionExpression ln(AbstractExpression operand) {
        return function(FunctionType.LN, operand);
    }

    public static FunctionExpression asin(AbstractExpression operand) {
        return function(FunctionType.ASIN, operand);
    }

    public static FunctionExpression acos(AbstractExpression operand) {
        return function(FunctionType.ACOS, operand);
    }

    public static FunctionExpression atan(AbstractExpression operand) {
        return function(FunctionType.ATAN, operand);
    }

    public static FunctionExpression sqrt(AbstractExpression operand) {
        return function(FunctionType.SQRT, operand);
    }

    /**
     * @return true if expr is exactly the given variable
     */
    public static boolean isVariable(AbstractExpression expr, VariableExpression variable) {
        return variable.equals(expr);
    }

    /**
     * @return true if expr does not depend on the variable
     */
    public static boolean isConstant(AbstractExpression expr, VariableExpression variable) {
        return ! expr.containsVariable(variable);
    }

    public static boolean isLiteral(AbstractExpression expr, double value) {
        return expr instanceof ConstantValueExpression && ((ConstantValueExpression) expr).hasValue(value);
    }

    public static boolean isFunction(AbstractExpression expr, FunctionType function) {
        return expr instanceof FunctionExpression && ((FunctionExpression) expr).isFunction(function);
    }

    /**
     * @return true if expr is a power whose base is exactly the variable
     */
    public static boolean isPowerOf(AbstractExpression expr, VariableExpression variable) {
        return expr.getExpressionType() == ExpressionType.OPERATOR_POWER
                && isVariable(expr.getLeft(), variable);
    }

    /**
     * Flatten nested products, (a*b)*c or a*(b*c), into [a, b, c] in
     * left to right order. Anything else is a single factor.
     */
    public static List<AbstractExpression> flattenMultiply(AbstractExpression expr) {
        ImmutableList.Builder<AbstractExpression> factors = ImmutableList.builder();
        collectFactors(expr, factors);
        return factors.build();
    }

    private static void collectFactors(AbstractExpression expr, ImmutableList.Builder<AbstractExpression> factors) {
        if (expr.getExpressionType() != ExpressionType.OPERATOR_MULTIPLY) {
            factors.add(expr);
            return;
        }
        collectFactors(expr.getLeft(), factors);
        collectFactors(expr.getRight(), factors);
    }

    /**
     * Rebuild a left-nested product from factors; the empty product is 1.
     */
    public static AbstractExpression product(List<AbstractExpression> factors) {
        if (factors.isEmpty()) {
            return ConstantValueExpression.ONE;
        }
        AbstractExpression result = factors.get(0);
        for (int ii = 1; ii < factors.size(); ii++) {
            result = multiply(result, factors.get(ii));
        }
        return result;
    }
}
