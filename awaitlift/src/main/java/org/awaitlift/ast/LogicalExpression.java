/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.ast;

import org.awaitlift.Token;
import org.awaitlift.types.CoreTypes;
import org.awaitlift.types.StaticType;
import org.awaitlift.types.StaticTypeContext;

/**
 * Short-circuiting {@code left && right} or {@code left || right}. The right operand is evaluated
 * only when the left one does not decide the result. Node type is {@link Token#AND} or {@link
 * Token#OR}.
 */
public class LogicalExpression extends Expression {

    private Expression left;
    private Expression right;

    public LogicalExpression(int operator, Expression left, Expression right) {
        setType(operator);
        setLeft(left);
        setRight(right);
    }

    /**
     * Sets the operator.
     *
     * @throws IllegalArgumentException if {@code nodeType} is not {@link Token#AND} or {@link
     *     Token#OR}
     */
    @Override
    public void setType(int nodeType) {
        if (nodeType != Token.AND && nodeType != Token.OR)
            throw new IllegalArgumentException("Invalid operator: " + nodeType);
        type = nodeType;
    }

    public Expression getLeft() {
        return left;
    }

    public void setLeft(Expression left) {
        assertNotNull(left);
        this.left = left;
        left.setParent(this);
    }

    public Expression getRight() {
        return right;
    }

    public void setRight(Expression right) {
        assertNotNull(right);
        this.right = right;
        right.setParent(this);
    }

    @Override
    public StaticType getStaticType(StaticTypeContext context) {
        return CoreTypes.BOOL;
    }

    @Override
    public String toSource(int depth) {
        return left.toSource(0) + (type == Token.AND ? " && " : " || ") + right.toSource(0);
    }

    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this)) {
            left.visit(v);
            right.visit(v);
        }
    }
}
