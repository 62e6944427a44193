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

/** Equality test {@code left == right}. Node type is {@link Token#EQUALS_CALL}. */
public class EqualsCall extends Expression {

    private Expression left;
    private Expression right;

    {
        type = Token.EQUALS_CALL;
    }

    public EqualsCall(Expression left, Expression right) {
        setLeft(left);
        setRight(right);
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
        return left.toSource(0) + " == " + right.toSource(0);
    }

    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this)) {
            left.visit(v);
            right.visit(v);
        }
    }
}
