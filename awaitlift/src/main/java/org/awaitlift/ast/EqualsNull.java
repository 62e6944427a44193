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

/** Null test {@code expression == null}. Node type is {@link Token#EQUALS_NULL}. */
public class EqualsNull extends Expression {

    private Expression expression;

    {
        type = Token.EQUALS_NULL;
    }

    public EqualsNull(Expression expression) {
        setExpression(expression);
    }

    public Expression getExpression() {
        return expression;
    }

    public void setExpression(Expression expression) {
        assertNotNull(expression);
        this.expression = expression;
        expression.setParent(this);
    }

    @Override
    public StaticType getStaticType(StaticTypeContext context) {
        return CoreTypes.BOOL;
    }

    @Override
    public String toSource(int depth) {
        return expression.toSource(0) + " == null";
    }

    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this)) {
            expression.visit(v);
        }
    }
}
