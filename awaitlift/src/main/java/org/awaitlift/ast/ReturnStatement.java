/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.ast;

import org.awaitlift.Token;

/** Return statement. Node type is {@link Token#RETURN}. */
public class ReturnStatement extends Statement {

    private Expression expression;

    {
        type = Token.RETURN;
    }

    public ReturnStatement() {}

    public ReturnStatement(Expression expression) {
        setExpression(expression);
    }

    /** Returns return value, {@code null} if return value was not specified */
    public Expression getExpression() {
        return expression;
    }

    public void setExpression(Expression expression) {
        this.expression = expression;
        if (expression != null) expression.setParent(this);
    }

    @Override
    public String toSource(int depth) {
        if (expression == null) {
            return makeIndent(depth) + "return;";
        }
        return makeIndent(depth) + "return " + expression.toSource(0) + ";";
    }

    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this) && expression != null) {
            expression.visit(v);
        }
    }
}
