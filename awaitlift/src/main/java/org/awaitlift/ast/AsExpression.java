/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.ast;

import org.awaitlift.Token;
import org.awaitlift.types.StaticType;
import org.awaitlift.types.StaticTypeContext;

/** Checked cast {@code operand as T}. Node type is {@link Token#AS}. */
public class AsExpression extends Expression {

    private Expression operand;
    private final StaticType targetType;

    {
        type = Token.AS;
    }

    public AsExpression(Expression operand, StaticType targetType) {
        assertNotNull(targetType);
        setOperand(operand);
        this.targetType = targetType;
    }

    public Expression getOperand() {
        return operand;
    }

    public void setOperand(Expression operand) {
        assertNotNull(operand);
        this.operand = operand;
        operand.setParent(this);
    }

    public StaticType getTargetType() {
        return targetType;
    }

    @Override
    public StaticType getStaticType(StaticTypeContext context) {
        return targetType;
    }

    @Override
    public String toSource(int depth) {
        return operand.toSource(0) + " as " + targetType;
    }

    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this)) {
            operand.visit(v);
        }
    }
}
