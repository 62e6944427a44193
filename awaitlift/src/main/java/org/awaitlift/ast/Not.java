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

/** Boolean negation {@code !operand}. Node type is {@link Token#NOT}. */
public class Not extends Expression {

    private Expression operand;

    {
        type = Token.NOT;
    }

    public Not(Expression operand) {
        setOperand(operand);
    }

    public Expression getOperand() {
        return operand;
    }

    public void setOperand(Expression operand) {
        assertNotNull(operand);
        this.operand = operand;
        operand.setParent(this);
    }

    @Override
    public StaticType getStaticType(StaticTypeContext context) {
        return CoreTypes.BOOL;
    }

    @Override
    public String toSource(int depth) {
        return "!" + operand.toSource(0);
    }

    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this)) {
            operand.visit(v);
        }
    }
}
