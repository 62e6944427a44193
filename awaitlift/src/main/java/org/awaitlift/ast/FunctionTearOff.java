/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.ast;

import org.awaitlift.Token;
import org.awaitlift.types.StaticType;
import org.awaitlift.types.StaticTypeContext;

/** {@code receiver.call} on a function value. Node type is {@link Token#FUNCTION_TEAR_OFF}. */
public class FunctionTearOff extends Expression {

    private Expression receiver;

    {
        type = Token.FUNCTION_TEAR_OFF;
    }

    public FunctionTearOff(Expression receiver) {
        setReceiver(receiver);
    }

    public Expression getReceiver() {
        return receiver;
    }

    public void setReceiver(Expression receiver) {
        assertNotNull(receiver);
        this.receiver = receiver;
        receiver.setParent(this);
    }

    /** The tear-off has the receiver's own function type. */
    @Override
    public StaticType getStaticType(StaticTypeContext context) {
        return receiver.getStaticType(context);
    }

    @Override
    public String toSource(int depth) {
        return receiver.toSource(0) + ".call";
    }

    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this)) {
            receiver.visit(v);
        }
    }
}
