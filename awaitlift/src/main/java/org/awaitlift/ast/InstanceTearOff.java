/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.ast;

import org.awaitlift.Token;
import org.awaitlift.types.StaticType;
import org.awaitlift.types.StaticTypeContext;

/**
 * An instance method bound to its receiver, {@code receiver.name} without a call. Node type is
 * {@link Token#INSTANCE_TEAR_OFF}.
 */
public class InstanceTearOff extends Expression {

    private Expression receiver;
    private final String name;
    private final StaticType functionType;

    {
        type = Token.INSTANCE_TEAR_OFF;
    }

    public InstanceTearOff(Expression receiver, String name, StaticType functionType) {
        assertNotNull(name);
        assertNotNull(functionType);
        setReceiver(receiver);
        this.name = name;
        this.functionType = functionType;
    }

    public Expression getReceiver() {
        return receiver;
    }

    public void setReceiver(Expression receiver) {
        assertNotNull(receiver);
        this.receiver = receiver;
        receiver.setParent(this);
    }

    public String getName() {
        return name;
    }

    @Override
    public StaticType getStaticType(StaticTypeContext context) {
        return functionType;
    }

    @Override
    public String toSource(int depth) {
        return receiver.toSource(0) + "." + name;
    }

    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this)) {
            receiver.visit(v);
        }
    }
}
