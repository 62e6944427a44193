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
 * Assignment to an instance property, {@code receiver.name = value}. Node type is {@link
 * Token#PROPERTY_SET}.
 */
public class PropertySet extends Expression {

    private Expression receiver;
    private final String name;
    private Expression value;

    {
        type = Token.PROPERTY_SET;
    }

    public PropertySet(Expression receiver, String name, Expression value) {
        assertNotNull(name);
        setReceiver(receiver);
        this.name = name;
        setValue(value);
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

    public Expression getValue() {
        return value;
    }

    public void setValue(Expression value) {
        assertNotNull(value);
        this.value = value;
        value.setParent(this);
    }

    @Override
    public StaticType getStaticType(StaticTypeContext context) {
        return value.getStaticType(context);
    }

    @Override
    public String toSource(int depth) {
        return receiver.toSource(0) + "." + name + " = " + value.toSource(0);
    }

    /** Visits this node, the receiver, and the value. */
    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this)) {
            receiver.visit(v);
            value.visit(v);
        }
    }
}
