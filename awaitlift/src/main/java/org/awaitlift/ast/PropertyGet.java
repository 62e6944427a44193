/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.ast;

import org.awaitlift.Token;
import org.awaitlift.types.StaticType;
import org.awaitlift.types.StaticTypeContext;

/** Read of an instance property, {@code receiver.name}. Node type is {@link Token#PROPERTY_GET}. */
public class PropertyGet extends Expression {

    private Expression receiver;
    private final String name;
    private final StaticType resultType;

    {
        type = Token.PROPERTY_GET;
    }

    public PropertyGet(Expression receiver, String name, StaticType resultType) {
        assertNotNull(name);
        assertNotNull(resultType);
        setReceiver(receiver);
        this.name = name;
        this.resultType = resultType;
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
        return resultType;
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
