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
 * Assignment to a superclass member, {@code super.name = value}. Node type is {@link
 * Token#SUPER_PROPERTY_SET}.
 */
public class SuperPropertySet extends Expression {

    private final Member target;
    private Expression value;

    {
        type = Token.SUPER_PROPERTY_SET;
    }

    public SuperPropertySet(Member target, Expression value) {
        assertNotNull(target);
        this.target = target;
        setValue(value);
    }

    public Member getTarget() {
        return target;
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
        return "super." + target.getName() + " = " + value.toSource(0);
    }

    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this)) {
            value.visit(v);
        }
    }
}
