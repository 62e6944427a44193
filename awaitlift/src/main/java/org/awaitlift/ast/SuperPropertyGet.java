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
 * Read of a superclass member, {@code super.name}. Node type is {@link
 * Token#SUPER_PROPERTY_GET}.
 */
public class SuperPropertyGet extends Expression {

    private final Member target;

    {
        type = Token.SUPER_PROPERTY_GET;
    }

    public SuperPropertyGet(Member target) {
        assertNotNull(target);
        this.target = target;
    }

    public Member getTarget() {
        return target;
    }

    @Override
    public StaticType getStaticType(StaticTypeContext context) {
        return target.getType();
    }

    @Override
    public String toSource(int depth) {
        return "super." + target.getName();
    }

    @Override
    public void visit(NodeVisitor v) {
        v.visit(this);
    }
}
