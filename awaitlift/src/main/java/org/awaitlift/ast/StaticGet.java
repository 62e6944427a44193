/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.ast;

import org.awaitlift.Token;
import org.awaitlift.types.StaticType;
import org.awaitlift.types.StaticTypeContext;

/** Read of a static field or top-level getter. Node type is {@link Token#STATIC_GET}. */
public class StaticGet extends Expression {

    private final Member target;

    {
        type = Token.STATIC_GET;
    }

    public StaticGet(Member target) {
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
        return target.getName();
    }

    @Override
    public void visit(NodeVisitor v) {
        v.visit(this);
    }
}
