/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.ast;

import org.awaitlift.Token;
import org.awaitlift.types.StaticType;

/** Call of a static or top-level procedure. Node type is {@link Token#STATIC_INVOCATION}. */
public class StaticInvocation extends InvocationExpression {

    private final Member target;

    {
        type = Token.STATIC_INVOCATION;
    }

    /** Creates a call whose static type is the target's declared result type. */
    public StaticInvocation(Member target, Arguments arguments) {
        this(target, arguments, target.getType());
    }

    /** Creates a call of a generic target, with the result type already instantiated. */
    public StaticInvocation(Member target, Arguments arguments, StaticType resultType) {
        super(arguments, resultType);
        assertNotNull(target);
        this.target = target;
    }

    public Member getTarget() {
        return target;
    }

    @Override
    public String toSource(int depth) {
        return target.getName() + getArguments().toSource(0);
    }

    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this)) {
            getArguments().visit(v);
        }
    }
}
