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
 * {@code rethrow} of the exception caught by the innermost enclosing catch clause. Node type is
 * {@link Token#RETHROW}.
 */
public class Rethrow extends Expression {

    {
        type = Token.RETHROW;
    }

    public Rethrow() {}

    @Override
    public StaticType getStaticType(StaticTypeContext context) {
        return StaticType.NEVER;
    }

    @Override
    public String toSource(int depth) {
        return "rethrow";
    }

    @Override
    public void visit(NodeVisitor v) {
        v.visit(this);
    }
}
