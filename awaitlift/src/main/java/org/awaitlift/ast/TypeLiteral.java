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

/** AST node for a type used as a value. Node type is {@link Token#TYPE_LITERAL}. */
public class TypeLiteral extends Expression {

    private final StaticType literalType;

    {
        type = Token.TYPE_LITERAL;
    }

    public TypeLiteral(StaticType literalType) {
        assertNotNull(literalType);
        this.literalType = literalType;
    }

    public StaticType getLiteralType() {
        return literalType;
    }

    @Override
    public StaticType getStaticType(StaticTypeContext context) {
        return CoreTypes.TYPE;
    }

    @Override
    public String toSource(int depth) {
        return literalType.toString();
    }

    @Override
    public void visit(NodeVisitor v) {
        v.visit(this);
    }
}
