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

/** AST node for a string literal. Node type is {@link Token#STRING}. */
public class StringLiteral extends Expression {

    private String value;

    {
        type = Token.STRING;
    }

    public StringLiteral(String value) {
        setValue(value);
    }

    /** Returns the string value, without quotes. */
    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        assertNotNull(value);
        this.value = value;
    }

    @Override
    public StaticType getStaticType(StaticTypeContext context) {
        return CoreTypes.STRING;
    }

    @Override
    public String toSource(int depth) {
        return '"' + value + '"';
    }

    @Override
    public void visit(NodeVisitor v) {
        v.visit(this);
    }
}
