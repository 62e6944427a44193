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

/**
 * AST node for a symbol literal such as {@code #foo}. Node type is {@link
 * Token#SYMBOL_LITERAL}.
 */
public class SymbolLiteral extends Expression {

    private final String value;

    {
        type = Token.SYMBOL_LITERAL;
    }

    public SymbolLiteral(String value) {
        assertNotNull(value);
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public StaticType getStaticType(StaticTypeContext context) {
        return CoreTypes.SYMBOL;
    }

    @Override
    public String toSource(int depth) {
        return "#" + value;
    }

    @Override
    public void visit(NodeVisitor v) {
        v.visit(this);
    }
}
