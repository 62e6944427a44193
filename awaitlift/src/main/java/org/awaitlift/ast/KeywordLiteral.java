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
 * AST node for keyword literals: currently, {@code this}, {@code null}, {@code true} and {@code
 * false}. Node type is one of {@link Token#THIS}, {@link Token#NULL}, {@link Token#TRUE} or {@link
 * Token#FALSE}.
 */
public class KeywordLiteral extends Expression {

    /**
     * Constructs a new KeywordLiteral
     *
     * @param nodeType the token type
     */
    public KeywordLiteral(int nodeType) {
        setType(nodeType);
    }

    public static KeywordLiteral of(boolean value) {
        return new KeywordLiteral(value ? Token.TRUE : Token.FALSE);
    }

    /**
     * Sets node token type
     *
     * @throws IllegalArgumentException if {@code nodeType} is unsupported
     */
    @Override
    public void setType(int nodeType) {
        if (!(nodeType == Token.THIS
                || nodeType == Token.NULL
                || nodeType == Token.TRUE
                || nodeType == Token.FALSE))
            throw new IllegalArgumentException("Invalid node type: " + nodeType);
        type = nodeType;
    }

    /** Returns true if the token type is {@link Token#TRUE} or {@link Token#FALSE}. */
    public boolean isBooleanLiteral() {
        return type == Token.TRUE || type == Token.FALSE;
    }

    @Override
    public StaticType getStaticType(StaticTypeContext context) {
        switch (getType()) {
            case Token.THIS:
                return context.getThisType();
            case Token.NULL:
                return CoreTypes.NULL;
            default:
                return CoreTypes.BOOL;
        }
    }

    @Override
    public String toSource(int depth) {
        switch (getType()) {
            case Token.THIS:
                return "this";
            case Token.NULL:
                return "null";
            case Token.TRUE:
                return "true";
            default:
                return "false";
        }
    }

    @Override
    public void visit(NodeVisitor v) {
        v.visit(this);
    }
}
