/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.awaitlift.Token;

/** A block statement, {@code { statements }}. Node type is {@link Token#BLOCK}. */
public class Block extends Statement {

    private final List<Statement> statements = new ArrayList<>();

    {
        type = Token.BLOCK;
    }

    public Block() {}

    public Block(List<? extends Statement> statements) {
        for (Statement s : statements) {
            addStatement(s);
        }
    }

    /** Returns the statements; add through {@link #addStatement}. */
    public List<Statement> getStatements() {
        return Collections.unmodifiableList(statements);
    }

    /**
     * Adds a statement to the end of the block, and sets its parent to this node.
     *
     * @throws IllegalArgumentException if {@code statement} is {@code null}
     */
    public void addStatement(Statement statement) {
        assertNotNull(statement);
        statements.add(statement);
        statement.setParent(this);
    }

    @Override
    public String toSource(int depth) {
        if (statements.isEmpty()) {
            return makeIndent(depth) + "{}";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(makeIndent(depth)).append("{ ");
        for (Statement s : statements) {
            sb.append(s.toSource(0)).append(' ');
        }
        return sb.append('}').toString();
    }

    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this)) {
            for (Statement s : statements) {
                s.visit(v);
            }
        }
    }
}
