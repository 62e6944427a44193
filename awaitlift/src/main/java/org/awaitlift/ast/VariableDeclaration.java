/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.ast;

import org.awaitlift.Token;
import org.awaitlift.types.StaticType;

/**
 * A local variable declaration. It is a statement when it appears in a block and the bound
 * variable of a {@link Let}. Reads and writes refer to the declaration node itself, so the
 * declaration doubles as the variable's identity. Node type is {@link
 * Token#VARIABLE_DECLARATION}.
 *
 * <p>The declared type is mutable: the temporary slot allocator widens it to {@link
 * StaticType#DYNAMIC} when a slot is reused at an inconsistent type.
 */
public class VariableDeclaration extends Statement {

    private final String name;
    private StaticType declaredType;
    private Expression initializer;
    private boolean isFinal;
    private boolean isConst;

    {
        type = Token.VARIABLE_DECLARATION;
    }

    public VariableDeclaration(String name) {
        this(name, StaticType.DYNAMIC);
    }

    public VariableDeclaration(String name, StaticType declaredType) {
        this.name = name;
        setDeclaredType(declaredType);
    }

    public VariableDeclaration(String name, Expression initializer) {
        this(name, StaticType.DYNAMIC);
        setInitializer(initializer);
    }

    public VariableDeclaration(String name, StaticType declaredType, Expression initializer) {
        this(name, declaredType);
        setInitializer(initializer);
    }

    /** Returns the variable name, or {@code null} for a synthetic variable used for sequencing. */
    public String getName() {
        return name;
    }

    public StaticType getDeclaredType() {
        return declaredType;
    }

    public void setDeclaredType(StaticType declaredType) {
        assertNotNull(declaredType);
        this.declaredType = declaredType;
    }

    /** Returns the initializer, {@code null} if none */
    public Expression getInitializer() {
        return initializer;
    }

    public void setInitializer(Expression initializer) {
        this.initializer = initializer;
        if (initializer != null) initializer.setParent(this);
    }

    public boolean isFinal() {
        return isFinal;
    }

    public void setIsFinal(boolean isFinal) {
        this.isFinal = isFinal;
    }

    public boolean isConst() {
        return isConst;
    }

    public void setIsConst(boolean isConst) {
        this.isConst = isConst;
    }

    /** Returns the declaration without the trailing semicolon, as it appears in a {@link Let}. */
    public String toDeclarationSource() {
        StringBuilder sb = new StringBuilder();
        if (isConst) {
            sb.append("const ");
        } else if (isFinal) {
            sb.append("final ");
        }
        sb.append(declaredType).append(' ').append(name == null ? "_" : name);
        if (initializer != null) {
            sb.append(" = ").append(initializer.toSource(0));
        }
        return sb.toString();
    }

    @Override
    public String toSource(int depth) {
        return makeIndent(depth) + toDeclarationSource() + ";";
    }

    /** Visits this node, then the initializer if present. */
    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this) && initializer != null) {
            initializer.visit(v);
        }
    }
}
