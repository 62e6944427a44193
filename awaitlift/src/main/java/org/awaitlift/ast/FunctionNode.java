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
import org.awaitlift.types.StaticType;

/**
 * A function: parameters, body and async marker. Top-level members and function literals share
 * this node. Node type is {@link Token#FUNCTION}.
 */
public class FunctionNode extends TreeNode {

    private final List<VariableDeclaration> parameters = new ArrayList<>();
    private Statement body;
    private AsyncMarker asyncMarker;
    private final StaticType returnType;

    {
        type = Token.FUNCTION;
    }

    public FunctionNode(
            List<VariableDeclaration> parameters,
            Statement body,
            AsyncMarker asyncMarker,
            StaticType returnType) {
        assertNotNull(asyncMarker);
        assertNotNull(returnType);
        for (VariableDeclaration parameter : parameters) {
            assertNotNull(parameter);
            parameter.setParent(this);
            this.parameters.add(parameter);
        }
        setBody(body);
        this.asyncMarker = asyncMarker;
        this.returnType = returnType;
    }

    public List<VariableDeclaration> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    public Statement getBody() {
        return body;
    }

    public void setBody(Statement body) {
        assertNotNull(body);
        this.body = body;
        body.setParent(this);
    }

    public AsyncMarker getAsyncMarker() {
        return asyncMarker;
    }

    public void setAsyncMarker(AsyncMarker asyncMarker) {
        assertNotNull(asyncMarker);
        this.asyncMarker = asyncMarker;
    }

    public boolean isAsync() {
        return asyncMarker == AsyncMarker.ASYNC;
    }

    public StaticType getReturnType() {
        return returnType;
    }

    @Override
    public String toSource(int depth) {
        StringBuilder sb = new StringBuilder();
        sb.append('(');
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(parameters.get(i).toDeclarationSource());
        }
        sb.append(')');
        if (isAsync()) {
            sb.append(" async");
        }
        sb.append(' ').append(body.toSource(0));
        return sb.toString();
    }

    /** Visits this node, the parameters, then the body. */
    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this)) {
            for (VariableDeclaration parameter : parameters) {
                parameter.visit(v);
            }
            body.visit(v);
        }
    }
}
