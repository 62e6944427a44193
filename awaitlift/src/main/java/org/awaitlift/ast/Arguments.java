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
 * The argument list of an invocation: type arguments, positional arguments and named arguments.
 * Positional arguments are evaluated before named ones, each group left to right. Node type is
 * {@link Token#ARGUMENTS}.
 */
public class Arguments extends TreeNode {

    private final List<StaticType> types;
    private final List<Expression> positional;
    private final List<NamedExpression> named;

    {
        type = Token.ARGUMENTS;
    }

    public Arguments(List<? extends Expression> positional) {
        this(
                positional,
                Collections.<StaticType>emptyList(),
                Collections.<NamedExpression>emptyList());
    }

    public Arguments(List<? extends Expression> positional, List<StaticType> types) {
        this(positional, types, Collections.<NamedExpression>emptyList());
    }

    public Arguments(
            List<? extends Expression> positional,
            List<StaticType> types,
            List<NamedExpression> named) {
        this.types = new ArrayList<>(types);
        this.positional = new ArrayList<>(positional.size());
        for (Expression arg : positional) {
            assertNotNull(arg);
            arg.setParent(this);
            this.positional.add(arg);
        }
        this.named = new ArrayList<>(named.size());
        for (NamedExpression arg : named) {
            assertNotNull(arg);
            arg.setParent(this);
            this.named.add(arg);
        }
    }

    public static Arguments empty() {
        return new Arguments(Collections.<Expression>emptyList());
    }

    public List<StaticType> getTypes() {
        return Collections.unmodifiableList(types);
    }

    /** Returns the positional arguments. Replace entries through {@link #setPositional}. */
    public List<Expression> getPositional() {
        return Collections.unmodifiableList(positional);
    }

    public void setPositional(int index, Expression arg) {
        assertNotNull(arg);
        positional.set(index, arg);
        arg.setParent(this);
    }

    public List<NamedExpression> getNamed() {
        return Collections.unmodifiableList(named);
    }

    @Override
    public String toSource(int depth) {
        StringBuilder sb = new StringBuilder();
        if (!types.isEmpty()) {
            sb.append('<');
            for (int i = 0; i < types.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(types.get(i));
            }
            sb.append('>');
        }
        sb.append('(');
        printList(positional, sb);
        if (!named.isEmpty()) {
            if (!positional.isEmpty()) sb.append(", ");
            printList(named, sb);
        }
        sb.append(')');
        return sb.toString();
    }

    /** Visits this node, the positional arguments, and the named arguments. */
    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this)) {
            for (Expression arg : positional) {
                arg.visit(v);
            }
            for (NamedExpression arg : named) {
                arg.visit(v);
            }
        }
    }
}
