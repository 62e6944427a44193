/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.ast;

import org.awaitlift.types.StaticType;
import org.awaitlift.types.StaticTypeContext;

/** Base class for the invocation forms. The static result type is resolved at construction. */
public abstract class InvocationExpression extends Expression {

    private Arguments arguments;
    private final StaticType resultType;

    protected InvocationExpression(Arguments arguments, StaticType resultType) {
        assertNotNull(resultType);
        setArguments(arguments);
        this.resultType = resultType;
    }

    public Arguments getArguments() {
        return arguments;
    }

    public void setArguments(Arguments arguments) {
        assertNotNull(arguments);
        this.arguments = arguments;
        arguments.setParent(this);
    }

    @Override
    public StaticType getStaticType(StaticTypeContext context) {
        return resultType;
    }
}
