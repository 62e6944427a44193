/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.transform;

import org.awaitlift.LoweringEnvirons;
import org.awaitlift.Token;
import org.awaitlift.ast.FunctionNode;
import org.awaitlift.types.StaticTypeContext;

/**
 * Entry point of the lowering. An async function is lowered by a fresh {@link
 * AsyncFunctionRewriter}; a sync function is searched for nested function literals, each of which
 * is transformed in turn. Every function body gets its own rewriter, so temporary numbering never
 * leaks between a function and the functions nested in it.
 */
public class RecursiveContinuationRewriter {

    private final ContinuationHelper helper;
    private final StaticTypeContext staticTypeContext;
    private final LoweringEnvirons env;

    public RecursiveContinuationRewriter(
            ContinuationHelper helper, StaticTypeContext staticTypeContext, LoweringEnvirons env) {
        this.helper = helper;
        this.staticTypeContext = staticTypeContext;
        this.env = env;
    }

    public FunctionNode transform(FunctionNode function) {
        if (function.isAsync()) {
            new AsyncFunctionRewriter(helper, staticTypeContext, env).rewrite(function);
            return function;
        }
        function.getBody()
                .visit(
                        node -> {
                            if (node.getType() == Token.FUNCTION) {
                                transform((FunctionNode) node);
                                return false;
                            }
                            return true;
                        });
        return function;
    }
}
