/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.tests;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.awaitlift.LoweringEnvirons;
import org.awaitlift.ast.FunctionNode;
import org.awaitlift.transform.AsyncFunctionRewriter;
import org.awaitlift.transform.ContinuationHelper;
import org.awaitlift.types.StaticTypeContext;

/** Runs a freshly built function once as written and once lowered. */
public class LoweringHarness {

    /** Result value and recorded events of one run. */
    public static final class Outcome {
        public final Object value;
        public final List<String> events;

        Outcome(Object value, List<String> events) {
            this.value = value;
            this.events = new ArrayList<>(events);
        }

        @Override
        public String toString() {
            return value + " " + events;
        }
    }

    private final ContinuationHelper helper = ContinuationHelper.createDefault();
    private final Consumer<TreeInterpreter> setup;

    /** @param setup defines the procedures and static fields a run can use */
    public LoweringHarness(Consumer<TreeInterpreter> setup) {
        this.setup = setup;
    }

    public Outcome original(Supplier<FunctionNode> factory) {
        TreeInterpreter interpreter = newInterpreter();
        Object value = interpreter.run(factory.get());
        return new Outcome(value, interpreter.getEvents());
    }

    public Outcome lowered(Supplier<FunctionNode> factory) {
        FunctionNode function = factory.get();
        AsyncFunctionRewriter rewriter =
                new AsyncFunctionRewriter(helper, new StaticTypeContext(), new LoweringEnvirons());
        rewriter.rewrite(function);
        TreeInterpreter interpreter = newInterpreter();
        interpreter.setAsyncResult(rewriter.getExpressionRewriter().getAsyncResult());
        Object value = interpreter.run(function);
        return new Outcome(value, interpreter.getEvents());
    }

    private TreeInterpreter newInterpreter() {
        TreeInterpreter interpreter = new TreeInterpreter(helper);
        setup.accept(interpreter);
        return interpreter;
    }
}
