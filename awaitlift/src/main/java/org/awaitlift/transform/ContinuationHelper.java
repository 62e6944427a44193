/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.transform;

import java.util.Collections;
import org.awaitlift.ast.Arguments;
import org.awaitlift.ast.Expression;
import org.awaitlift.ast.Member;
import org.awaitlift.ast.StaticInvocation;
import org.awaitlift.types.StaticType;

/**
 * The well-known runtime members the lowered code calls. The driver supplies them; the rewriters
 * only read them, so one instance may be shared by every rewriter of a compilation.
 */
public class ContinuationHelper {

    public static final String AWAIT_HELPER_NAME = "_awaitHelper";
    public static final String UNSAFE_CAST_NAME = "unsafeCast";

    private final Member awaitHelper;
    private final Member unsafeCast;

    /**
     * @param awaitHelper {@code _awaitHelper(futureOrValue, thenContinuation, errorContinuation)}
     * @param unsafeCast {@code unsafeCast<T>(value)}, a cast that is never checked at run time
     */
    public ContinuationHelper(Member awaitHelper, Member unsafeCast) {
        if (awaitHelper == null || unsafeCast == null) {
            throw new IllegalArgumentException("helper members required");
        }
        this.awaitHelper = awaitHelper;
        this.unsafeCast = unsafeCast;
    }

    public static ContinuationHelper createDefault() {
        return new ContinuationHelper(
                new Member(AWAIT_HELPER_NAME, StaticType.DYNAMIC),
                new Member(UNSAFE_CAST_NAME, StaticType.DYNAMIC));
    }

    public Member getAwaitHelper() {
        return awaitHelper;
    }

    public Member getUnsafeCast() {
        return unsafeCast;
    }

    /** Builds {@code unsafeCast<type>(value)}, whose static type is {@code type}. */
    public Expression unsafeCast(Expression value, StaticType type) {
        Arguments arguments =
                new Arguments(Collections.singletonList(value), Collections.singletonList(type));
        return new StaticInvocation(unsafeCast, arguments, type);
    }
}
