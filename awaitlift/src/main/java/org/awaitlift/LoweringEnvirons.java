/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift;

/** Settings shared by all rewriters working on one compilation. */
public class LoweringEnvirons {

    public static final String DEFAULT_TEMPORARY_PREFIX = ":async_temporary_";

    private boolean printTrees;
    private String temporaryNamePrefix;

    public LoweringEnvirons() {
        printTrees = false;
        temporaryNamePrefix = DEFAULT_TEMPORARY_PREFIX;
    }

    /**
     * Creates environs from the {@code awaitlift.printTrees} and {@code
     * awaitlift.temporaryNamePrefix} system properties, falling back to the defaults.
     */
    public static LoweringEnvirons fromSystemProperties() {
        LoweringEnvirons env = new LoweringEnvirons();
        env.setPrintTrees(Boolean.getBoolean("awaitlift.printTrees"));
        String prefix = System.getProperty("awaitlift.temporaryNamePrefix");
        if (prefix != null && !prefix.isEmpty()) {
            env.setTemporaryNamePrefix(prefix);
        }
        return env;
    }

    /** Whether every lowered function body is printed to stdout. */
    public boolean isPrintTrees() {
        return printTrees;
    }

    public void setPrintTrees(boolean printTrees) {
        this.printTrees = printTrees;
    }

    public String getTemporaryNamePrefix() {
        return temporaryNamePrefix;
    }

    /**
     * Sets the prefix of temporary slot names; the slot index is appended to it.
     *
     * @throws IllegalArgumentException if the prefix is {@code null} or empty
     */
    public void setTemporaryNamePrefix(String temporaryNamePrefix) {
        if (temporaryNamePrefix == null || temporaryNamePrefix.isEmpty()) {
            throw new IllegalArgumentException("empty temporary name prefix");
        }
        this.temporaryNamePrefix = temporaryNamePrefix;
    }
}
