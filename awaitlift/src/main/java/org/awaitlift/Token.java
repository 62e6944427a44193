/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift;

/**
 * Node type constants for the resolved tree. Every {@link org.awaitlift.ast.TreeNode} carries one
 * of these, and the transforms dispatch on it.
 */
public class Token {

    public static final int ERROR = -1,
            // literals
            NUMBER = 1,
            STRING = 2,
            TRUE = 3,
            FALSE = 4,
            NULL = 5,
            THIS = 6,
            SYMBOL_LITERAL = 7,
            TYPE_LITERAL = 8,

            // variables, properties and statics
            VARIABLE_GET = 10,
            VARIABLE_SET = 11,
            PROPERTY_GET = 12,
            PROPERTY_SET = 13,
            SUPER_PROPERTY_GET = 14,
            SUPER_PROPERTY_SET = 15,
            STATIC_GET = 16,
            STATIC_SET = 17,
            STATIC_TEAR_OFF = 18,
            INSTANCE_TEAR_OFF = 19,

            // invocations
            METHOD_INVOCATION = 20,
            FUNCTION_INVOCATION = 21,
            LOCAL_FUNCTION_INVOCATION = 22,
            STATIC_INVOCATION = 23,
            CONSTRUCTOR_INVOCATION = 24,
            SUPER_METHOD_INVOCATION = 25,
            FUNCTION_TEAR_OFF = 26,

            // operators
            EQUALS_CALL = 30,
            EQUALS_NULL = 31,
            NOT = 32,
            IS = 33,
            AS = 34,
            THROW = 35,
            RETHROW = 36,
            STRING_CONCATENATION = 37,
            LIST_LITERAL = 38,
            MAP_LITERAL = 39,
            AND = 40,
            OR = 41,
            CONDITIONAL = 42,
            LET = 43,
            BLOCK_EXPRESSION = 44,
            AWAIT = 45,
            FUNCTION_EXPRESSION = 46,

            // statements
            EXPR_STATEMENT = 60,
            VARIABLE_DECLARATION = 61,
            BLOCK = 62,
            IF = 63,
            EMPTY = 64,
            RETURN = 65,
            CONTINUATION_POINT = 66,

            // auxiliary
            FUNCTION = 80,
            ARGUMENTS = 81,
            NAMED_EXPRESSION = 82,
            MAP_ENTRY = 83;

    /** Returns true if nodes of the given type are statements. */
    public static boolean isStatement(int type) {
        return type >= EXPR_STATEMENT && type <= CONTINUATION_POINT;
    }

    /** Returns a name for the token, for debugging and error messages. */
    public static String typeToName(int token) {
        switch (token) {
            case ERROR:
                return "ERROR";
            case NUMBER:
                return "NUMBER";
            case STRING:
                return "STRING";
            case TRUE:
                return "TRUE";
            case FALSE:
                return "FALSE";
            case NULL:
                return "NULL";
            case THIS:
                return "THIS";
            case SYMBOL_LITERAL:
                return "SYMBOL_LITERAL";
            case TYPE_LITERAL:
                return "TYPE_LITERAL";
            case VARIABLE_GET:
                return "VARIABLE_GET";
            case VARIABLE_SET:
                return "VARIABLE_SET";
            case PROPERTY_GET:
                return "PROPERTY_GET";
            case PROPERTY_SET:
                return "PROPERTY_SET";
            case SUPER_PROPERTY_GET:
                return "SUPER_PROPERTY_GET";
            case SUPER_PROPERTY_SET:
                return "SUPER_PROPERTY_SET";
            case STATIC_GET:
                return "STATIC_GET";
            case STATIC_SET:
                return "STATIC_SET";
            case STATIC_TEAR_OFF:
                return "STATIC_TEAR_OFF";
            case INSTANCE_TEAR_OFF:
                return "INSTANCE_TEAR_OFF";
            case METHOD_INVOCATION:
                return "METHOD_INVOCATION";
            case FUNCTION_INVOCATION:
                return "FUNCTION_INVOCATION";
            case LOCAL_FUNCTION_INVOCATION:
                return "LOCAL_FUNCTION_INVOCATION";
            case STATIC_INVOCATION:
                return "STATIC_INVOCATION";
            case CONSTRUCTOR_INVOCATION:
                return "CONSTRUCTOR_INVOCATION";
            case SUPER_METHOD_INVOCATION:
                return "SUPER_METHOD_INVOCATION";
            case FUNCTION_TEAR_OFF:
                return "FUNCTION_TEAR_OFF";
            case EQUALS_CALL:
                return "EQUALS_CALL";
            case EQUALS_NULL:
                return "EQUALS_NULL";
            case NOT:
                return "NOT";
            case IS:
                return "IS";
            case AS:
                return "AS";
            case THROW:
                return "THROW";
            case RETHROW:
                return "RETHROW";
            case STRING_CONCATENATION:
                return "STRING_CONCATENATION";
            case LIST_LITERAL:
                return "LIST_LITERAL";
            case MAP_LITERAL:
                return "MAP_LITERAL";
            case AND:
                return "AND";
            case OR:
                return "OR";
            case CONDITIONAL:
                return "CONDITIONAL";
            case LET:
                return "LET";
            case BLOCK_EXPRESSION:
                return "BLOCK_EXPRESSION";
            case AWAIT:
                return "AWAIT";
            case FUNCTION_EXPRESSION:
                return "FUNCTION_EXPRESSION";
            case EXPR_STATEMENT:
                return "EXPR_STATEMENT";
            case VARIABLE_DECLARATION:
                return "VARIABLE_DECLARATION";
            case BLOCK:
                return "BLOCK";
            case IF:
                return "IF";
            case EMPTY:
                return "EMPTY";
            case RETURN:
                return "RETURN";
            case CONTINUATION_POINT:
                return "CONTINUATION_POINT";
            case FUNCTION:
                return "FUNCTION";
            case ARGUMENTS:
                return "ARGUMENTS";
            case NAMED_EXPRESSION:
                return "NAMED_EXPRESSION";
            case MAP_ENTRY:
                return "MAP_ENTRY";
        }

        // Token without name
        throw new IllegalStateException(String.valueOf(token));
    }
}
