/**
 * VMware Continuent Tungsten Replicator
 * Copyright (C) 2015 VMware, Inc. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Initial developer(s):
 * Contributor(s):
 */

package com.binrelay.replicator.filter;

import java.util.regex.Pattern;

import org.apache.log4j.Logger;

/**
 * Discards statement events that can never yield replicable DDL before they
 * reach the parser: transaction control, account and privilege management,
 * stored routine and trigger definitions, server administration, and any
 * statement issued while a system schema was current.
 */
public class QueryEventFilter
{
    private static Logger         logger          = Logger.getLogger(QueryEventFilter.class);

    // Leading whitespace and comments, including executable comments.
    private static final String   LEADING_NOISE   = "^\\s*(?:(?:/\\*.*?\\*/|#[^\\n]*(?:\\n|$)|--(?:\\s[^\\n]*)?(?:\\n|$))\\s*)*";

    private static final String   DEFINER         = "(?:DEFINER\\s*=\\s*\\S+\\s+)?";

    private static final String[] SKIPPED_PREFIXES = {"BEGIN", "COMMIT",
            "ROLLBACK", "SAVEPOINT", "RELEASE\\s+SAVEPOINT", "XA",
            "START\\s+TRANSACTION", "FLUSH", "OPTIMIZE", "ANALYZE", "REPAIR",
            "GRANT", "REVOKE", "(?:CREATE|DROP|ALTER|RENAME)\\s+USER",
            "SET\\s+PASSWORD", "(?:CREATE|DROP|ALTER)\\s+ROLE",
            "(?:CREATE|DROP|ALTER)\\s+" + DEFINER
                    + "(?:TRIGGER|PROCEDURE|FUNCTION|EVENT)",
            "(?:INSTALL|UNINSTALL)\\s+PLUGIN", "RESET", "PURGE",
            "CHANGE\\s+MASTER", "SHOW"                };

    private static final Pattern  SKIPPED         = Pattern.compile(
                                                          LEADING_NOISE
                                                                  + "(?:"
                                                                  + join(SKIPPED_PREFIXES)
                                                                  + ")\\b",
                                                          Pattern.CASE_INSENSITIVE
                                                                  | Pattern.DOTALL);

    private static final Pattern  BLANK           = Pattern.compile(LEADING_NOISE
                                                          + ";?\\s*$",
                                                          Pattern.DOTALL);

    private static String join(String[] alternatives)
    {
        StringBuilder sb = new StringBuilder();
        for (String alternative : alternatives)
        {
            if (sb.length() > 0)
                sb.append('|');
            sb.append(alternative);
        }
        return sb.toString();
    }

    /**
     * Returns true if the statement event should be discarded without further
     * processing.
     * 
     * @param sql Statement text
     * @param schema Schema that was current when the statement ran, may be
     *            null
     */
    public boolean skipQueryEvent(String sql, String schema)
    {
        boolean skip;
        String reason;
        if (sql == null || BLANK.matcher(sql).matches())
        {
            skip = true;
            reason = "empty statement";
        }
        else if (SystemSchemas.isSystemSchema(schema))
        {
            skip = true;
            reason = "system schema " + schema;
        }
        else if (SKIPPED.matcher(sql).lookingAt())
        {
            skip = true;
            reason = "non-replicated statement type";
        }
        else
        {
            skip = false;
            reason = null;
        }

        if (skip && logger.isDebugEnabled())
            logger.debug("Pre-filtered query (" + reason + "): " + sql);
        return skip;
    }
}
