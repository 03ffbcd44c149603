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

package com.binrelay.replicator.conf;

/**
 * Property names and defaults used to configure the replicate filter.
 */
public class ReplicatorConf
{
    /** Prefix shared by all replicate filter properties. */
    static public final String FILTER_REPLICATE_PREFIX             = "replicator.filter.replicate.";

    /** Comma separated schema patterns to replicate. */
    static public final String DO_DB                               = "do_db";

    /** Comma separated schema patterns to ignore. */
    static public final String IGNORE_DB                           = "ignore_db";

    /**
     * Indexed table rules to replicate: do_table.N.schema and do_table.N.table.
     */
    static public final String DO_TABLE                            = "do_table";

    /**
     * Indexed table rules to ignore: ignore_table.N.schema and
     * ignore_table.N.table.
     */
    static public final String IGNORE_TABLE                        = "ignore_table";

    /** Suffix for the schema pattern of an indexed table rule. */
    static public final String TABLE_RULE_SCHEMA                   = "schema";

    /** Suffix for the table pattern of an indexed table rule. */
    static public final String TABLE_RULE_TABLE                    = "table";

    /** Whether literal and regex patterns compare case-sensitively. */
    static public final String CASE_SENSITIVE                      = "case_sensitive";
    static public final String CASE_SENSITIVE_DEFAULT              = "true";

    /** Whether a DDL parse error stops processing or drops the statement. */
    static public final String ABORT_ON_PARSE_ERROR                = "abort_on_parse_error";
    static public final String ABORT_ON_PARSE_ERROR_DEFAULT        = "true";

    /**
     * Whether statements that are not DDL go to the applier. They do only if
     * the current schema is known and passes the schema rules.
     */
    static public final String PASS_THROUGH_NON_DDL                = "pass_through_non_ddl";
    static public final String PASS_THROUGH_NON_DDL_DEFAULT        = "false";

    /** Prefix marking a pattern as a regular expression. */
    static public final String REGEX_MARKER                        = "~";
}
