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

import java.util.List;

import org.apache.log4j.Logger;

import com.binrelay.replicator.conf.ReplicatorConf;

/**
 * The compiled filter configuration: schema allow and deny lists and table
 * allow and deny lists. A rule set is immutable once built; configuration
 * changes build a new rule set rather than altering an existing one.
 */
public final class RuleSet
{
    private static Logger      logger = Logger.getLogger(RuleSet.class);

    private final TableMatcher schemaAllow;
    private final TableMatcher schemaDeny;
    private final TableMatcher tableAllow;
    private final TableMatcher tableDeny;
    private final boolean      caseSensitive;

    private RuleSet(TableMatcher schemaAllow, TableMatcher schemaDeny,
            TableMatcher tableAllow, TableMatcher tableDeny,
            boolean caseSensitive)
    {
        this.schemaAllow = schemaAllow;
        this.schemaDeny = schemaDeny;
        this.tableAllow = tableAllow;
        this.tableDeny = tableDeny;
        this.caseSensitive = caseSensitive;
    }

    /**
     * Builds a case-sensitive rule set.
     * 
     * @see #build(List, List, List, List, boolean)
     */
    public static RuleSet build(List<String> schemaAllow,
            List<String> schemaDeny, List<TablePattern> tableAllow,
            List<TablePattern> tableDeny) throws FilterConfigurationException
    {
        return build(schemaAllow, schemaDeny, tableAllow, tableDeny, true);
    }

    /**
     * Compiles every pattern in the four lists. Any list may be null or empty.
     * 
     * @throws FilterConfigurationException Thrown if any pattern is invalid;
     *             no rule set is produced in that case
     */
    public static RuleSet build(List<String> schemaAllow,
            List<String> schemaDeny, List<TablePattern> tableAllow,
            List<TablePattern> tableDeny, boolean caseSensitive)
            throws FilterConfigurationException
    {
        RuleSet rules = new RuleSet(TableMatcher.forSchemas(
                ReplicatorConf.DO_DB, schemaAllow, caseSensitive),
                TableMatcher.forSchemas(ReplicatorConf.IGNORE_DB, schemaDeny,
                        caseSensitive), TableMatcher.forTables(
                        ReplicatorConf.DO_TABLE, tableAllow, caseSensitive),
                TableMatcher.forTables(ReplicatorConf.IGNORE_TABLE, tableDeny,
                        caseSensitive), caseSensitive);
        logger.info("Built filter rules: " + rules);
        return rules;
    }

    /**
     * Returns a rule set with no rules, which filters only system schemas.
     */
    public static RuleSet empty()
    {
        try
        {
            return build(null, null, null, null, true);
        }
        catch (FilterConfigurationException e)
        {
            throw new IllegalStateException("Empty rule set failed to build",
                    e);
        }
    }

    public TableMatcher getSchemaAllow()
    {
        return schemaAllow;
    }

    public TableMatcher getSchemaDeny()
    {
        return schemaDeny;
    }

    public TableMatcher getTableAllow()
    {
        return tableAllow;
    }

    public TableMatcher getTableDeny()
    {
        return tableDeny;
    }

    public boolean isCaseSensitive()
    {
        return caseSensitive;
    }

    /** Returns true if no rules are configured in any list. */
    public boolean isEmpty()
    {
        return schemaAllow.isEmpty() && schemaDeny.isEmpty()
                && tableAllow.isEmpty() && tableDeny.isEmpty();
    }

    public String toString()
    {
        return ReplicatorConf.DO_DB + "=" + schemaAllow.getRules().size() + " "
                + ReplicatorConf.IGNORE_DB + "="
                + schemaDeny.getRules().size() + " " + ReplicatorConf.DO_TABLE
                + "=" + tableAllow.getRules().size() + " "
                + ReplicatorConf.IGNORE_TABLE + "="
                + tableDeny.getRules().size() + " case_sensitive="
                + caseSensitive;
    }
}
