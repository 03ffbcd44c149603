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

import java.util.concurrent.atomic.AtomicReference;

import org.apache.log4j.Logger;

import com.binrelay.replicator.database.NormalizedStatement;

/**
 * Decides whether schemas, tables and normalized statements are skipped. The
 * logic is as follows.
 * <p>
 * Schema statements (CREATE/DROP/ALTER DATABASE):
 * <ol>
 * <li>System schemas are skipped.</li>
 * <li>If the schema allow list is set, keep the schema if it matches the list
 * or if any table allow rule refers to it, so that the schema holding allowed
 * tables can be created and dropped downstream. Skip everything else.</li>
 * <li>Otherwise, if the schema deny list is set, skip the schema if it matches
 * the list or if any table deny rule refers to it.</li>
 * <li>Otherwise keep the schema.</li>
 * </ol>
 * Tables and row changes:
 * <ol>
 * <li>Tables in system schemas are skipped.</li>
 * <li>If the table allow list is set, keep the table if it matches the list or
 * its schema matches the schema allow list. Skip everything else.</li>
 * <li>Otherwise, if the table deny list is set, skip the table if it matches
 * the list or if its schema matches the schema deny list. A table that passes
 * both is still skipped when the schema allow list is set and does not match
 * its schema. Keep everything else.</li>
 * <li>Otherwise apply the schema allow list, or failing that the schema deny
 * list, to the table's schema.</li>
 * </ol>
 * Note the asymmetry under deny rules: a schema statement is skipped as soon
 * as a table deny rule refers to the schema, even though other tables of that
 * schema are kept.
 * <p>
 * Decisions depend only on the rule set and the names supplied. The rule set
 * is held in an atomic reference; {@link #reload(RuleSet)} swaps it as a unit
 * and each decision reads it once, so concurrent callers see either the old or
 * the new rules.
 */
public class SchemaTableFilter
{
    private static Logger                  logger = Logger.getLogger(SchemaTableFilter.class);

    private final AtomicReference<RuleSet> ruleSet;

    public SchemaTableFilter(RuleSet ruleSet)
    {
        this.ruleSet = new AtomicReference<RuleSet>(ruleSet);
    }

    /**
     * Installs new rules. Decisions already in progress finish with the old
     * rules.
     * 
     * @return The rules that were replaced
     */
    public RuleSet reload(RuleSet newRules)
    {
        RuleSet old = ruleSet.getAndSet(newRules);
        logger.info("Replaced filter rules: old=[" + old + "] new=["
                + newRules + "]");
        return old;
    }

    public RuleSet getRuleSet()
    {
        return ruleSet.get();
    }

    /**
     * Returns true if a statement on the schema itself should be skipped.
     */
    public boolean skipSchema(String schema)
    {
        boolean skip = skipSchema(ruleSet.get(), schema);
        if (logger.isDebugEnabled())
            logger.debug("Schema decision: schema=" + schema + " skip=" + skip);
        return skip;
    }

    /**
     * Returns true if a statement or row change on the table should be
     * skipped.
     */
    public boolean skipTable(String schema, String table)
    {
        boolean skip = skipTable(ruleSet.get(), schema, table);
        if (logger.isDebugEnabled())
            logger.debug("Table decision: schema=" + schema + " table="
                    + table + " skip=" + skip);
        return skip;
    }

    /**
     * Returns true if a normalized statement should be skipped, using the
     * schema decision for schema statements and the table decision for all
     * others.
     */
    public boolean skipStatement(NormalizedStatement statement)
    {
        if (statement.isSchemaScoped())
            return skipSchema(statement.getSchema());
        else
            return skipTable(statement.getSchema(), statement.getTable());
    }

    private static boolean skipSchema(RuleSet rules, String schema)
    {
        if (SystemSchemas.isSystemSchema(schema))
            return true;
        if (isUnknown(schema))
            return false;

        if (!rules.getSchemaAllow().isEmpty())
        {
            return !(rules.getSchemaAllow().match(schema, null) || rules
                    .getTableAllow().matchSchema(schema));
        }
        else if (!rules.getSchemaDeny().isEmpty())
        {
            return rules.getSchemaDeny().match(schema, null)
                    || rules.getTableDeny().matchSchema(schema);
        }
        return false;
    }

    private static boolean skipTable(RuleSet rules, String schema, String table)
    {
        if (SystemSchemas.isSystemSchema(schema))
            return true;
        if (isUnknown(schema))
            return false;

        if (!rules.getTableAllow().isEmpty())
        {
            return !(rules.getTableAllow().match(schema, table) || rules
                    .getSchemaAllow().match(schema, null));
        }
        else if (!rules.getTableDeny().isEmpty())
        {
            if (rules.getTableDeny().match(schema, table))
                return true;
            if (rules.getSchemaDeny().match(schema, null))
                return true;
            if (!rules.getSchemaAllow().isEmpty())
                return !rules.getSchemaAllow().match(schema, null);
            return false;
        }
        return skipSchemaOnly(rules, schema);
    }

    // Schema lists alone, without references from table rules.
    private static boolean skipSchemaOnly(RuleSet rules, String schema)
    {
        if (!rules.getSchemaAllow().isEmpty())
            return !rules.getSchemaAllow().match(schema, null);
        else if (!rules.getSchemaDeny().isEmpty())
            return rules.getSchemaDeny().match(schema, null);
        return false;
    }

    // Without a schema there is nothing to match against.
    private static boolean isUnknown(String schema)
    {
        return schema == null || schema.length() == 0;
    }
}
