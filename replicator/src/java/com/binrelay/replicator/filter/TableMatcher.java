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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.apache.log4j.Logger;

/**
 * Matches schema and table names against an ordered list of rules. Schema
 * rules are built from plain pattern specifications such as "test" or
 * "~^b.*"; table rules from schema/table pattern pairs.
 * <p>
 * Besides the rules themselves, the matcher indexes the schema patterns that
 * its rules reference: literal schema names go into a hash set and distinct
 * regular expressions into a list. This answers "does any rule refer to this
 * schema?" without a table name. Instances are immutable and may be shared
 * between threads.
 */
public class TableMatcher
{
    private static Logger          logger = Logger.getLogger(TableMatcher.class);

    private final List<FilterRule> rules;
    private final boolean          caseSensitive;
    private final Set<String>      literalSchemas;
    private final List<NamePattern> regexSchemas;

    /**
     * Creates a matcher from compiled rules.
     */
    public TableMatcher(List<FilterRule> rules, boolean caseSensitive)
    {
        this.rules = Collections.unmodifiableList(new ArrayList<FilterRule>(
                rules));
        this.caseSensitive = caseSensitive;

        Set<String> literals = new HashSet<String>();
        Set<String> regexSources = new HashSet<String>();
        List<NamePattern> regexes = new ArrayList<NamePattern>();
        for (FilterRule rule : rules)
        {
            NamePattern schema = rule.getSchemaPattern();
            if (schema.isLiteral())
                literals.add(normalize(schema.getSource()));
            else if (regexSources.add(schema.getSource()))
                regexes.add(schema);
        }
        this.literalSchemas = Collections.unmodifiableSet(literals);
        this.regexSchemas = Collections.unmodifiableList(regexes);
    }

    /**
     * Compiles schema rules.
     * 
     * @param listName Name of the list, used in error messages
     * @param specs Schema pattern specifications
     * @param caseSensitive Whether names compare case-sensitively
     * @throws FilterConfigurationException Thrown if a pattern is invalid
     */
    public static TableMatcher forSchemas(String listName, List<String> specs,
            boolean caseSensitive) throws FilterConfigurationException
    {
        List<FilterRule> rules = new ArrayList<FilterRule>();
        if (specs != null)
        {
            for (String spec : specs)
            {
                rules.add(new FilterRule(compile(listName, spec, caseSensitive),
                        null));
            }
        }
        return new TableMatcher(rules, caseSensitive);
    }

    /**
     * Compiles table rules.
     * 
     * @param listName Name of the list, used in error messages
     * @param specs Schema/table pattern pairs
     * @param caseSensitive Whether names compare case-sensitively
     * @throws FilterConfigurationException Thrown if a pattern is invalid or
     *             missing
     */
    public static TableMatcher forTables(String listName,
            List<TablePattern> specs, boolean caseSensitive)
            throws FilterConfigurationException
    {
        List<FilterRule> rules = new ArrayList<FilterRule>();
        if (specs != null)
        {
            for (TablePattern spec : specs)
            {
                if (spec.getSchema() == null || spec.getTable() == null)
                    throw new FilterConfigurationException("Table rule in "
                            + listName + " needs both schema and table: "
                            + spec);
                rules.add(new FilterRule(compile(listName, spec.getSchema(),
                        caseSensitive), compile(listName, spec.getTable(),
                        caseSensitive)));
            }
        }
        return new TableMatcher(rules, caseSensitive);
    }

    private static NamePattern compile(String listName, String spec,
            boolean caseSensitive) throws FilterConfigurationException
    {
        try
        {
            NamePattern pattern = NamePattern.compile(spec, caseSensitive);
            if (logger.isDebugEnabled())
                logger.debug("Compiled " + listName + " pattern: " + spec);
            return pattern;
        }
        catch (FilterConfigurationException e)
        {
            throw new FilterConfigurationException("Unable to compile "
                    + listName + " rule: " + e.getMessage(), spec, e);
        }
    }

    public boolean isEmpty()
    {
        return rules.isEmpty();
    }

    public List<FilterRule> getRules()
    {
        return rules;
    }

    /**
     * Returns true if any rule matches. For schema rules the table is ignored;
     * table rules need a non-null table.
     * 
     * @param schema Schema name
     * @param table Table name or null to match on schema only
     */
    public boolean match(String schema, String table)
    {
        for (FilterRule rule : rules)
        {
            if (rule.matches(schema, table))
            {
                if (logger.isDebugEnabled())
                    logger.debug("Matched rule " + rule + ": schema=" + schema
                            + " table=" + table);
                return true;
            }
        }
        return false;
    }

    /**
     * Returns true if any rule's schema pattern matches the schema, regardless
     * of table patterns.
     */
    public boolean matchSchema(String schema)
    {
        if (schema == null)
            return false;
        if (literalSchemas.contains(normalize(schema)))
            return true;
        for (NamePattern regex : regexSchemas)
        {
            if (regex.matches(schema))
                return true;
        }
        return false;
    }

    private String normalize(String name)
    {
        return caseSensitive ? name : name.toLowerCase(Locale.ROOT);
    }

    public String toString()
    {
        return this.getClass().getSimpleName() + ": " + rules;
    }
}
