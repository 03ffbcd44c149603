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

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringTokenizer;
import java.util.TreeMap;

import org.apache.log4j.Logger;

import com.binrelay.common.config.PropertyException;
import com.binrelay.common.config.RelayProperties;
import com.binrelay.replicator.ReplicatorException;
import com.binrelay.replicator.applier.Applier;
import com.binrelay.replicator.conf.ReplicatorConf;
import com.binrelay.replicator.database.DdlParser;
import com.binrelay.replicator.database.DdlResolver;
import com.binrelay.replicator.database.NormalizedStatement;
import com.binrelay.replicator.database.ResolvedDdl;
import com.binrelay.replicator.database.SqlParseException;
import com.binrelay.replicator.event.QueryEvent;
import com.binrelay.replicator.event.ReplEvent;
import com.binrelay.replicator.event.RowsEvent;

/**
 * Implements a filter to either apply or ignore operations on particular
 * schemas and/or tables, then hands what survives to an applier. Schema lists
 * are comma separated patterns; table rules are schema/table pattern pairs. A
 * pattern is a literal name, or a regular expression if it starts with "~",
 * for example "~^b.*" for all schemas starting with b.
 * <p>
 * Each statement event goes through three steps:
 * <ol>
 * <li>Statements that never carry replicable DDL (transaction control, grants,
 * and so on) and statements run in a system schema are dropped.</li>
 * <li>The statement is resolved into single-target DDL statements. A statement
 * that is not DDL is dropped, unless pass-through is enabled and the current
 * schema is known and not skipped by the schema rules.</li>
 * <li>Each resolved statement is kept or skipped on its own.</li>
 * </ol>
 * Row change events are kept or skipped by schema and table. Output order
 * follows input order.
 * <p>
 * Life cycle: call setters or {@link #configure(RelayProperties)}, then
 * {@link #prepare()}, then {@link #filter(ReplEvent)} for each event, then
 * {@link #release()}.
 */
public class ReplicateFilter
{
    private static Logger          logger            = Logger.getLogger(ReplicateFilter.class);

    private String                 doDb;
    private String                 ignoreDb;
    private List<TablePattern>     doTables          = new ArrayList<TablePattern>();
    private List<TablePattern>     ignoreTables      = new ArrayList<TablePattern>();
    private boolean                caseSensitive     = Boolean
                                                             .parseBoolean(ReplicatorConf.CASE_SENSITIVE_DEFAULT);
    private boolean                abortOnParseError = Boolean
                                                             .parseBoolean(ReplicatorConf.ABORT_ON_PARSE_ERROR_DEFAULT);
    private boolean                passThroughNonDdl = Boolean
                                                             .parseBoolean(ReplicatorConf.PASS_THROUGH_NON_DDL_DEFAULT);

    private Applier                applier;
    private DdlResolver            resolver          = new DdlResolver();
    private final QueryEventFilter queryFilter       = new QueryEventFilter();
    private final FilterStatistics statistics        = new FilterStatistics();
    private SchemaTableFilter      filter;

    /**
     * Define a comma-separated list of schema patterns to replicate. If set,
     * only operations on matching schemas are forwarded, except for tables
     * allowed by table rules.
     */
    public void setDoDb(String doDb)
    {
        this.doDb = doDb;
    }

    /**
     * Define a comma-separated list of schema patterns to ignore.
     */
    public void setIgnoreDb(String ignoreDb)
    {
        this.ignoreDb = ignoreDb;
    }

    /** Define table rules to replicate. */
    public void setDoTables(List<TablePattern> doTables)
    {
        this.doTables = new ArrayList<TablePattern>(doTables);
    }

    /** Define table rules to ignore. */
    public void setIgnoreTables(List<TablePattern> ignoreTables)
    {
        this.ignoreTables = new ArrayList<TablePattern>(ignoreTables);
    }

    public void addDoTable(String schema, String table)
    {
        doTables.add(new TablePattern(schema, table));
    }

    public void addIgnoreTable(String schema, String table)
    {
        ignoreTables.add(new TablePattern(schema, table));
    }

    /**
     * If false, names compare without regard to case. Defaults to true.
     */
    public void setCaseSensitive(boolean caseSensitive)
    {
        this.caseSensitive = caseSensitive;
    }

    /**
     * If true, a DDL parse error is thrown to the caller; otherwise the
     * statement is logged and dropped. Defaults to true.
     */
    public void setAbortOnParseError(boolean abortOnParseError)
    {
        this.abortOnParseError = abortOnParseError;
    }

    /**
     * If true, statements that are not DDL go to the applier when their
     * current schema is known and passes the schema rules. Defaults to false,
     * which drops them.
     */
    public void setPassThroughNonDdl(boolean passThroughNonDdl)
    {
        this.passThroughNonDdl = passThroughNonDdl;
    }

    public void setApplier(Applier applier)
    {
        this.applier = applier;
    }

    /** Replaces the default MySQL DDL parser. */
    public void setDdlParser(DdlParser parser)
    {
        this.resolver = new DdlResolver(parser);
    }

    /**
     * Loads settings from properties starting with
     * {@link ReplicatorConf#FILTER_REPLICATE_PREFIX}. Simple settings map to
     * setters; table rules are indexed pairs such as do_table.1.schema and
     * do_table.1.table, ordered by index.
     * 
     * @throws FilterConfigurationException Thrown if a property is malformed
     */
    public void configure(RelayProperties properties)
            throws FilterConfigurationException
    {
        RelayProperties filterProps = properties.subset(
                ReplicatorConf.FILTER_REPLICATE_PREFIX, true);
        try
        {
            filterProps.applyProperties(this, true);
        }
        catch (PropertyException e)
        {
            throw new FilterConfigurationException(
                    "Invalid replicate filter property: " + e.getMessage(),
                    e.getKey(), e);
        }
        doTables = readTableRules(filterProps, ReplicatorConf.DO_TABLE);
        ignoreTables = readTableRules(filterProps, ReplicatorConf.IGNORE_TABLE);

        if (logger.isDebugEnabled())
            logger.debug("Configured replicate filter: do_db=" + doDb
                    + " ignore_db=" + ignoreDb + " do_table=" + doTables
                    + " ignore_table=" + ignoreTables);
    }

    /**
     * Loads settings from a properties file.
     * 
     * @throws FilterConfigurationException Thrown if the file cannot be read
     *             or a property is malformed
     * @see #configure(RelayProperties)
     */
    public void configure(File file) throws FilterConfigurationException
    {
        RelayProperties properties;
        try
        {
            properties = RelayProperties.loadFile(file);
        }
        catch (IOException e)
        {
            throw new FilterConfigurationException(
                    "Unable to read replicate filter configuration: "
                            + file.getAbsolutePath(), file.getPath(), e);
        }
        configure(properties);
    }

    // Collects list.N.schema / list.N.table pairs in index order.
    private static List<TablePattern> readTableRules(RelayProperties props,
            String listName) throws FilterConfigurationException
    {
        RelayProperties ruleProps = props.subset(listName + ".", true);
        TreeMap<Integer, String[]> byIndex = new TreeMap<Integer, String[]>();
        for (String key : ruleProps.keyNames())
        {
            int dot = key.indexOf('.');
            String part = dot == -1 ? "" : key.substring(dot + 1);
            int index;
            try
            {
                index = Integer.parseInt(dot == -1 ? key : key.substring(0,
                        dot));
            }
            catch (NumberFormatException e)
            {
                throw new FilterConfigurationException(
                        "Table rule property needs a numeric index: "
                                + listName + "." + key, key, e);
            }

            String[] pair = byIndex.get(index);
            if (pair == null)
            {
                pair = new String[2];
                byIndex.put(index, pair);
            }
            if (ReplicatorConf.TABLE_RULE_SCHEMA.equals(part))
                pair[0] = ruleProps.getString(key).trim();
            else if (ReplicatorConf.TABLE_RULE_TABLE.equals(part))
                pair[1] = ruleProps.getString(key).trim();
            else
                throw new FilterConfigurationException(
                        "Unknown table rule property: " + listName + "."
                                + key);
        }

        List<TablePattern> rules = new ArrayList<TablePattern>();
        for (Map.Entry<Integer, String[]> entry : byIndex.entrySet())
        {
            String[] pair = entry.getValue();
            if (pair[0] == null || pair[1] == null)
                throw new FilterConfigurationException("Table rule "
                        + listName + "." + entry.getKey()
                        + " needs both schema and table");
            rules.add(new TablePattern(pair[0], pair[1]));
        }
        return rules;
    }

    /**
     * Compiles the current settings into a rule set.
     * 
     * @throws FilterConfigurationException Thrown if any pattern is invalid
     */
    public RuleSet buildRuleSet() throws FilterConfigurationException
    {
        return RuleSet.build(split(doDb), split(ignoreDb), doTables,
                ignoreTables, caseSensitive);
    }

    private static List<String> split(String patterns)
    {
        List<String> list = new ArrayList<String>();
        if (patterns == null)
            return list;
        StringTokenizer st = new StringTokenizer(patterns, ", \t\n\r\f");
        while (st.hasMoreTokens())
            list.add(st.nextToken());
        return list;
    }

    /**
     * Compiles rules and readies the filter. The filter does not start with
     * rules that fail to compile.
     * 
     * @throws FilterConfigurationException Thrown if there is no applier or a
     *             pattern is invalid
     */
    public void prepare() throws FilterConfigurationException
    {
        if (logger.isDebugEnabled())
            logger.debug("Preparing Replicate Filter");

        if (applier == null)
            throw new FilterConfigurationException(
                    "No applier set for replicate filter");
        filter = new SchemaTableFilter(buildRuleSet());
    }

    /**
     * Builds rules from new properties and installs them in place of the
     * current ones. If the new rules do not compile, the current rules stay
     * in force.
     * 
     * @throws FilterConfigurationException Thrown if the new rules are invalid
     */
    public void reconfigure(RelayProperties properties)
            throws FilterConfigurationException
    {
        ReplicateFilter staging = new ReplicateFilter();
        staging.configure(properties);
        RuleSet rules = staging.buildRuleSet();
        getSchemaTableFilter().reload(rules);
    }

    /**
     * Filters one event, passing whatever survives to the applier.
     * 
     * @throws SqlParseException Thrown if a DDL statement cannot be parsed and
     *             the filter is set to abort on parse errors
     * @throws ReplicatorException Thrown if the applier fails
     */
    public void filter(ReplEvent event) throws ReplicatorException
    {
        if (event instanceof RowsEvent)
            filterRows((RowsEvent) event);
        else if (event instanceof QueryEvent)
            filterQuery((QueryEvent) event);
        else
            throw new ReplicatorException("Unsupported event type: "
                    + event.getClass().getName());
    }

    private void filterRows(RowsEvent event) throws ReplicatorException
    {
        if (getSchemaTableFilter().skipTable(event.getSchemaName(),
                event.getTableName()))
        {
            if (logger.isDebugEnabled())
                logger.debug("Filtering event: " + event);
            statistics.incrementSkipped();
            return;
        }
        statistics.incrementKept();
        applier.applyRows(event);
    }

    private void filterQuery(QueryEvent event) throws ReplicatorException
    {
        SchemaTableFilter schemaTableFilter = getSchemaTableFilter();
        String query = event.getQuery();
        String schema = event.getDefaultSchema();

        if (queryFilter.skipQueryEvent(query, schema))
        {
            statistics.incrementPreFiltered();
            return;
        }

        ResolvedDdl resolved;
        try
        {
            resolved = resolver.resolve(query, schema);
        }
        catch (SqlParseException e)
        {
            statistics.incrementParseFailures();
            if (abortOnParseError)
                throw e;
            logger.warn("Dropping statement that could not be parsed: seqno="
                    + event.getSeqno() + " error=" + e.getMessage()
                    + " query=" + event.getQuerySummary());
            return;
        }

        if (!resolved.isDdl())
        {
            if (passThroughNonDdl && schema != null && schema.length() > 0
                    && !schemaTableFilter.skipSchema(schema))
            {
                statistics.incrementPassedThrough();
                applier.applyPassThrough(event);
            }
            else
            {
                if (logger.isDebugEnabled())
                    logger.debug("Dropping statement that is not DDL: seqno="
                            + event.getSeqno() + " query="
                            + event.getQuerySummary());
                statistics.incrementNonDdlDropped();
            }
            return;
        }

        for (NormalizedStatement statement : resolved.getStatements())
        {
            if (statement.getSchema() == null)
            {
                logger.warn("No schema found for statement, cannot filter: seqno="
                        + event.getSeqno() + " statement=" + statement.getSql());
            }

            if (schemaTableFilter.skipStatement(statement))
            {
                if (logger.isDebugEnabled())
                    logger.debug("Filtering statement: " + statement);
                statistics.incrementSkipped();
                continue;
            }
            statistics.incrementKept();
            applier.applyStatement(event, statement);
        }
    }

    /**
     * Returns the decision engine.
     * 
     * @throws IllegalStateException Thrown if the filter is not prepared
     */
    public SchemaTableFilter getSchemaTableFilter()
    {
        if (filter == null)
            throw new IllegalStateException("Replicate filter is not prepared");
        return filter;
    }

    public FilterStatistics getStatistics()
    {
        return statistics;
    }

    /**
     * Releases the filter and logs what it did.
     */
    public void release()
    {
        logger.info("Releasing replicate filter: " + statistics);
        filter = null;
    }
}
