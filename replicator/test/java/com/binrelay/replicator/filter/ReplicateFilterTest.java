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
import java.io.FileWriter;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

import junit.framework.TestCase;

import com.binrelay.common.config.RelayProperties;
import com.binrelay.replicator.ReplicatorException;
import com.binrelay.replicator.conf.ReplicatorConf;
import com.binrelay.replicator.database.NormalizedStatement;
import com.binrelay.replicator.database.SqlParseException;
import com.binrelay.replicator.database.StatementKind;
import com.binrelay.replicator.event.QueryEvent;
import com.binrelay.replicator.event.RowsEvent;

/**
 * This class implements a test of the ReplicateFilter class. It checks the
 * basic semantics of dropping and allowing various combinations of schema names
 * and tables. Test cases check row updates as well as statements.
 */
public class ReplicateFilterTest extends TestCase
{
    private static final String[] DB_NAMES     = {"s1", "s2", "btest", "b1",
            "stest", "st"                      };

    private FilterVerificationHelper filterHelper = new FilterVerificationHelper();
    private long                     seqno;

    /**
     * Setup.
     */
    public void setUp() throws Exception
    {
        filterHelper = new FilterVerificationHelper();
        seqno = 0;
    }

    /**
     * Verify that the filter allows events through if no properties are set.
     */
    public void testUnspecifiedProperties() throws Exception
    {
        ReplicateFilter rf = new ReplicateFilter();
        filterHelper.setFilter(rf);

        verifyStmtIgnore("insert into bar(val) values(1)", "foo");
        assertEquals(1, rf.getStatistics().getNonDdlDropped());

        verifyStmtAccept("create database foo", null);
        verifyStmtAccept("drop table foo.bar", null);
        verifyRowsAccept("foo", "bar");
        verifyRowsIgnore("mysql", "user");
        filterHelper.done();
    }

    /**
     * Verify that we allow operations on schemas in a schema allow list,
     * including regular expressions.
     */
    public void testSelectDb() throws Exception
    {
        ReplicateFilter rf = new ReplicateFilter();
        rf.setDoDb("~^b.*,s1,stest");
        filterHelper.setFilter(rf);

        boolean[] skipped = {false, true, false, false, false, true};
        for (int i = 0; i < DB_NAMES.length; i++)
        {
            verifyStmt("create database " + DB_NAMES[i], "", skipped[i]);
            verifyStmt("drop database " + DB_NAMES[i], "", skipped[i]);
        }
        filterHelper.done();
    }

    /**
     * Verify that we ignore operations on schemas in a schema deny list. The
     * outcome is the complement of the allow list test.
     */
    public void testIgnoreDb() throws Exception
    {
        ReplicateFilter rf = new ReplicateFilter();
        rf.setIgnoreDb("~^b.*,s1,stest");
        filterHelper.setFilter(rf);

        boolean[] skipped = {true, false, true, true, true, false};
        for (int i = 0; i < DB_NAMES.length; i++)
        {
            verifyStmt("create database " + DB_NAMES[i], "", skipped[i]);
            verifyStmt("drop database " + DB_NAMES[i], "", skipped[i]);
        }
        filterHelper.done();
    }

    /**
     * Verify a table allow list combined with a schema allow list, across
     * statements and row changes.
     */
    public void testSelectTable() throws Exception
    {
        ReplicateFilter rf = new ReplicateFilter();
        rf.setDoDb("t2");
        rf.addDoTable("stest", "log");
        rf.addDoTable("stest", "~^t.*");
        filterHelper.setFilter(rf);

        verifyStmtIgnore("create database s1", "");
        verifyStmtIgnore("create table s1.log(id int)", "");
        verifyStmtIgnore("drop database s1", "");
        verifyStmtIgnore("create table mysql.test(id int)", "");
        verifyStmtIgnore("drop table mysql.test", "");

        verifyStmtAccept("create database stest", "");
        verifyStmtAccept("create table stest.log(id int)", "");
        verifyStmtAccept("create table stest.t(id int)", "");
        verifyStmtIgnore("create table stest.log2(id int)", "");

        verifyRowsAccept("stest", "t");
        verifyRowsAccept("stest", "log");
        verifyRowsIgnore("stest", "log2");

        List<String> kept = keptTables(filter(
                "drop table stest.log,stest.t,stest.log2", ""));
        assertEquals("[log, t]", kept.toString());

        verifyStmtAccept("drop database stest", "");

        verifyStmtAccept("create database t2", "");
        verifyStmtAccept("create table t2.log(id int)", "");
        verifyStmtAccept("create table t2.log1(id int)", "");
        verifyRowsAccept("t2", "log1");
        kept = keptTables(filter("drop table t2.log, t2.log1", ""));
        assertEquals("[log, log1]", kept.toString());
        verifyStmtAccept("drop database t2", "");
        filterHelper.done();
    }

    /**
     * Verify a table deny list combined with a schema deny list. A schema with
     * table deny rules is skipped for schema statements even though some of
     * its tables pass.
     */
    public void testIgnoreTable() throws Exception
    {
        ReplicateFilter rf = new ReplicateFilter();
        rf.setIgnoreDb("t2");
        rf.addIgnoreTable("stest", "log");
        rf.addIgnoreTable("stest", "~^t.*");
        filterHelper.setFilter(rf);

        verifyStmtAccept("create database s1", "");
        verifyStmtAccept("create table s1.log(id int)", "");
        verifyStmtAccept("drop database s1", "");
        verifyStmtIgnore("create table mysql.test(id int)", "");
        verifyStmtIgnore("drop table mysql.test", "");

        verifyStmtIgnore("create database stest", "");
        verifyStmtIgnore("create table stest.log(id int)", "");
        verifyStmtIgnore("create table stest.t(id int)", "");
        verifyStmtAccept("create table stest.log2(id int)", "");

        verifyRowsIgnore("stest", "t");
        verifyRowsIgnore("stest", "log");
        verifyRowsAccept("stest", "log2");

        List<String> kept = keptTables(filter(
                "drop table stest.log,stest.t,stest.log2", ""));
        assertEquals("[log2]", kept.toString());

        verifyStmtIgnore("drop database stest", "");

        verifyStmtIgnore("create database t2", "");
        verifyStmtIgnore("create table t2.log(id int)", "");
        verifyRowsIgnore("t2", "log1");
        kept = keptTables(filter("drop table t2.log, t2.log1", ""));
        assertEquals(0, kept.size());
        verifyStmtIgnore("drop database t2", "");
        filterHelper.done();
    }

    /**
     * Verify that statements that are not DDL never reach the applier by
     * default, whatever their schema.
     */
    public void testNonDdlDropped() throws Exception
    {
        ReplicateFilter rf = new ReplicateFilter();
        rf.setDoDb("s1");
        filterHelper.setFilter(rf);

        verifyStmtIgnore("insert into mysql.user values (1)", "");
        verifyStmtIgnore("create view s2.v as select 1", "s2");
        verifyStmtIgnore("insert into s2.t values (1)", "s2");
        verifyStmtIgnore("insert into s1.t values (1)", "s1");
        verifyStmtIgnore("/*!40000 ALTER TABLE t DISABLE KEYS */", "s1");
        assertEquals(4, rf.getStatistics().getNonDdlDropped());
        assertEquals(1, rf.getStatistics().getPreFiltered());
        assertEquals(0, rf.getStatistics().getPassedThrough());
        filterHelper.done();
    }

    /**
     * Verify that pass-through of statements that are not DDL, when enabled,
     * still honors the schema rules and refuses statements with no known
     * schema.
     */
    public void testNonDdlPassThrough() throws Exception
    {
        RelayProperties props = new RelayProperties();
        props.setString(ReplicatorConf.FILTER_REPLICATE_PREFIX
                + ReplicatorConf.DO_DB, "s1");
        props.setString(ReplicatorConf.FILTER_REPLICATE_PREFIX
                + ReplicatorConf.PASS_THROUGH_NON_DDL, "true");
        ReplicateFilter rf = new ReplicateFilter();
        rf.configure(props);
        filterHelper.setFilter(rf);

        List<Object> out = filter("insert into s1.t values (1)", "s1");
        assertEquals(1, out.size());
        assertTrue(out.get(0) instanceof QueryEvent);

        verifyStmtIgnore("insert into mysql.user values (1)", "");
        verifyStmtIgnore("insert into s1.t values (1)", null);
        verifyStmtIgnore("create view s2.v as select 1", "s2");
        verifyStmtIgnore("insert into t values (1)", "mysql");
        assertEquals(1, rf.getStatistics().getPassedThrough());
        assertEquals(3, rf.getStatistics().getNonDdlDropped());
        filterHelper.done();
    }

    /**
     * Verify that a compound statement is split into single-table statements
     * in source order, that unqualified names take the current schema, and
     * that each statement can be replayed on its own.
     */
    public void testCompoundStatements() throws Exception
    {
        ReplicateFilter rf = new ReplicateFilter();
        rf.setIgnoreDb("b");
        filterHelper.setFilter(rf);

        List<Object> out = filter(
                "DROP TABLE IF EXISTS a.t1, b.t2, t3 /* generated */", "c");
        assertEquals(2, out.size());
        NormalizedStatement first = (NormalizedStatement) out.get(0);
        NormalizedStatement second = (NormalizedStatement) out.get(1);
        assertEquals(StatementKind.DROP_TABLE, first.getKind());
        assertEquals("a", first.getSchema());
        assertEquals("DROP TABLE IF EXISTS `a`.`t1`", first.getSql());
        assertEquals("c", second.getSchema());
        assertEquals("t3", second.getTable());
        assertEquals("DROP TABLE IF EXISTS `t3`", second.getSql());

        out = filter("RENAME TABLE a.x TO a.y, b.x TO b.y", "");
        assertEquals(1, out.size());
        assertEquals("RENAME TABLE `a`.`x` TO `a`.`y`",
                ((NormalizedStatement) out.get(0)).getSql());

        out = filter("alter table t4 add column c1 int", "b");
        assertEquals(0, out.size());
        out = filter("alter table t4 add column c1 int", "c");
        assertEquals("Single-target statement keeps its text",
                "alter table t4 add column c1 int",
                ((NormalizedStatement) out.get(0)).getSql());
        filterHelper.done();
    }

    /**
     * Verify that statements with no replication relevance are dropped before
     * parsing.
     */
    public void testPreFilter() throws Exception
    {
        ReplicateFilter rf = new ReplicateFilter();
        filterHelper.setFilter(rf);

        verifyStmtIgnore("BEGIN", "s1");
        verifyStmtIgnore("GRANT ALL ON s1.* TO 'u'@'%'", "s1");
        verifyStmtIgnore("create table t1(id int)", "mysql");
        verifyStmtIgnore("  ", "s1");
        assertEquals(4, rf.getStatistics().getPreFiltered());
        filterHelper.done();
    }

    /**
     * Verify that a statement that cannot be parsed stops processing by
     * default.
     */
    public void testParseErrorAbort() throws Exception
    {
        ReplicateFilter rf = new ReplicateFilter();
        filterHelper.setFilter(rf);
        try
        {
            filter("drop table stest.log extra words", "stest");
            fail("Unparsable statement accepted");
        }
        catch (SqlParseException e)
        {
            assertEquals("drop table stest.log extra words", e.getSql());
        }
        assertEquals(1, rf.getStatistics().getParseFailures());
        assertEquals(0, filterHelper.getApplier().getApplied().size());
        filterHelper.done();
    }

    /**
     * Verify that a statement that cannot be parsed is dropped when so
     * configured, and that processing continues.
     */
    public void testParseErrorDrop() throws Exception
    {
        RelayProperties props = new RelayProperties();
        props.setString(ReplicatorConf.FILTER_REPLICATE_PREFIX
                + ReplicatorConf.ABORT_ON_PARSE_ERROR, "false");
        ReplicateFilter rf = new ReplicateFilter();
        rf.configure(props);
        filterHelper.setFilter(rf);

        verifyStmtIgnore("rename table a.x to", "stest");
        verifyStmtAccept("rename table a.x to a.y", "stest");
        assertEquals(1, rf.getStatistics().getParseFailures());
        assertEquals(1, rf.getStatistics().getKept());
        filterHelper.done();
    }

    /**
     * Verify that settings load from a properties file, with indexed table
     * rules taken in numeric order.
     */
    public void testConfigureFromProperties() throws Exception
    {
        RelayProperties props = loadProperties();
        ReplicateFilter rf = new ReplicateFilter();
        rf.configure(props);
        filterHelper.setFilter(rf);

        RuleSet rules = rf.getSchemaTableFilter().getRuleSet();
        assertFalse(rules.isCaseSensitive());
        assertEquals(1, rules.getSchemaAllow().getRules().size());
        List<FilterRule> tableRules = rules.getTableAllow().getRules();
        assertEquals(3, tableRules.size());
        assertEquals("log", tableRules.get(0).getTablePattern().getSource());
        assertEquals("~^t.*", tableRules.get(1).getTablePattern().getSource());
        assertEquals("reports", tableRules.get(2).getSchemaPattern()
                .getSource());

        verifyStmtAccept("create table STEST.Log(id int)", "");
        verifyRowsAccept("reports", "AUDIT_2024");
        verifyRowsIgnore("reports", "sales");
        verifyStmtAccept("create database T2", "");

        // Parse errors are dropped under this configuration.
        verifyStmtIgnore("create table", "t2");
        filterHelper.done();
    }

    /**
     * Verify that settings load from a file and that a missing file is a
     * configuration error.
     */
    public void testConfigureFromFile() throws Exception
    {
        File file = File.createTempFile("replicate", ".properties");
        file.deleteOnExit();
        FileWriter fw = new FileWriter(file);
        fw.write("replicator.filter.replicate.ignore_db=s1\n");
        fw.close();

        ReplicateFilter rf = new ReplicateFilter();
        rf.configure(file);
        filterHelper.setFilter(rf);
        verifyStmtIgnore("create database s1", "");
        verifyStmtAccept("create database s2", "");
        filterHelper.done();

        File missing = new File(file.getParentFile(), file.getName()
                + ".missing");
        try
        {
            new ReplicateFilter().configure(missing);
            fail("Missing file accepted");
        }
        catch (FilterConfigurationException e)
        {
            assertEquals(missing.getPath(), e.getExtraData());
        }
    }

    /**
     * Verify that invalid settings are reported before the filter starts.
     */
    public void testInvalidConfiguration() throws Exception
    {
        ReplicateFilter rf = new ReplicateFilter();
        rf.setDoDb("s1,~[bad");
        rf.setApplier(new CollectingApplier());
        try
        {
            rf.prepare();
            fail("Invalid regex accepted");
        }
        catch (FilterConfigurationException e)
        {
            assertEquals("~[bad", e.getExtraData());
        }

        try
        {
            new ReplicateFilter().prepare();
            fail("Filter prepared without applier");
        }
        catch (FilterConfigurationException e)
        {
            // Expected.
        }

        RelayProperties props = new RelayProperties();
        props.setString("replicator.filter.replicate.ignore_table.1.schema",
                "stest");
        try
        {
            new ReplicateFilter().configure(props);
            fail("Table rule without table accepted");
        }
        catch (FilterConfigurationException e)
        {
            assertTrue(e.getMessage(), e.getMessage().contains("ignore_table"));
        }

        props = new RelayProperties();
        props.setString("replicator.filter.replicate.do_table.x.schema",
                "stest");
        try
        {
            new ReplicateFilter().configure(props);
            fail("Table rule without numeric index accepted");
        }
        catch (FilterConfigurationException e)
        {
            // Expected.
        }

        props = new RelayProperties();
        props.setString(ReplicatorConf.FILTER_REPLICATE_PREFIX
                + ReplicatorConf.CASE_SENSITIVE, "maybe");
        try
        {
            new ReplicateFilter().configure(props);
            fail("Invalid boolean accepted");
        }
        catch (FilterConfigurationException e)
        {
            assertEquals(ReplicatorConf.CASE_SENSITIVE, e.getExtraData());
        }
    }

    /**
     * Verify that new rules replace old ones in one step, and that rules that
     * do not compile leave the current rules in force.
     */
    public void testReconfigure() throws Exception
    {
        ReplicateFilter rf = new ReplicateFilter();
        rf.setDoDb("s1");
        filterHelper.setFilter(rf);
        verifyStmtIgnore("create database s2", "");

        RelayProperties props = new RelayProperties();
        props.setString("replicator.filter.replicate.do_db", "s2");
        rf.reconfigure(props);
        verifyStmtAccept("create database s2", "");
        verifyStmtIgnore("create database s1", "");

        props.setString("replicator.filter.replicate.do_db", "~(s1");
        try
        {
            rf.reconfigure(props);
            fail("Invalid rules installed");
        }
        catch (FilterConfigurationException e)
        {
            // Expected.
        }
        verifyStmtAccept("create database s2", "");
        filterHelper.done();
    }

    /**
     * Verify that applier failures reach the caller.
     */
    public void testApplierFailure() throws Exception
    {
        ReplicateFilter rf = new ReplicateFilter();
        filterHelper.setFilter(rf);
        filterHelper.getApplier().setFail(true);
        try
        {
            filter("create database s1", "");
            fail("Applier failure hidden");
        }
        catch (ReplicatorException e)
        {
            // Expected.
        }
        filterHelper.done();
    }

    private RelayProperties loadProperties() throws Exception
    {
        InputStream is = getClass().getResourceAsStream(
                "/filter/replicate-filter.properties");
        assertNotNull("Test properties not found", is);
        try
        {
            RelayProperties props = new RelayProperties();
            props.load(is);
            return props;
        }
        finally
        {
            is.close();
        }
    }

    private List<Object> filter(String sql, String schema)
            throws ReplicatorException
    {
        return filterHelper.filter(new QueryEvent(seqno++, sql, schema));
    }

    private static List<String> keptTables(List<Object> out)
    {
        List<String> tables = new ArrayList<String>();
        for (Object o : out)
            tables.add(((NormalizedStatement) o).getTable());
        return tables;
    }

    private void verifyStmt(String sql, String schema, boolean ignored)
            throws ReplicatorException
    {
        if (ignored)
            verifyStmtIgnore(sql, schema);
        else
            verifyStmtAccept(sql, schema);
    }

    // Confirms that the statement produced output.
    private void verifyStmtAccept(String sql, String schema)
            throws ReplicatorException
    {
        List<Object> out = filter(sql, schema);
        assertFalse("Statement should be accepted: " + sql, out.isEmpty());
    }

    // Confirms that the statement produced no output.
    private void verifyStmtIgnore(String sql, String schema)
            throws ReplicatorException
    {
        List<Object> out = filter(sql, schema);
        assertTrue("Statement should be ignored: " + sql, out.isEmpty());
    }

    private void verifyRowsAccept(String schema, String table)
            throws ReplicatorException
    {
        List<Object> out = filterHelper.filter(rows(schema, table));
        assertEquals("Rows should be accepted: " + schema + "." + table, 1,
                out.size());
    }

    private void verifyRowsIgnore(String schema, String table)
            throws ReplicatorException
    {
        List<Object> out = filterHelper.filter(rows(schema, table));
        assertEquals("Rows should be ignored: " + schema + "." + table, 0,
                out.size());
    }

    private RowsEvent rows(String schema, String table)
    {
        List<Object[]> images = new ArrayList<Object[]>();
        images.add(new Object[]{1, "value"});
        return new RowsEvent(seqno++, schema, table,
                RowsEvent.ActionType.INSERT, images);
    }
}
