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

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the pre-filter that drops statements with no replication relevance
 * before DDL parsing.
 */
public class QueryEventFilterTest
{
    private final QueryEventFilter filter = new QueryEventFilter();

    /**
     * Verify that empty statements and comment-only statements are dropped.
     */
    @Test
    public void testEmptyStatements() throws Exception
    {
        Assert.assertTrue(filter.skipQueryEvent(null, "s1"));
        Assert.assertTrue(filter.skipQueryEvent("", "s1"));
        Assert.assertTrue(filter.skipQueryEvent("   ;  ", "s1"));
        Assert.assertTrue(filter.skipQueryEvent("/* nothing */", "s1"));
        Assert.assertTrue(filter.skipQueryEvent("# just a note\n", "s1"));
    }

    /**
     * Verify that transaction control and administrative statements are
     * dropped regardless of case and leading comments.
     */
    @Test
    public void testSkippedStatementTypes() throws Exception
    {
        String[] skipped = {"BEGIN", "commit", "ROLLBACK TO SAVEPOINT sp1",
                "SAVEPOINT sp1", "release savepoint sp1", "XA START 'x1'",
                "START TRANSACTION", "FLUSH PRIVILEGES",
                "OPTIMIZE TABLE s1.t1", "analyze table t1", "REPAIR TABLE t1",
                "GRANT SELECT ON s1.* TO 'u'@'%'",
                "REVOKE ALL ON s1.* FROM 'u'@'%'",
                "CREATE USER 'u'@'%' IDENTIFIED BY 'p'", "DROP USER 'u'@'%'",
                "SET PASSWORD FOR 'u'@'%' = 'p'", "CREATE ROLE r1",
                "CREATE TRIGGER trg BEFORE INSERT ON t1 FOR EACH ROW SET @a=1",
                "CREATE DEFINER=`root`@`localhost` PROCEDURE p1() BEGIN END",
                "DROP FUNCTION f1", "ALTER EVENT e1 DISABLE",
                "INSTALL PLUGIN p SONAME 'p.so'", "RESET MASTER",
                "PURGE BINARY LOGS TO 'mysql-bin.000010'",
                "CHANGE MASTER TO MASTER_HOST='h'", "SHOW TABLES",
                "/* app */ BEGIN", "-- note\nCOMMIT", "  \n\tbegin"};
        for (String sql : skipped)
        {
            Assert.assertTrue(sql, filter.skipQueryEvent(sql, "s1"));
        }
    }

    /**
     * Verify that DDL and DML statements are passed on.
     */
    @Test
    public void testStatementsPassed() throws Exception
    {
        String[] passed = {"CREATE TABLE t1 (id int)",
                "create database s1", "DROP TABLE users",
                "ALTER TABLE s1.t1 ADD COLUMN c int",
                "RENAME TABLE a TO b", "TRUNCATE TABLE t1",
                "INSERT INTO t1 VALUES (1)", "BEGINNING_OF_NAME",
                "/* app */ CREATE TABLE t2 (id int)"};
        for (String sql : passed)
        {
            Assert.assertFalse(sql, filter.skipQueryEvent(sql, "s1"));
            Assert.assertFalse(sql, filter.skipQueryEvent(sql, null));
        }
    }

    /**
     * Verify that any statement run in a system schema is dropped.
     */
    @Test
    public void testSystemSchemaStatements() throws Exception
    {
        Assert.assertTrue(filter.skipQueryEvent("CREATE TABLE t1 (id int)",
                "mysql"));
        Assert.assertTrue(filter.skipQueryEvent("DROP TABLE t1", "SYS"));
        Assert.assertTrue(filter.skipQueryEvent("INSERT INTO t VALUES (1)",
                "performance_schema"));
    }
}
