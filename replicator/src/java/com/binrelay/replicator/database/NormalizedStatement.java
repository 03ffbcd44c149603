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

package com.binrelay.replicator.database;

/**
 * One unit of resolved DDL: an operation on exactly one schema or one table,
 * with SQL text that replays just that operation. The schema is null if the
 * source statement did not name one and no default schema was known.
 */
public class NormalizedStatement
{
    private final StatementKind kind;
    private final String        schema;
    private final String        table;
    private final String        sql;

    public NormalizedStatement(StatementKind kind, String schema, String table,
            String sql)
    {
        if (kind.isSchemaScoped() && table != null)
            throw new IllegalArgumentException(
                    "Schema statement may not name a table: kind=" + kind
                            + " table=" + table);
        if (!kind.isSchemaScoped() && table == null)
            throw new IllegalArgumentException(
                    "Table statement must name a table: kind=" + kind);
        this.kind = kind;
        this.schema = schema;
        this.table = table;
        this.sql = sql;
    }

    public StatementKind getKind()
    {
        return kind;
    }

    public String getSchema()
    {
        return schema;
    }

    /** Returns the table name or null for schema statements. */
    public String getTable()
    {
        return table;
    }

    public String getSql()
    {
        return sql;
    }

    public boolean isSchemaScoped()
    {
        return kind.isSchemaScoped();
    }

    public boolean equals(Object o)
    {
        if (!(o instanceof NormalizedStatement))
            return false;
        NormalizedStatement other = (NormalizedStatement) o;
        return kind == other.kind && equal(schema, other.schema)
                && equal(table, other.table) && equal(sql, other.sql);
    }

    private static boolean equal(String a, String b)
    {
        return a == null ? b == null : a.equals(b);
    }

    public int hashCode()
    {
        int hash = kind.hashCode();
        hash = hash * 31 + (schema == null ? 0 : schema.hashCode());
        hash = hash * 31 + (table == null ? 0 : table.hashCode());
        return hash;
    }

    public String toString()
    {
        return kind + " " + (table == null ? schema : schema + "." + table)
                + " [" + sql + "]";
    }
}
