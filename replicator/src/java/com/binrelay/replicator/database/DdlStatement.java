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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parse tree of a recognized DDL statement. The type tag decides which of the
 * remaining fields are set:
 * <ul>
 * <li>CREATE/DROP/ALTER_DATABASE: schema name (may be null for ALTER, meaning
 * the current schema)</li>
 * <li>CREATE_TABLE, TRUNCATE_TABLE: one table</li>
 * <li>DROP_TABLE: one or more tables plus the IF EXISTS and TEMPORARY flags</li>
 * <li>ALTER_TABLE: one table plus its alter specifications in source order</li>
 * <li>RENAME_TABLE: source tables and rename targets as parallel lists</li>
 * <li>CREATE_INDEX, DROP_INDEX: index name and one table</li>
 * </ul>
 */
public class DdlStatement
{
    public enum Type
    {
        CREATE_DATABASE, DROP_DATABASE, ALTER_DATABASE, CREATE_TABLE, DROP_TABLE, ALTER_TABLE, RENAME_TABLE, TRUNCATE_TABLE, CREATE_INDEX, DROP_INDEX
    }

    /**
     * One comma-separated clause of an ALTER TABLE statement. If the clause
     * renames the table, the new name is available so that later clauses can
     * be addressed to it.
     */
    public static class AlterSpec
    {
        private final String    text;
        private final TableName renameTo;

        public AlterSpec(String text, TableName renameTo)
        {
            this.text = text;
            this.renameTo = renameTo;
        }

        public String getText()
        {
            return text;
        }

        /** Returns the new table name if this clause renames the table. */
        public TableName getRenameTo()
        {
            return renameTo;
        }
    }

    private final Type            type;
    private final String          sql;
    private String                schema;
    private final List<TableName> tables        = new ArrayList<TableName>();
    private final List<TableName> renameTargets = new ArrayList<TableName>();
    private final List<AlterSpec> alterSpecs    = new ArrayList<AlterSpec>();
    private String                indexName;
    private boolean               ifExists;
    private boolean               temporary;
    private boolean               ignore;

    public DdlStatement(Type type, String sql)
    {
        this.type = type;
        this.sql = sql;
    }

    public Type getType()
    {
        return type;
    }

    /** Returns the statement text as received. */
    public String getSql()
    {
        return sql;
    }

    public String getSchema()
    {
        return schema;
    }

    void setSchema(String schema)
    {
        this.schema = schema;
    }

    public List<TableName> getTables()
    {
        return Collections.unmodifiableList(tables);
    }

    void addTable(TableName table)
    {
        tables.add(table);
    }

    public List<TableName> getRenameTargets()
    {
        return Collections.unmodifiableList(renameTargets);
    }

    void addRename(TableName from, TableName to)
    {
        tables.add(from);
        renameTargets.add(to);
    }

    public List<AlterSpec> getAlterSpecs()
    {
        return Collections.unmodifiableList(alterSpecs);
    }

    void addAlterSpec(AlterSpec spec)
    {
        alterSpecs.add(spec);
    }

    public String getIndexName()
    {
        return indexName;
    }

    void setIndexName(String indexName)
    {
        this.indexName = indexName;
    }

    public boolean isIfExists()
    {
        return ifExists;
    }

    void setIfExists(boolean ifExists)
    {
        this.ifExists = ifExists;
    }

    public boolean isTemporary()
    {
        return temporary;
    }

    void setTemporary(boolean temporary)
    {
        this.temporary = temporary;
    }

    /** Returns true for ALTER IGNORE TABLE. */
    public boolean isIgnore()
    {
        return ignore;
    }

    void setIgnore(boolean ignore)
    {
        this.ignore = ignore;
    }

    public String toString()
    {
        StringBuilder sb = new StringBuilder(type.toString());
        if (schema != null)
            sb.append(" schema=").append(schema);
        if (!tables.isEmpty())
            sb.append(" tables=").append(tables);
        if (!renameTargets.isEmpty())
            sb.append(" to=").append(renameTargets);
        if (!alterSpecs.isEmpty())
            sb.append(" specs=").append(alterSpecs.size());
        return sb.toString();
    }
}
