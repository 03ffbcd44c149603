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
 * A table name as written in SQL, with optional schema qualifier. Quotes are
 * removed from both parts.
 */
public class TableName
{
    private final String schema;
    private final String name;

    public TableName(String schema, String name)
    {
        this.schema = schema;
        this.name = name;
    }

    /** Returns the schema qualifier or null if the name is unqualified. */
    public String getSchema()
    {
        return schema;
    }

    public String getName()
    {
        return name;
    }

    /**
     * Returns the schema qualifier if present, otherwise the default schema.
     */
    public String resolveSchema(String defaultSchema)
    {
        return schema == null ? defaultSchema : schema;
    }

    /**
     * Renders the name as backquoted SQL, keeping the qualification present in
     * the source.
     */
    public String toSql()
    {
        if (schema == null)
            return quote(name);
        else
            return quote(schema) + "." + quote(name);
    }

    /** Backquotes an identifier, doubling embedded backquotes. */
    public static String quote(String identifier)
    {
        return "`" + identifier.replace("`", "``") + "`";
    }

    public boolean equals(Object o)
    {
        if (!(o instanceof TableName))
            return false;
        TableName other = (TableName) o;
        return name.equals(other.name)
                && (schema == null ? other.schema == null : schema
                        .equals(other.schema));
    }

    public int hashCode()
    {
        return name.hashCode() * 31 + (schema == null ? 0 : schema.hashCode());
    }

    public String toString()
    {
        return schema == null ? name : schema + "." + name;
    }
}
