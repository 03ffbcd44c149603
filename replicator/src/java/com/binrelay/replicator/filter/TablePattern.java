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

/**
 * A schema/table rule as written in configuration: a schema pattern and a
 * table pattern, each either a literal name or "~" followed by a regular
 * expression.
 */
public class TablePattern
{
    private final String schema;
    private final String table;

    public TablePattern(String schema, String table)
    {
        this.schema = schema;
        this.table = table;
    }

    public String getSchema()
    {
        return schema;
    }

    public String getTable()
    {
        return table;
    }

    public boolean equals(Object o)
    {
        if (!(o instanceof TablePattern))
            return false;
        TablePattern other = (TablePattern) o;
        return String.valueOf(schema).equals(String.valueOf(other.schema))
                && String.valueOf(table).equals(String.valueOf(other.table));
    }

    public int hashCode()
    {
        return String.valueOf(schema).hashCode() * 31
                + String.valueOf(table).hashCode();
    }

    public String toString()
    {
        return "(" + schema + ", " + table + ")";
    }
}
