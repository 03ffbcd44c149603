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
 * A compiled filter rule. Schema rules have only a schema pattern and match
 * any table in a matching schema; table rules match only when both the schema
 * and the table name match.
 */
public class FilterRule
{
    private final NamePattern schemaPattern;
    private final NamePattern tablePattern;

    /**
     * Creates a rule.
     * 
     * @param schemaPattern Schema pattern, required
     * @param tablePattern Table pattern, or null for a schema rule
     */
    public FilterRule(NamePattern schemaPattern, NamePattern tablePattern)
    {
        this.schemaPattern = schemaPattern;
        this.tablePattern = tablePattern;
    }

    public NamePattern getSchemaPattern()
    {
        return schemaPattern;
    }

    public NamePattern getTablePattern()
    {
        return tablePattern;
    }

    public boolean isTableRule()
    {
        return tablePattern != null;
    }

    /**
     * Returns true if the rule matches. A table rule does not match a null
     * table name.
     */
    public boolean matches(String schema, String table)
    {
        if (!schemaPattern.matches(schema))
            return false;
        return tablePattern == null || tablePattern.matches(table);
    }

    public String toString()
    {
        if (tablePattern == null)
            return schemaPattern.toString();
        return schemaPattern + "." + tablePattern;
    }
}
