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
 * Operation kinds of normalized DDL statements. Schema-scoped kinds name only a
 * schema; all others name a schema and a table.
 */
public enum StatementKind
{
    CREATE_SCHEMA(true), DROP_SCHEMA(true), ALTER_SCHEMA(true), CREATE_TABLE(
            false), DROP_TABLE(false), ALTER_TABLE(false), RENAME_TABLE(false), TRUNCATE_TABLE(
            false), CREATE_INDEX(false), DROP_INDEX(false);

    private final boolean schemaScoped;

    private StatementKind(boolean schemaScoped)
    {
        this.schemaScoped = schemaScoped;
    }

    /** Returns true if the statement has no table component. */
    public boolean isSchemaScoped()
    {
        return schemaScoped;
    }
}
