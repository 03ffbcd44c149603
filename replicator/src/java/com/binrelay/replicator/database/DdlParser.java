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
 * Denotes a SQL dialect parser that recognizes DDL statements. Implementations
 * must be stateless or confine state to a single call so that one instance can
 * serve concurrent callers.
 */
public interface DdlParser
{
    /**
     * Parses a statement.
     * 
     * @param sql Statement text
     * @return Parse tree of the statement, or null if the statement is not one
     *         of the recognized DDL forms
     * @throws SqlParseException Thrown if the statement is recognizably DDL but
     *             malformed, so that its targets cannot be determined
     */
    public DdlStatement parse(String sql) throws SqlParseException;
}
