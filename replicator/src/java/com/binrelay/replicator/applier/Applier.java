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

package com.binrelay.replicator.applier;

import com.binrelay.replicator.ReplicatorException;
import com.binrelay.replicator.database.NormalizedStatement;
import com.binrelay.replicator.event.QueryEvent;
import com.binrelay.replicator.event.RowsEvent;

/**
 * Denotes a downstream consumer of filtered events. The filter calls these
 * methods in the order in which the events and statements arrived; the applier
 * never sees anything the filter decided to skip.
 */
public interface Applier
{
    /**
     * Apply one normalized DDL statement.
     * 
     * @param source Event the statement was resolved from
     * @param statement Single-target statement to apply
     * @throws ReplicatorException Thrown if applier processing fails
     */
    public void applyStatement(QueryEvent source, NormalizedStatement statement)
            throws ReplicatorException;

    /**
     * Apply a statement that is not recognized DDL. Called only when
     * pass-through is enabled, and only for statements whose current schema
     * passed the schema rules.
     * 
     * @throws ReplicatorException Thrown if applier processing fails
     */
    public void applyPassThrough(QueryEvent event) throws ReplicatorException;

    /**
     * Apply a row change set.
     * 
     * @throws ReplicatorException Thrown if applier processing fails
     */
    public void applyRows(RowsEvent event) throws ReplicatorException;
}
