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

package com.binrelay.replicator.event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Holds a row change set, which is a change of a unique type
 * (INSERT/UPDATE/DELETE) involving one or more rows in a single table. Each
 * row image is an array of column values in table column order.
 */
public class RowsEvent extends ReplEvent
{
    public enum ActionType
    {
        INSERT, DELETE, UPDATE
    }

    private final String         schemaName;
    private final String         tableName;
    private final ActionType     action;
    private final List<Object[]> rowImages;

    public RowsEvent(long seqno, String schemaName, String tableName,
            ActionType action, List<Object[]> rowImages)
    {
        super(seqno);
        this.schemaName = schemaName;
        this.tableName = tableName;
        this.action = action;
        if (rowImages == null)
            this.rowImages = Collections.emptyList();
        else
            this.rowImages = Collections
                    .unmodifiableList(new ArrayList<Object[]>(rowImages));
    }

    public String getSchemaName()
    {
        return schemaName;
    }

    public String getTableName()
    {
        return tableName;
    }

    public ActionType getAction()
    {
        return action;
    }

    public List<Object[]> getRowImages()
    {
        return rowImages;
    }

    public String toString()
    {
        return "RowsEvent seqno=" + getSeqno() + " " + action + " "
                + schemaName + "." + tableName + " rows=" + rowImages.size();
    }
}
