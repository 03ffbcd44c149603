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

/**
 * A statement event from the log: SQL text plus the schema that was current
 * when the statement executed on the source. The default schema may be null
 * or empty if no schema was selected.
 */
public class QueryEvent extends ReplEvent
{
    private final String query;
    private final String defaultSchema;

    public QueryEvent(long seqno, String query, String defaultSchema)
    {
        super(seqno);
        this.query = query;
        this.defaultSchema = defaultSchema;
    }

    public String getQuery()
    {
        return query;
    }

    public String getDefaultSchema()
    {
        return defaultSchema;
    }

    /**
     * Returns the beginning of the query for log messages.
     */
    public String getQuerySummary()
    {
        if (query == null)
            return null;
        else if (query.length() <= 200)
            return query;
        else
            return query.substring(0, 200) + "...";
    }

    public String toString()
    {
        return "QueryEvent seqno=" + getSeqno() + " schema=" + defaultSchema
                + " query=" + getQuerySummary();
    }
}
