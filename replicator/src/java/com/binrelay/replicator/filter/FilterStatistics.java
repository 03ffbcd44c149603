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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts what the replicate filter did with the items it received. Counters
 * may be read while the filter is running.
 */
public class FilterStatistics
{
    private final AtomicLong kept          = new AtomicLong();
    private final AtomicLong skipped       = new AtomicLong();
    private final AtomicLong preFiltered   = new AtomicLong();
    private final AtomicLong passedThrough = new AtomicLong();
    private final AtomicLong parseFailures = new AtomicLong();
    private final AtomicLong nonDdlDropped = new AtomicLong();

    void incrementKept()
    {
        kept.incrementAndGet();
    }

    void incrementSkipped()
    {
        skipped.incrementAndGet();
    }

    void incrementPreFiltered()
    {
        preFiltered.incrementAndGet();
    }

    void incrementPassedThrough()
    {
        passedThrough.incrementAndGet();
    }

    void incrementParseFailures()
    {
        parseFailures.incrementAndGet();
    }

    void incrementNonDdlDropped()
    {
        nonDdlDropped.incrementAndGet();
    }

    /** Statements and row changes handed to the applier after filtering. */
    public long getKept()
    {
        return kept.get();
    }

    /** Statements and row changes dropped by filter rules. */
    public long getSkipped()
    {
        return skipped.get();
    }

    /** Statement events dropped before parsing. */
    public long getPreFiltered()
    {
        return preFiltered.get();
    }

    /** Statement events that were not DDL and went to the applier as is. */
    public long getPassedThrough()
    {
        return passedThrough.get();
    }

    /** Statement events that could not be parsed. */
    public long getParseFailures()
    {
        return parseFailures.get();
    }

    /** Statement events that were not DDL and were dropped. */
    public long getNonDdlDropped()
    {
        return nonDdlDropped.get();
    }

    public String toString()
    {
        return "kept=" + kept + " skipped=" + skipped + " preFiltered="
                + preFiltered + " passedThrough=" + passedThrough
                + " parseFailures=" + parseFailures + " nonDdlDropped="
                + nonDdlDropped;
    }
}
