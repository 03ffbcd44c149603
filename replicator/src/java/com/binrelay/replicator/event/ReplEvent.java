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
 * Denotes an event read from the source replication log. Events are handed to
 * the filter one at a time in log order; the sequence number identifies the
 * event in log messages.
 */
public abstract class ReplEvent
{
    private final long seqno;

    protected ReplEvent(long seqno)
    {
        this.seqno = seqno;
    }

    public long getSeqno()
    {
        return seqno;
    }
}
