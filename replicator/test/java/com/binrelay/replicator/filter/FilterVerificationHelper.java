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

import java.util.ArrayList;
import java.util.List;

import com.binrelay.replicator.ReplicatorException;
import com.binrelay.replicator.event.ReplEvent;

/**
 * Implements a simple harness to test the replicate filter. The helper
 * supplies an applier that records output, so tests can see what survived
 * each event.
 */
public class FilterVerificationHelper
{
    // Filter to be tested.
    private ReplicateFilter   filter;

    // Receives everything the filter keeps.
    private CollectingApplier applier;

    /**
     * Assign a filter to be tested. Caller must instantiate and assign
     * properties, then call this method. The helper sets the applier and
     * calls prepare() on the filter instance.
     * 
     * @throws ReplicatorException Thrown if the filter does not prepare
     */
    public void setFilter(ReplicateFilter filter) throws ReplicatorException
    {
        this.filter = filter;
        this.applier = new CollectingApplier();
        filter.setApplier(applier);
        filter.prepare();
    }

    public ReplicateFilter getFilter()
    {
        return filter;
    }

    public CollectingApplier getApplier()
    {
        return applier;
    }

    /**
     * Deliver an event to the filter and return what the filter applied for
     * it.
     * 
     * @throws ReplicatorException Thrown if the filter fails
     */
    public List<Object> filter(ReplEvent event) throws ReplicatorException
    {
        applier.clear();
        filter.filter(event);
        return new ArrayList<Object>(applier.getApplied());
    }

    /**
     * Calls release() method on the filter.
     */
    public void done()
    {
        filter.release();
    }
}
