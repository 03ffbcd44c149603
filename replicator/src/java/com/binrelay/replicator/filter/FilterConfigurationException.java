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

import com.binrelay.replicator.ReplicatorException;

/**
 * Signals filter rules that cannot be used, such as a regular expression that
 * does not compile or a table rule with a missing half. The offending pattern,
 * if any, is available as extra data.
 */
public class FilterConfigurationException extends ReplicatorException
{
    private static final long serialVersionUID = 1L;

    public FilterConfigurationException(String msg)
    {
        super(msg);
    }

    public FilterConfigurationException(String msg, String pattern,
            Throwable cause)
    {
        super(msg, cause);
        setExtraData(pattern);
    }
}
