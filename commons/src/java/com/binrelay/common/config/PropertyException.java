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

package com.binrelay.common.config;

/**
 * Signals a property that cannot be used as supplied: a value that does not
 * convert to the type a setter expects, a required key with no value, or a key
 * with no corresponding setter.
 */
public class PropertyException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    private final String      key;

    /**
     * Creates a new exception with a message.
     */
    public PropertyException(String msg)
    {
        this(msg, null, null);
    }

    /**
     * Creates a new exception for a named property with an underlying cause.
     */
    public PropertyException(String msg, String key, Throwable t)
    {
        super(msg, t);
        this.key = key;
    }

    /** Returns the offending property name, if known. */
    public String getKey()
    {
        return key;
    }
}
