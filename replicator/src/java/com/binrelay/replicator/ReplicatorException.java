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

package com.binrelay.replicator;

/**
 * Parent of all checked exceptions raised by the replicator. Besides the
 * message, an exception may carry the original error message of a wrapped
 * exception and extra data such as the SQL text or pattern that caused it.
 */
public class ReplicatorException extends Exception
{
    private static final long serialVersionUID     = 1L;

    private String            originalErrorMessage = null;
    private String            extraData            = null;

    /**
     * Creates a new <code>ReplicatorException</code> object
     */
    public ReplicatorException(String msg)
    {
        super(msg);
    }

    /**
     * Creates a new <code>ReplicatorException</code> object wrapping another
     * exception.
     */
    public ReplicatorException(String msg, Throwable cause)
    {
        super(msg, cause);
        if (cause instanceof ReplicatorException)
        {
            ReplicatorException exc = (ReplicatorException) cause;
            this.extraData = exc.extraData;
            this.originalErrorMessage = exc.originalErrorMessage;
        }
        else if (cause != null)
            this.originalErrorMessage = cause.getMessage();
    }

    public void setOriginalErrorMessage(String originalErrorMessage)
    {
        this.originalErrorMessage = originalErrorMessage;
    }

    public String getOriginalErrorMessage()
    {
        return originalErrorMessage;
    }

    public String getExtraData()
    {
        return extraData;
    }

    public void setExtraData(String extraData)
    {
        this.extraData = extraData;
    }
}
