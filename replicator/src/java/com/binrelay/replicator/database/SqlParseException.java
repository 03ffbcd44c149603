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

import com.binrelay.replicator.ReplicatorException;

/**
 * Signals DDL text that cannot be parsed. The statement text is available as
 * extra data; the offset is the character position at which parsing failed,
 * or -1 if unknown.
 */
public class SqlParseException extends ReplicatorException
{
    private static final long serialVersionUID = 1L;

    private final int         offset;

    public SqlParseException(String msg, String sql, int offset)
    {
        super(msg + (offset >= 0 ? " at offset " + offset : ""));
        this.offset = offset;
        setExtraData(sql);
    }

    /** Returns the character offset of the failure or -1. */
    public int getOffset()
    {
        return offset;
    }

    /** Returns the statement text that failed to parse. */
    public String getSql()
    {
        return getExtraData();
    }
}
