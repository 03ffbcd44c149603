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

import java.util.Collections;
import java.util.List;

/**
 * Outcome of DDL resolution: either "not DDL", or the normalized statements in
 * the order their targets appear in the source text.
 */
public class ResolvedDdl
{
    private static final ResolvedDdl        NOT_DDL = new ResolvedDdl(false,
                                                            Collections
                                                                    .<NormalizedStatement> emptyList());

    private final boolean                   ddl;
    private final List<NormalizedStatement> statements;

    private ResolvedDdl(boolean ddl, List<NormalizedStatement> statements)
    {
        this.ddl = ddl;
        this.statements = statements;
    }

    /** Returns the result for statements that are not recognized DDL. */
    public static ResolvedDdl notDdl()
    {
        return NOT_DDL;
    }

    /** Returns a DDL result holding the given statements. */
    public static ResolvedDdl of(List<NormalizedStatement> statements)
    {
        return new ResolvedDdl(true,
                Collections.unmodifiableList(statements));
    }

    public boolean isDdl()
    {
        return ddl;
    }

    public List<NormalizedStatement> getStatements()
    {
        return statements;
    }

    public String toString()
    {
        return ddl ? statements.toString() : "not DDL";
    }
}
