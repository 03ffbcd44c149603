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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Names of the MySQL catalog schemas. These are never replicated, whatever the
 * configured rules say.
 */
public class SystemSchemas
{
    public static final Set<String> NAMES = Collections
                                                  .unmodifiableSet(new HashSet<String>(
                                                          Arrays.asList(
                                                                  "mysql",
                                                                  "information_schema",
                                                                  "performance_schema",
                                                                  "sys")));

    /**
     * Returns true if the schema is a system schema. Comparison ignores case.
     */
    public static boolean isSystemSchema(String schema)
    {
        return schema != null
                && NAMES.contains(schema.toLowerCase(Locale.ROOT));
    }
}
