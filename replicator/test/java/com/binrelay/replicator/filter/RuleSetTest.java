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
import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests construction of rule sets from configured lists.
 */
public class RuleSetTest
{
    /**
     * Verify that every list is compiled into its own matcher.
     */
    @Test
    public void testBuild() throws Exception
    {
        List<TablePattern> doTables = new ArrayList<TablePattern>();
        doTables.add(new TablePattern("stest", "log"));
        doTables.add(new TablePattern("stest", "~^t.*"));

        RuleSet rules = RuleSet.build(Arrays.asList("t2"),
                Arrays.asList("a", "b", "c"), doTables, null);
        Assert.assertEquals(1, rules.getSchemaAllow().getRules().size());
        Assert.assertEquals(3, rules.getSchemaDeny().getRules().size());
        Assert.assertEquals(2, rules.getTableAllow().getRules().size());
        Assert.assertTrue(rules.getTableDeny().isEmpty());
        Assert.assertTrue(rules.getTableAllow().getRules().get(1)
                .isTableRule());
        Assert.assertTrue(rules.isCaseSensitive());
        Assert.assertFalse(rules.isEmpty());
    }

    /**
     * Verify that a rule set without rules reports itself as empty.
     */
    @Test
    public void testEmpty() throws Exception
    {
        Assert.assertTrue(RuleSet.empty().isEmpty());
        Assert.assertTrue(RuleSet.build(new ArrayList<String>(), null, null,
                new ArrayList<TablePattern>()).isEmpty());
    }

    /**
     * Verify that a single bad pattern in any list prevents the rule set from
     * being built.
     */
    @Test
    public void testInvalidPattern() throws Exception
    {
        List<TablePattern> badTables = new ArrayList<TablePattern>();
        badTables.add(new TablePattern("stest", "~*log"));
        try
        {
            RuleSet.build(Arrays.asList("s1"), null, null, badTables);
            Assert.fail("Rule set built with invalid regex");
        }
        catch (FilterConfigurationException e)
        {
            Assert.assertEquals("~*log", e.getExtraData());
        }
    }

    /**
     * Verify that the rule set is immutable.
     */
    @Test(expected = UnsupportedOperationException.class)
    public void testRulesReadOnly() throws Exception
    {
        RuleSet rules = RuleSet.build(Arrays.asList("s1"), null, null, null);
        rules.getSchemaAllow().getRules().clear();
    }
}
