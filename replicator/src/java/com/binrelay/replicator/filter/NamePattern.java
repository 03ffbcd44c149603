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

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.binrelay.replicator.conf.ReplicatorConf;

/**
 * A compiled schema or table name pattern. A specification starting with "~"
 * is a regular expression that must match the whole candidate name; anything
 * else is a literal name. The choice is made once, when the pattern is
 * compiled.
 */
public abstract class NamePattern
{
    private final String source;

    protected NamePattern(String source)
    {
        this.source = source;
    }

    /**
     * Compiles a pattern specification.
     * 
     * @param spec Literal name or "~" followed by a regular expression
     * @param caseSensitive If false, literals compare ignoring case and
     *            regular expressions are case-insensitive
     * @throws FilterConfigurationException Thrown if the specification is empty
     *             or the regular expression does not compile
     */
    public static NamePattern compile(String spec, boolean caseSensitive)
            throws FilterConfigurationException
    {
        if (spec == null || spec.length() == 0)
            throw new FilterConfigurationException("Empty name pattern");

        if (spec.startsWith(ReplicatorConf.REGEX_MARKER))
        {
            String regex = spec.substring(ReplicatorConf.REGEX_MARKER.length());
            if (regex.length() == 0)
                throw new FilterConfigurationException(
                        "Empty regular expression in pattern: " + spec, spec,
                        null);
            try
            {
                int flags = caseSensitive ? 0 : Pattern.CASE_INSENSITIVE
                        | Pattern.UNICODE_CASE;
                return new RegexPattern(spec, Pattern.compile(regex, flags));
            }
            catch (PatternSyntaxException e)
            {
                throw new FilterConfigurationException(
                        "Invalid regular expression in pattern: " + spec,
                        spec, e);
            }
        }
        return new LiteralPattern(spec, caseSensitive);
    }

    /**
     * Returns true if the candidate name matches. A null candidate never
     * matches.
     */
    public abstract boolean matches(String candidate);

    /** Returns true if this is a literal name. */
    public abstract boolean isLiteral();

    /** Returns the specification this pattern was compiled from. */
    public String getSource()
    {
        return source;
    }

    public String toString()
    {
        return source;
    }

    /**
     * Matches a name exactly, optionally ignoring case.
     */
    static class LiteralPattern extends NamePattern
    {
        private final boolean caseSensitive;

        LiteralPattern(String name, boolean caseSensitive)
        {
            super(name);
            this.caseSensitive = caseSensitive;
        }

        public boolean matches(String candidate)
        {
            if (candidate == null)
                return false;
            else if (caseSensitive)
                return getSource().equals(candidate);
            else
                return getSource().equalsIgnoreCase(candidate);
        }

        public boolean isLiteral()
        {
            return true;
        }
    }

    /**
     * Matches names against a regular expression anchored at both ends.
     */
    static class RegexPattern extends NamePattern
    {
        private final Pattern pattern;

        RegexPattern(String spec, Pattern pattern)
        {
            super(spec);
            this.pattern = pattern;
        }

        public boolean matches(String candidate)
        {
            return candidate != null && pattern.matcher(candidate).matches();
        }

        public boolean isLiteral()
        {
            return false;
        }
    }
}
