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

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.StringTokenizer;
import java.util.TreeMap;
import java.util.TreeSet;

import org.apache.log4j.Logger;

/**
 * Holds relay configuration as a set of name/value pairs with typed accessors.
 * Values are loaded from Java properties files; expressions of the form
 * ${name} are replaced by a local property or, failing that, a system
 * property. Properties may also be applied to plug-in style objects through
 * their setter methods (see {@link #applyProperties(Object, boolean)}).
 * <p>
 * Instances are not synchronized. Build them on one thread and hand them off
 * read-only.
 */
public class RelayProperties
{
    private static Logger       logger = Logger.getLogger(RelayProperties.class);

    private Map<String, Object> properties;

    /**
     * Creates a new, empty instance.
     */
    public RelayProperties()
    {
        properties = new HashMap<String, Object>();
    }

    /**
     * Creates a new instance from an existing map.
     */
    public RelayProperties(Map<String, String> map)
    {
        properties = new HashMap<String, Object>(map);
    }

    /**
     * Loads a properties file with variable substitutions.
     */
    public static RelayProperties loadFile(File file) throws IOException
    {
        logger.info("Loading relay properties from " + file.getAbsolutePath());
        RelayProperties props = new RelayProperties();
        InputStream is = new FileInputStream(file);
        try
        {
            props.load(is);
        }
        finally
        {
            is.close();
        }
        return props;
    }

    /**
     * Loads values from Java properties file format with variable
     * substitutions.
     */
    public void load(InputStream is) throws IOException
    {
        load(is, true);
    }

    /**
     * Loads values from Java properties file format. Current values are
     * replaced.
     *
     * @param is InputStream containing properties
     * @param doSubstitutions If true perform ${name} substitutions
     */
    public void load(InputStream is, boolean doSubstitutions)
            throws IOException
    {
        Properties props = new Properties();
        props.load(is);
        if (doSubstitutions)
            substituteSystemValues(props, 10);
        load(props);
    }

    /**
     * Load values from a Properties instance. Current values are replaced.
     */
    public void load(Properties props)
    {
        HashMap<String, Object> map = new HashMap<String, Object>();
        Enumeration<?> keys = props.propertyNames();
        while (keys.hasMoreElements())
        {
            String key = (String) keys.nextElement();
            map.put(key, props.getProperty(key));
        }
        properties = map;
    }

    /**
     * Repeats substitution passes until nothing changes or the iteration limit
     * is reached, so that variables may refer to other variables without
     * risking an endless loop.
     *
     * @return Total number of substitutions made
     */
    public static int substituteSystemValues(Properties props, int iterations)
    {
        int substitutions = 0;
        for (int i = 0; i < iterations; i++)
        {
            int count = substituteSystemValues(props);
            if (count == 0)
                break;
            substitutions += count;
        }
        return substitutions;
    }

    /**
     * Replaces each ${name} expression in property values with the value of
     * local property 'name' or, if there is none, system property 'name'.
     * Local properties win. Expressions that resolve to nothing, or are not
     * well formed, are left as they are.
     *
     * @return Number of substitutions made
     */
    public static int substituteSystemValues(Properties props)
    {
        int substitutions = 0;

        // Resolve against a snapshot so that one pass sees consistent values.
        Properties originalProps = new Properties();
        originalProps.putAll(props);

        for (String key : originalProps.stringPropertyNames())
        {
            String value = originalProps.getProperty(key);
            StringBuilder newValue = new StringBuilder();
            int pos = 0;
            while (pos < value.length())
            {
                int start = value.indexOf("${", pos);
                if (start == -1)
                    break;
                int end = value.indexOf('}', start + 2);
                if (end == -1)
                    break;

                String name = value.substring(start + 2, end);
                String replacement = null;
                if (name.length() > 0
                        && Character.isLetterOrDigit(name.charAt(0)))
                {
                    replacement = originalProps.getProperty(name);
                    if (replacement == null)
                        replacement = System.getProperty(name);
                }

                newValue.append(value, pos, start);
                if (replacement == null)
                    newValue.append(value, start, end + 1);
                else
                {
                    newValue.append(replacement);
                    substitutions++;
                }
                pos = end + 1;
            }
            newValue.append(value.substring(pos));
            props.setProperty(key, newValue.toString());
        }

        return substitutions;
    }

    /**
     * Applies properties to the given object, throwing an exception if a
     * property has no matching setter.
     */
    public void applyProperties(Object o)
    {
        applyProperties(o, false);
    }

    /**
     * Applies properties to an object by matching property names to setter
     * methods. The first letter of the name is capitalized, each underscore is
     * removed and the character that follows it capitalized, and "set" is
     * prepended: case_sensitive becomes setCaseSensitive. Setters must be
     * public and take one argument of type String, boolean, int, long or
     * List&lt;String&gt;. Names that contain a period address nested
     * structures and are left to the caller.
     *
     * @param o Instance for which we are to set properties
     * @param ignoreIfMissing If true skip properties that have no setter
     * @throws PropertyException Thrown if a setter is missing and
     *             ignoreIfMissing is false, or the value cannot be converted or
     *             the setter fails
     */
    public void applyProperties(Object o, boolean ignoreIfMissing)
    {
        Method[] methods = o.getClass().getMethods();

        for (String key : new TreeSet<String>(keyNames()))
        {
            if (key.indexOf('.') != -1)
                continue;

            String setterName = setterName(key);
            Method setter = null;
            for (Method m : methods)
            {
                if (m.getName().equals(setterName)
                        && m.getParameterTypes().length == 1)
                {
                    setter = m;
                    break;
                }
            }
            if (setter == null)
            {
                if (ignoreIfMissing)
                {
                    if (logger.isDebugEnabled())
                        logger.debug("Ignoring missing setter for property="
                                + key);
                    continue;
                }
                throw new PropertyException(
                        "Unable to find method corresponding to property: class="
                                + o.getClass().getName() + " property=" + key
                                + " expected setter=" + setterName, key, null);
            }

            String value = getString(key);
            if (value == null)
                continue;

            Object arg = convert(key, value, setter.getParameterTypes()[0]);
            try
            {
                setter.invoke(o, arg);
            }
            catch (IllegalAccessException e)
            {
                throw new PropertyException("Unable to set property: key="
                        + key + " value=" + value, key, e);
            }
            catch (InvocationTargetException e)
            {
                throw new PropertyException("Unable to set property: key="
                        + key + " value=" + value, key, e.getCause());
            }
        }
    }

    // Turns foo_bar into setFooBar.
    private static String setterName(String key)
    {
        StringBuilder name = new StringBuilder("set");
        boolean upper = true;
        for (int i = 0; i < key.length(); i++)
        {
            char c = key.charAt(i);
            if (c == '_' && i < key.length() - 1)
                upper = true;
            else if (upper)
            {
                name.append(Character.toUpperCase(c));
                upper = false;
            }
            else
                name.append(c);
        }
        return name.toString();
    }

    // Converts a string value to the setter argument type.
    private Object convert(String key, String value, Class<?> type)
    {
        try
        {
            if (type == String.class)
                return value;
            else if (type == Boolean.TYPE || type == Boolean.class)
                return toBoolean(key, value);
            else if (type == Integer.TYPE || type == Integer.class)
                return Integer.valueOf(value.trim());
            else if (type == Long.TYPE || type == Long.class)
                return Long.valueOf(value.trim());
            else if (type == List.class)
                return getStringList(key);
        }
        catch (NumberFormatException e)
        {
            throw new PropertyException(
                    "Unable to translate property value: key=" + key
                            + " value=" + value, key, e);
        }
        throw new PropertyException("Unsupported setter argument type: key="
                + key + " type=" + type.getName(), key, null);
    }

    // Only true and false are accepted, ignoring case.
    private static Boolean toBoolean(String key, String value)
    {
        String v = value.trim();
        if ("true".equalsIgnoreCase(v))
            return Boolean.TRUE;
        else if ("false".equalsIgnoreCase(v))
            return Boolean.FALSE;
        throw new PropertyException("Invalid boolean value: key=" + key
                + " value=" + value, key, null);
    }

    /**
     * Returns keys of all properties currently stored in this instance.
     */
    public Set<String> keyNames()
    {
        return properties.keySet();
    }

    /**
     * Returns keys of all properties where the key name starts with the
     * provided prefix.
     */
    public Set<String> keyNames(String prefix)
    {
        Set<String> subset = new TreeSet<String>();
        for (String key : keyNames())
        {
            if (key != null && key.startsWith(prefix))
                subset.add(key);
        }
        return subset;
    }

    /**
     * Returns an instance holding the properties whose names match the given
     * prefix.
     *
     * @param prefix Return only those properties that match the prefix
     * @param removePrefix If true remove the prefix from each property name
     */
    public RelayProperties subset(String prefix, boolean removePrefix)
    {
        RelayProperties rp = new RelayProperties();
        int nameIndex = removePrefix ? prefix.length() : 0;
        for (String key : keyNames(prefix))
        {
            String newKey = key.substring(nameIndex);
            if (newKey.length() > 0)
                rp.setObject(newKey, getObject(key));
        }
        return rp;
    }

    public boolean containsKey(String key)
    {
        return properties.containsKey(key);
    }

    public int size()
    {
        return properties.size();
    }

    public boolean isEmpty()
    {
        return properties.isEmpty();
    }

    public String remove(String key)
    {
        Object value = properties.remove(key);
        return value == null ? null : value.toString();
    }

    public void setObject(String key, Object value)
    {
        properties.put(key, value);
    }

    public void setString(String key, String value)
    {
        properties.put(key, value);
    }

    public void setInt(String key, int value)
    {
        setString(key, Integer.toString(value));
    }

    public void setBoolean(String key, boolean value)
    {
        setString(key, Boolean.toString(value));
    }

    /**
     * Stores a list as a comma-separated string.
     */
    public void setStringList(String key, List<String> list)
    {
        StringBuilder sb = new StringBuilder();
        for (String item : list)
        {
            if (sb.length() > 0)
                sb.append(",");
            sb.append(item);
        }
        setString(key, sb.toString());
    }

    /**
     * Returns the value as an object with an optional default value, checking
     * that a value is present if required.
     *
     * @throws PropertyException if the value is required but does not exist
     */
    public Object getObject(String key, Object defaultValue, boolean required)
    {
        Object value = properties.get(key);
        if (value != null)
            return value;
        else if (defaultValue != null)
            return defaultValue;

        if (required)
            throw new PropertyException(
                    "No value found for required property: " + key, key, null);
        return null;
    }

    public Object getObject(String key)
    {
        return getObject(key, null, false);
    }

    /**
     * Returns the value as a String with an optional default value, checking
     * that a value is present if required.
     */
    public String getString(String key, String defaultValue, boolean required)
    {
        Object o = getObject(key, defaultValue, required);
        return o == null ? null : o.toString();
    }

    /**
     * Returns the value as a String or null if not found.
     */
    public String getString(String key)
    {
        return getString(key, null, false);
    }

    public int getInt(String key, String defaultValue, boolean required)
    {
        String value = getString(key, defaultValue, required);
        try
        {
            return Integer.parseInt(value.trim());
        }
        catch (RuntimeException e)
        {
            throw new PropertyException("Invalid integer value: key=" + key
                    + " value=" + value, key, e);
        }
    }

    public boolean getBoolean(String key)
    {
        return getBoolean(key, null, false);
    }

    public boolean getBoolean(String key, String defaultValue, boolean required)
    {
        String value = getString(key, defaultValue, required);
        return value != null && Boolean.parseBoolean(value.trim());
    }

    /**
     * Returns a list of strings from a value holding items separated by commas
     * or whitespace. "a, b,c, " returns "a", "b", "c"; "," returns an empty
     * list, as does a missing key.
     */
    public List<String> getStringList(String key)
    {
        List<String> list = new ArrayList<String>();
        String listValues = getString(key);
        if (listValues == null)
            return list;

        StringTokenizer st = new StringTokenizer(listValues, ", \t\n\r\f");
        while (st.hasMoreTokens())
            list.add(st.nextToken());
        return list;
    }

    /**
     * Returns true if the argument contains exactly the same property values.
     */
    public boolean equals(Object o)
    {
        if (!(o instanceof RelayProperties))
            return false;
        return properties.equals(((RelayProperties) o).properties);
    }

    public int hashCode()
    {
        return properties.hashCode();
    }

    /**
     * Returns the properties in key order.
     */
    public String toString()
    {
        return new TreeMap<String, Object>(properties).toString();
    }
}
