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

import java.util.ArrayList;
import java.util.List;

/**
 * Splits MySQL statement text into tokens. Comments of all three MySQL forms
 * are dropped, including executable comments. Identifiers in backquotes and
 * string literals are returned with quotes removed and escapes resolved; each
 * token remembers its position in the source so that callers can copy source
 * text verbatim.
 */
public class MySQLLexer
{
    public enum TokenType
    {
        WORD, QUOTED_IDENTIFIER, STRING, DOUBLE_QUOTED, SYMBOL
    }

    /**
     * A single token and its [start, end) position in the source text.
     */
    public static class Token
    {
        private final TokenType type;
        private final String    value;
        private final int       start;
        private final int       end;

        Token(TokenType type, String value, int start, int end)
        {
            this.type = type;
            this.value = value;
            this.start = start;
            this.end = end;
        }

        public TokenType getType()
        {
            return type;
        }

        public String getValue()
        {
            return value;
        }

        public int getStart()
        {
            return start;
        }

        public int getEnd()
        {
            return end;
        }

        /** Returns true if this is an unquoted word equal to the keyword. */
        public boolean isKeyword(String keyword)
        {
            return type == TokenType.WORD && value.equalsIgnoreCase(keyword);
        }

        /** Returns true if this is the given punctuation character. */
        public boolean isSymbol(char c)
        {
            return type == TokenType.SYMBOL && value.charAt(0) == c;
        }

        /** Returns true if the token can name a schema or table. */
        public boolean isIdentifier()
        {
            return type == TokenType.WORD
                    || type == TokenType.QUOTED_IDENTIFIER
                    || type == TokenType.DOUBLE_QUOTED;
        }

        public String toString()
        {
            return type + "(" + value + ")@" + start;
        }
    }

    /**
     * Tokenizes a statement.
     * 
     * @throws SqlParseException Thrown if a comment, string or quoted
     *             identifier is not terminated
     */
    public List<Token> tokenize(String sql) throws SqlParseException
    {
        List<Token> tokens = new ArrayList<Token>();
        int length = sql.length();
        int pos = 0;
        while (pos < length)
        {
            char c = sql.charAt(pos);
            if (Character.isWhitespace(c))
            {
                pos++;
            }
            else if (c == '/' && pos + 1 < length && sql.charAt(pos + 1) == '*')
            {
                int close = sql.indexOf("*/", pos + 2);
                if (close == -1)
                    throw new SqlParseException("Unterminated comment", sql,
                            pos);
                pos = close + 2;
            }
            else if (c == '#' || isDashComment(sql, pos))
            {
                int eol = sql.indexOf('\n', pos);
                pos = (eol == -1) ? length : eol + 1;
            }
            else if (c == '`')
            {
                pos = quoted(sql, pos, '`', TokenType.QUOTED_IDENTIFIER,
                        tokens);
            }
            else if (c == '\'')
            {
                pos = quoted(sql, pos, '\'', TokenType.STRING, tokens);
            }
            else if (c == '"')
            {
                pos = quoted(sql, pos, '"', TokenType.DOUBLE_QUOTED, tokens);
            }
            else if (isWordChar(c))
            {
                int start = pos;
                while (pos < length && isWordChar(sql.charAt(pos)))
                    pos++;
                tokens.add(new Token(TokenType.WORD, sql.substring(start, pos),
                        start, pos));
            }
            else
            {
                tokens.add(new Token(TokenType.SYMBOL, String.valueOf(c), pos,
                        pos + 1));
                pos++;
            }
        }
        return tokens;
    }

    // MySQL requires whitespace or end of text after "--".
    private static boolean isDashComment(String sql, int pos)
    {
        if (!sql.startsWith("--", pos))
            return false;
        return pos + 2 >= sql.length()
                || Character.isWhitespace(sql.charAt(pos + 2))
                || Character.isISOControl(sql.charAt(pos + 2));
    }

    private static boolean isWordChar(char c)
    {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c > 0x7f;
    }

    // Reads a quoted token starting at pos and returns the position after it.
    // The quote character is escaped by doubling it; strings also accept
    // backslash escapes.
    private static int quoted(String sql, int pos, char quote, TokenType type,
            List<Token> tokens) throws SqlParseException
    {
        StringBuilder value = new StringBuilder();
        int start = pos;
        int i = pos + 1;
        while (i < sql.length())
        {
            char c = sql.charAt(i);
            if (c == quote)
            {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote)
                {
                    value.append(quote);
                    i += 2;
                    continue;
                }
                tokens.add(new Token(type, value.toString(), start, i + 1));
                return i + 1;
            }
            else if (c == '\\' && type != TokenType.QUOTED_IDENTIFIER
                    && i + 1 < sql.length())
            {
                value.append(sql.charAt(i + 1));
                i += 2;
            }
            else
            {
                value.append(c);
                i++;
            }
        }
        throw new SqlParseException("Unterminated quoted text", sql, start);
    }
}
