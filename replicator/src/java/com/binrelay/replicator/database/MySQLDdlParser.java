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

import org.apache.log4j.Logger;

import com.binrelay.replicator.database.MySQLLexer.Token;

/**
 * Recognizes MySQL DDL on schemas, tables and indexes:
 * <ul>
 * <li>CREATE/DROP/ALTER {DATABASE|SCHEMA}</li>
 * <li>CREATE [TEMPORARY] TABLE, DROP [TEMPORARY] TABLE[S] with a table list,
 * ALTER [IGNORE] TABLE with a list of alter specifications, RENAME TABLE with
 * a list of renames, TRUNCATE [TABLE]</li>
 * <li>CREATE [UNIQUE|FULLTEXT|SPATIAL] INDEX ... ON and DROP INDEX ... ON</li>
 * </ul>
 * Other statements, including DML and DDL on views, users, routines and
 * triggers, are not recognized and yield null. The parser only reads as far as
 * needed to find statement targets; column definitions and table options are
 * not validated.
 */
public class MySQLDdlParser implements DdlParser
{
    private static Logger    logger = Logger.getLogger(MySQLDdlParser.class);

    private final MySQLLexer lexer  = new MySQLLexer();

    /**
     * {@inheritDoc}
     * 
     * @see com.binrelay.replicator.database.DdlParser#parse(java.lang.String)
     */
    public DdlStatement parse(String sql) throws SqlParseException
    {
        if (sql == null)
            return null;

        Cursor c = new Cursor(sql, lexer.tokenize(sql));
        DdlStatement stmt;
        if (c.acceptKeyword("CREATE"))
            stmt = parseCreate(c);
        else if (c.acceptKeyword("DROP"))
            stmt = parseDrop(c);
        else if (c.acceptKeyword("ALTER"))
            stmt = parseAlter(c);
        else if (c.acceptKeyword("RENAME"))
            stmt = parseRename(c);
        else if (c.acceptKeyword("TRUNCATE"))
            stmt = parseTruncate(c);
        else
            stmt = null;

        if (logger.isDebugEnabled())
            logger.debug("Parsed statement: " + stmt);
        return stmt;
    }

    private DdlStatement parseCreate(Cursor c) throws SqlParseException
    {
        String sql = c.getSql();
        if (c.acceptKeyword("DATABASE") || c.acceptKeyword("SCHEMA"))
        {
            c.acceptKeywords("IF", "NOT", "EXISTS");
            DdlStatement stmt = new DdlStatement(
                    DdlStatement.Type.CREATE_DATABASE, sql);
            stmt.setSchema(c.identifier("schema name"));
            return stmt;
        }

        boolean temporary = c.acceptKeyword("TEMPORARY");
        if (c.acceptKeyword("TABLE"))
        {
            c.acceptKeywords("IF", "NOT", "EXISTS");
            DdlStatement stmt = new DdlStatement(
                    DdlStatement.Type.CREATE_TABLE, sql);
            stmt.setTemporary(temporary);
            stmt.addTable(c.tableName());
            return stmt;
        }
        else if (temporary)
            throw c.error("Expected TABLE");

        if (!c.acceptKeyword("ONLINE"))
            c.acceptKeyword("OFFLINE");
        boolean indexType = c.acceptKeyword("UNIQUE")
                || c.acceptKeyword("FULLTEXT") || c.acceptKeyword("SPATIAL");
        if (c.acceptKeyword("INDEX"))
        {
            DdlStatement stmt = new DdlStatement(
                    DdlStatement.Type.CREATE_INDEX, sql);
            stmt.setIndexName(c.identifier("index name"));
            // Skip an optional index type clause to reach ON.
            while (!c.atEnd() && !c.peek().isKeyword("ON"))
                c.next();
            c.expectKeyword("ON");
            stmt.addTable(c.tableName());
            return stmt;
        }
        else if (indexType)
            throw c.error("Expected INDEX");

        return null;
    }

    private DdlStatement parseDrop(Cursor c) throws SqlParseException
    {
        String sql = c.getSql();
        if (c.acceptKeyword("DATABASE") || c.acceptKeyword("SCHEMA"))
        {
            DdlStatement stmt = new DdlStatement(
                    DdlStatement.Type.DROP_DATABASE, sql);
            stmt.setIfExists(c.acceptKeywords("IF", "EXISTS"));
            stmt.setSchema(c.identifier("schema name"));
            c.endOfStatement();
            return stmt;
        }

        boolean temporary = c.acceptKeyword("TEMPORARY");
        if (c.acceptKeyword("TABLE") || c.acceptKeyword("TABLES"))
        {
            DdlStatement stmt = new DdlStatement(DdlStatement.Type.DROP_TABLE,
                    sql);
            stmt.setTemporary(temporary);
            stmt.setIfExists(c.acceptKeywords("IF", "EXISTS"));
            do
            {
                stmt.addTable(c.tableName());
            }
            while (c.acceptSymbol(','));
            if (!c.acceptKeyword("RESTRICT"))
                c.acceptKeyword("CASCADE");
            c.endOfStatement();
            return stmt;
        }
        else if (temporary)
            throw c.error("Expected TABLE");

        if (!c.acceptKeyword("ONLINE"))
            c.acceptKeyword("OFFLINE");
        if (c.acceptKeyword("INDEX"))
        {
            DdlStatement stmt = new DdlStatement(DdlStatement.Type.DROP_INDEX,
                    sql);
            stmt.setIndexName(c.identifier("index name"));
            c.expectKeyword("ON");
            stmt.addTable(c.tableName());
            return stmt;
        }

        return null;
    }

    private DdlStatement parseAlter(Cursor c) throws SqlParseException
    {
        String sql = c.getSql();
        if (c.acceptKeyword("DATABASE") || c.acceptKeyword("SCHEMA"))
        {
            DdlStatement stmt = new DdlStatement(
                    DdlStatement.Type.ALTER_DATABASE, sql);
            if (c.atEnd())
                throw c.error("Expected schema name or options");
            Token t = c.peek();
            if (t.isIdentifier() && !isDatabaseOption(t))
                stmt.setSchema(c.identifier("schema name"));
            return stmt;
        }

        if (!c.acceptKeyword("ONLINE"))
            c.acceptKeyword("OFFLINE");
        boolean ignore = c.acceptKeyword("IGNORE");
        if (c.acceptKeyword("TABLE"))
        {
            DdlStatement stmt = new DdlStatement(
                    DdlStatement.Type.ALTER_TABLE, sql);
            stmt.setIgnore(ignore);
            stmt.addTable(c.tableName());
            parseAlterSpecs(c, stmt);
            return stmt;
        }
        else if (ignore)
            throw c.error("Expected TABLE");

        return null;
    }

    // Words that may follow ALTER DATABASE when the schema name is omitted.
    private static boolean isDatabaseOption(Token t)
    {
        return t.isKeyword("DEFAULT") || t.isKeyword("CHARACTER")
                || t.isKeyword("CHARSET") || t.isKeyword("COLLATE")
                || t.isKeyword("ENCRYPTION") || t.isKeyword("READ");
    }

    // Splits the remainder of ALTER TABLE into clauses at top-level commas.
    private void parseAlterSpecs(Cursor c, DdlStatement stmt)
            throws SqlParseException
    {
        List<Token> spec = new ArrayList<Token>();
        boolean sawComma = false;
        int depth = 0;
        while (!c.atEnd())
        {
            Token t = c.peek();
            if (depth == 0 && t.isSymbol(';') && c.isLast())
                break;
            c.next();

            if (t.isSymbol('('))
                depth++;
            else if (t.isSymbol(')'))
            {
                if (--depth < 0)
                    throw c.error("Unbalanced parentheses", t);
            }
            else if (depth == 0 && t.isSymbol(','))
            {
                if (spec.isEmpty())
                    throw c.error("Empty alter specification", t);
                stmt.addAlterSpec(alterSpec(c.getSql(), spec));
                spec = new ArrayList<Token>();
                sawComma = true;
                continue;
            }
            spec.add(t);
        }

        if (depth != 0)
            throw c.error("Unbalanced parentheses");
        if (spec.isEmpty())
        {
            if (sawComma)
                throw c.error("Empty alter specification");
        }
        else
            stmt.addAlterSpec(alterSpec(c.getSql(), spec));
        c.endOfStatement();
    }

    // Builds a clause from its tokens, noting a table rename.
    private DdlStatement.AlterSpec alterSpec(String sql, List<Token> tokens)
            throws SqlParseException
    {
        String text = sql.substring(tokens.get(0).getStart(),
                tokens.get(tokens.size() - 1).getEnd());
        TableName renameTo = null;

        Cursor spec = new Cursor(sql, tokens);
        if (spec.acceptKeyword("RENAME"))
        {
            Token next = spec.peek();
            if (next != null && !next.isKeyword("COLUMN")
                    && !next.isKeyword("INDEX") && !next.isKeyword("KEY"))
            {
                if (!spec.acceptKeyword("TO"))
                    spec.acceptKeyword("AS");
                renameTo = spec.tableName();
            }
        }
        return new DdlStatement.AlterSpec(text, renameTo);
    }

    private DdlStatement parseRename(Cursor c) throws SqlParseException
    {
        if (!c.acceptKeyword("TABLE"))
            return null;

        DdlStatement stmt = new DdlStatement(DdlStatement.Type.RENAME_TABLE,
                c.getSql());
        do
        {
            TableName from = c.tableName();
            c.expectKeyword("TO");
            TableName to = c.tableName();
            stmt.addRename(from, to);
        }
        while (c.acceptSymbol(','));
        c.endOfStatement();
        return stmt;
    }

    private DdlStatement parseTruncate(Cursor c) throws SqlParseException
    {
        DdlStatement stmt = new DdlStatement(DdlStatement.Type.TRUNCATE_TABLE,
                c.getSql());
        c.acceptKeyword("TABLE");
        stmt.addTable(c.tableName());
        c.endOfStatement();
        return stmt;
    }

    /**
     * Position in a token list. Each parse call uses its own cursor, which
     * keeps the parser itself free of per-statement state.
     */
    private static class Cursor
    {
        private final String      sql;
        private final List<Token> tokens;
        private int               pos = 0;

        Cursor(String sql, List<Token> tokens)
        {
            this.sql = sql;
            this.tokens = tokens;
        }

        String getSql()
        {
            return sql;
        }

        boolean atEnd()
        {
            return pos >= tokens.size();
        }

        boolean isLast()
        {
            return pos == tokens.size() - 1;
        }

        Token peek()
        {
            return atEnd() ? null : tokens.get(pos);
        }

        Token next()
        {
            return tokens.get(pos++);
        }

        boolean acceptKeyword(String keyword)
        {
            if (!atEnd() && tokens.get(pos).isKeyword(keyword))
            {
                pos++;
                return true;
            }
            return false;
        }

        // Accepts a keyword sequence only if all of it is present.
        boolean acceptKeywords(String... keywords)
        {
            if (pos + keywords.length > tokens.size())
                return false;
            for (int i = 0; i < keywords.length; i++)
            {
                if (!tokens.get(pos + i).isKeyword(keywords[i]))
                    return false;
            }
            pos += keywords.length;
            return true;
        }

        void expectKeyword(String keyword) throws SqlParseException
        {
            if (!acceptKeyword(keyword))
                throw error("Expected " + keyword);
        }

        boolean acceptSymbol(char symbol)
        {
            if (!atEnd() && tokens.get(pos).isSymbol(symbol))
            {
                pos++;
                return true;
            }
            return false;
        }

        String identifier(String what) throws SqlParseException
        {
            if (atEnd() || !tokens.get(pos).isIdentifier())
                throw error("Expected " + what);
            return tokens.get(pos++).getValue();
        }

        TableName tableName() throws SqlParseException
        {
            String first = identifier("table name");
            if (acceptSymbol('.'))
                return new TableName(first, identifier("table name"));
            return new TableName(null, first);
        }

        // Allows a trailing semicolon and nothing else.
        void endOfStatement() throws SqlParseException
        {
            acceptSymbol(';');
            if (!atEnd())
                throw error("Unexpected text");
        }

        SqlParseException error(String msg)
        {
            return error(msg, peek());
        }

        SqlParseException error(String msg, Token t)
        {
            if (t == null)
                return new SqlParseException(msg + " at end of statement",
                        sql, sql.length());
            return new SqlParseException(msg + " near '" + t.getValue() + "'",
                    sql, t.getStart());
        }
    }
}
