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

/**
 * Turns DDL text into single-target statements. Statements that name several
 * tables (DROP TABLE with a table list, RENAME TABLE with several renames,
 * ALTER TABLE with clauses after a RENAME TO) are split into one statement per
 * target, in source order, each with SQL text that can be replayed on its own.
 * Statements with a single target keep their original text.
 * <p>
 * Unqualified table names resolve to the default schema supplied by the
 * caller, normally the schema that was current on the source.
 */
public class DdlResolver
{
    private static Logger   logger = Logger.getLogger(DdlResolver.class);

    private final DdlParser parser;

    /**
     * Creates a resolver using the MySQL dialect parser.
     */
    public DdlResolver()
    {
        this(new MySQLDdlParser());
    }

    public DdlResolver(DdlParser parser)
    {
        this.parser = parser;
    }

    /**
     * Resolves a statement with no default schema.
     * 
     * @see #resolve(String, String)
     */
    public ResolvedDdl resolve(String sql) throws SqlParseException
    {
        return resolve(sql, null);
    }

    /**
     * Resolves a statement into normalized statements.
     * 
     * @param sql Statement text
     * @param defaultSchema Schema for unqualified names, or null/empty if none
     * @return Normalized statements, or a result for which isDdl() is false if
     *         the statement is not recognized DDL
     * @throws SqlParseException Thrown if the statement is DDL but cannot be
     *             parsed
     */
    public ResolvedDdl resolve(String sql, String defaultSchema)
            throws SqlParseException
    {
        DdlStatement stmt = parser.parse(sql);
        if (stmt == null)
            return ResolvedDdl.notDdl();

        String schema = (defaultSchema == null || defaultSchema.length() == 0)
                ? null
                : defaultSchema;
        String text = sql.trim();
        List<NormalizedStatement> out = new ArrayList<NormalizedStatement>();

        switch (stmt.getType())
        {
            case CREATE_DATABASE :
                out.add(new NormalizedStatement(StatementKind.CREATE_SCHEMA,
                        stmt.getSchema(), null, text));
                break;
            case DROP_DATABASE :
                out.add(new NormalizedStatement(StatementKind.DROP_SCHEMA,
                        stmt.getSchema(), null, text));
                break;
            case ALTER_DATABASE :
                String target = stmt.getSchema() == null ? schema : stmt
                        .getSchema();
                out.add(new NormalizedStatement(StatementKind.ALTER_SCHEMA,
                        target, null, text));
                break;
            case CREATE_TABLE :
                out.add(tableStatement(StatementKind.CREATE_TABLE, stmt
                        .getTables().get(0), schema, text));
                break;
            case TRUNCATE_TABLE :
                out.add(tableStatement(StatementKind.TRUNCATE_TABLE, stmt
                        .getTables().get(0), schema, text));
                break;
            case CREATE_INDEX :
                out.add(tableStatement(StatementKind.CREATE_INDEX, stmt
                        .getTables().get(0), schema, text));
                break;
            case DROP_INDEX :
                out.add(tableStatement(StatementKind.DROP_INDEX, stmt
                        .getTables().get(0), schema, text));
                break;
            case DROP_TABLE :
                resolveDropTable(stmt, schema, text, out);
                break;
            case RENAME_TABLE :
                resolveRenameTable(stmt, schema, text, out);
                break;
            case ALTER_TABLE :
                resolveAlterTable(stmt, schema, text, out);
                break;
        }

        if (logger.isDebugEnabled())
            logger.debug("Resolved DDL into " + out.size() + " statement(s): "
                    + out);
        return ResolvedDdl.of(out);
    }

    private void resolveDropTable(DdlStatement stmt, String schema,
            String text, List<NormalizedStatement> out)
    {
        List<TableName> tables = stmt.getTables();
        if (tables.size() == 1)
        {
            out.add(tableStatement(StatementKind.DROP_TABLE, tables.get(0),
                    schema, text));
            return;
        }

        StringBuilder prefix = new StringBuilder("DROP ");
        if (stmt.isTemporary())
            prefix.append("TEMPORARY ");
        prefix.append("TABLE ");
        if (stmt.isIfExists())
            prefix.append("IF EXISTS ");
        for (TableName table : tables)
        {
            out.add(tableStatement(StatementKind.DROP_TABLE, table, schema,
                    prefix + table.toSql()));
        }
    }

    // Rename units are addressed to the table being renamed.
    private void resolveRenameTable(DdlStatement stmt, String schema,
            String text, List<NormalizedStatement> out)
    {
        List<TableName> from = stmt.getTables();
        List<TableName> to = stmt.getRenameTargets();
        if (from.size() == 1)
        {
            out.add(tableStatement(StatementKind.RENAME_TABLE, from.get(0),
                    schema, text));
            return;
        }

        for (int i = 0; i < from.size(); i++)
        {
            out.add(tableStatement(StatementKind.RENAME_TABLE, from.get(i),
                    schema, "RENAME TABLE " + from.get(i).toSql() + " TO "
                            + to.get(i).toSql()));
        }
    }

    // An ALTER TABLE stays one unit with its original text unless a RENAME TO
    // clause moves later clauses to another table. Clauses are then grouped
    // by the table they address: the RENAME TO clause closes the group of the
    // old name and the clauses after it form the group of the new name.
    private void resolveAlterTable(DdlStatement stmt, String schema,
            String text, List<NormalizedStatement> out)
    {
        TableName current = stmt.getTables().get(0);
        List<TableName> targets = new ArrayList<TableName>();
        List<StringBuilder> clauses = new ArrayList<StringBuilder>();
        StringBuilder group = null;
        for (DdlStatement.AlterSpec spec : stmt.getAlterSpecs())
        {
            if (group == null)
            {
                group = new StringBuilder();
                targets.add(current);
                clauses.add(group);
            }
            if (group.length() > 0)
                group.append(", ");
            group.append(spec.getText());

            TableName renameTo = spec.getRenameTo();
            if (renameTo != null
                    && !sameTable(current, renameTo, schema))
            {
                current = renameTo;
                group = null;
            }
        }

        if (targets.size() <= 1)
        {
            out.add(tableStatement(StatementKind.ALTER_TABLE,
                    stmt.getTables().get(0), schema, text));
            return;
        }

        String prefix = stmt.isIgnore() ? "ALTER IGNORE TABLE " : "ALTER TABLE ";
        for (int i = 0; i < targets.size(); i++)
        {
            TableName target = targets.get(i);
            out.add(tableStatement(StatementKind.ALTER_TABLE, target, schema,
                    prefix + target.toSql() + " " + clauses.get(i)));
        }
    }

    private static boolean sameTable(TableName a, TableName b,
            String defaultSchema)
    {
        String schemaA = a.resolveSchema(defaultSchema);
        String schemaB = b.resolveSchema(defaultSchema);
        boolean sameSchema = schemaA == null
                ? schemaB == null
                : schemaA.equals(schemaB);
        return sameSchema && a.getName().equals(b.getName());
    }

    private NormalizedStatement tableStatement(StatementKind kind,
            TableName table, String defaultSchema, String sql)
    {
        return new NormalizedStatement(kind,
                table.resolveSchema(defaultSchema), table.getName(), sql);
    }
}
