/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.sqlbridge.exec.planner.sql;

import static org.junit.Assert.assertEquals;

import java.util.List;

import org.junit.Test;
import org.junit.experimental.categories.Category;
import org.sqlbridge.categories.SqlTest;
import org.sqlbridge.exec.ExecConstants;
import org.sqlbridge.exec.record.Row;
import org.sqlbridge.exec.rpc.user.SessionHandle;
import org.sqlbridge.exec.server.options.SessionOptionManager;
import org.sqlbridge.test.BaseTestQuery;

import com.google.common.collect.ImmutableMap;

@Category(SqlTest.class)
public class TestVariableSubstitution extends BaseTestQuery {

  @Test
  public void replacesKnownReferences() {
    final SessionOptionManager options = new SessionOptionManager(server.getContext().getOptionManager());
    options.setOption("table", "range(3)");
    options.setOption("limit", "10");

    assertEquals("select * from range(3) limit 10",
        VariableSubstitution.substitute("select * from ${table} limit ${hivevar:limit}", options));
    assertEquals("select 'default'",
        VariableSubstitution.substitute("select '${hiveconf:" + ExecConstants.DEFAULT_DATABASE_KEY + "}'", options));
  }

  @Test
  public void keepsUnknownReferences() {
    final SessionOptionManager options = new SessionOptionManager(server.getContext().getOptionManager());
    assertEquals("select '${nothing}', '${ spaced }', '$plain'",
        VariableSubstitution.substitute("select '${nothing}', '${ spaced }', '$plain'", options));
  }

  @Test
  public void replacementIsLiteral() {
    final SessionOptionManager options = new SessionOptionManager(server.getContext().getOptionManager());
    options.setOption("price", "$1\\2");
    assertEquals("select '$1\\2'", VariableSubstitution.substitute("select '${price}'", options));
  }

  @Test
  public void statementsAreSubstituted() {
    final SessionHandle session = openSession();
    query(session, "set hivevar:rows=4");
    assertEquals(4, query(session, "select * from range(${hivevar:rows})").size());
  }

  @Test
  public void perStatementValuesAreSubstituted() {
    final SessionHandle session = openSession();
    final List<Row> rows = fetchAll(service.executeStatement(session, "select * from range(${n})",
        ImmutableMap.of("n", "2"), false));
    assertEquals(2, rows.size());
  }

  @Test
  public void substitutionCanBeDisabled() {
    final SessionHandle session = openSession();
    query(session, "set greeting=hello");
    assertEquals("hello", queryValue(session, "select '${greeting}'"));

    query(session, "set " + ExecConstants.VARIABLE_SUBSTITUTE_KEY + "=false");
    assertEquals("${greeting}", queryValue(session, "select '${greeting}'"));
  }
}
