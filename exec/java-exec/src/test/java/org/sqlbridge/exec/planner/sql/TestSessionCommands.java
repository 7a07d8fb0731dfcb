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
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;
import org.junit.experimental.categories.Category;
import org.sqlbridge.categories.SqlTest;
import org.sqlbridge.common.exceptions.ErrorType;
import org.sqlbridge.common.exceptions.UserException;
import org.sqlbridge.exec.ExecConstants;
import org.sqlbridge.exec.planner.sql.handlers.SetOptionHandler;
import org.sqlbridge.exec.record.ResultSchema;
import org.sqlbridge.exec.record.Row;
import org.sqlbridge.exec.rpc.user.SessionHandle;
import org.sqlbridge.exec.work.operation.OperationHandle;
import org.sqlbridge.test.BaseTestQuery;

import com.google.common.collect.ImmutableList;

@Category(SqlTest.class)
public class TestSessionCommands extends BaseTestQuery {

  @Test
  public void setWithoutArgumentsListsSessionValues() {
    final SessionHandle session = openSession();
    assertEquals(ImmutableList.of(), query(session, "SET"));

    query(session, "set b.key=2");
    query(session, "set a.key = 1;");

    assertEquals(ImmutableList.of(Row.of("a.key", "1"), Row.of("b.key", "2")), query(session, "set"));
  }

  @Test
  public void setReturnsTheValueSet() {
    final SessionHandle session = openSession();
    final OperationHandle handle = execute(session, "SET hiveconf:region=emea");
    final ResultSchema schema = service.getResultSetMetadata(handle);
    assertEquals(2, schema.getColumnCount());
    assertEquals("key", schema.getColumn(0).getName());
    assertEquals("value", schema.getColumn(1).getName());
    assertEquals(ImmutableList.of(Row.of("region", "emea")), fetchAll(handle));
  }

  @Test
  public void setKeyReturnsEffectiveValue() {
    final SessionHandle session = openSession();
    assertEquals(ImmutableList.of(Row.of(ExecConstants.DEFAULT_DATABASE_KEY, "default")),
        query(session, "set " + ExecConstants.DEFAULT_DATABASE_KEY));
    assertEquals(ImmutableList.of(Row.of("missing", SetOptionHandler.UNDEFINED)),
        query(session, "set missing"));

    query(session, "set hivevar:missing=found");
    assertEquals(ImmutableList.of(Row.of("missing", "found")), query(session, "set hiveconf:missing"));
  }

  @Test
  public void verboseSetListsEveryOption() {
    final SessionHandle session = openSession();
    query(session, "set custom=1");

    final OperationHandle handle = execute(session, "SET -v");
    assertEquals(3, service.getResultSetMetadata(handle).getColumnCount());
    final List<Row> rows = fetchAll(handle);
    assertEquals(ExecConstants.VALIDATORS.size() + 1, rows.size());

    boolean sawCustom = false;
    for (Row row : rows) {
      assertEquals(3, row.size());
      if ("custom".equals(row.get(0))) {
        assertEquals(Row.of("custom", "1", SetOptionHandler.UNDEFINED), row);
        sawCustom = true;
      }
      if (ExecConstants.ASYNC_EXECUTION_KEY.equals(row.get(0))) {
        assertEquals(ExecConstants.ASYNC_EXECUTION.getDescription(), row.get(2));
      }
    }
    assertTrue(sawCustom);
    assertEquals(rows, query(session, "set -v"));
  }

  @Test
  public void illTypedValueIsRejected() {
    final SessionHandle session = openSession();
    expectError(ErrorType.VALIDATION, new Runnable() {
      @Override
      public void run() {
        execute(session, "set " + ExecConstants.INCREMENTAL_COLLECT_KEY + "=maybe");
      }
    });
    assertEquals("true", queryValue(session, "select conf('" + ExecConstants.INCREMENTAL_COLLECT_KEY + "')"));
  }

  @Test
  public void resetRemovesSessionValues() {
    final SessionHandle session = openSession();
    query(session, "set a=1");
    query(session, "set b=2");
    query(session, "set " + ExecConstants.INCREMENTAL_COLLECT_KEY + "=false");

    query(session, "reset a");
    assertEquals(ImmutableList.of(Row.of("a", SetOptionHandler.UNDEFINED)), query(session, "set a"));
    assertEquals(ImmutableList.of(Row.of("b", "2"), Row.of(ExecConstants.INCREMENTAL_COLLECT_KEY, "false")),
        query(session, "set"));

    query(session, "RESET");
    assertEquals(ImmutableList.of(), query(session, "set"));
    assertEquals("true", queryValue(session, "select conf('" + ExecConstants.INCREMENTAL_COLLECT_KEY + "')"));
  }

  @Test
  public void useChangesCurrentDatabase() {
    final SessionHandle session = openSession();
    assertEquals("default", queryValue(session, "select current_database()"));
    assertEquals(ImmutableList.of(), query(session, "USE `Sales`"));
    assertEquals("sales", queryValue(session, "select current_database()"));
  }

  @Test
  public void temporaryViewLifecycle() {
    final SessionHandle session = openSession();
    query(session, "CREATE TEMPORARY VIEW v AS select 1");
    assertEquals(1, queryValue(session, "select * from v"));

    expectError(ErrorType.VALIDATION, new Runnable() {
      @Override
      public void run() {
        execute(session, "create temporary view v as select 2");
      }
    });
    query(session, "create temporary view if not exists v as select 2");
    assertEquals(1, queryValue(session, "select * from v"));

    query(session, "create or replace temp view V as select 3");
    assertEquals(3, queryValue(session, "select * from v"));

    query(session, "drop view v");
    expectError(ErrorType.ENGINE, new Runnable() {
      @Override
      public void run() {
        execute(session, "select * from v");
      }
    });
  }

  @Test
  public void dropOfUnknownViewReachesTheEngine() {
    final SessionHandle session = openSession();
    final int executions = engine.getExecutionCount();
    expectError(ErrorType.ENGINE, new Runnable() {
      @Override
      public void run() {
        execute(session, "drop view permanent_view");
      }
    });
    assertEquals(executions + 1, engine.getExecutionCount());
  }

  @Test
  public void temporaryViewShadowsTable() {
    engine.registerTable("t", ResultSchema.ofStrings("name"), ImmutableList.of(Row.of("table")));
    final SessionHandle session = openSession();
    assertEquals("table", queryValue(session, "select * from t"));
    query(session, "create temporary view t as select 'view'");
    assertEquals("view", queryValue(session, "select * from t"));
  }

  @Test
  public void temporaryFunctionLifecycle() {
    final SessionHandle session = openSession();
    query(session, "CREATE TEMPORARY FUNCTION MyUpper AS 'org.example.udf.Upper'");

    final OperationHandle handle = execute(session, "describe function extended myupper");
    assertEquals("function_desc", service.getResultSetMetadata(handle).getColumn(0).getName());
    assertEquals(ImmutableList.of(
        Row.of("Function: myupper"),
        Row.of("Class: org.example.udf.Upper"),
        Row.of("Usage: N/A.")), fetchAll(handle));

    final UserException duplicate = expectError(ErrorType.VALIDATION, new Runnable() {
      @Override
      public void run() {
        execute(session, "create temporary function myupper as 'org.example.udf.Other'");
      }
    });
    assertTrue(duplicate.getMessage().contains("Function myupper already exists"));

    query(session, "create or replace temporary function myupper as 'org.example.udf.Other'");
    assertEquals("Class: org.example.udf.Other", query(session, "desc function myupper").get(1).get(0));

    query(session, "drop temporary function myupper");
    final UserException missing = expectError(ErrorType.VALIDATION, new Runnable() {
      @Override
      public void run() {
        execute(session, "drop temporary function myupper");
      }
    });
    assertTrue(missing.getMessage().contains("Temporary function 'myupper' not found"));
    assertEquals(ImmutableList.of(), query(session, "drop temporary function if exists myupper"));
  }
}
