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
package org.sqlbridge.exec.engine;

import org.sqlbridge.exec.ops.QueryContext;

/**
 * The SQL engine the server delegates to. Parsing, planning and execution all happen behind this
 * interface.
 *
 * <p>Implementations must be thread safe: statements of different operations are executed
 * concurrently. A long running call should poll {@link QueryContext#getCancellationSignal()} at
 * convenient points and give up once it is set; the calling thread is interrupted as well.</p>
 */
public interface QueryEngine {

  /**
   * Executes one statement.
   *
   * @param context statement text, effective options and the session the statement runs in
   * @return schema and rows of the result; rows may still be produced lazily
   * @throws Exception any failure, reported to the client as an engine error
   */
  QueryResult execute(QueryContext context) throws Exception;
}
