/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.boxer.batch;

import net.hydromatic.boxer.ast.Drt;
import net.hydromatic.boxer.parse.BoxerParseException;

/**
 * Called on various events while a batch is demultiplexed.
 *
 * <p>If discourses are parsed in parallel, methods may be called from
 * several threads at once.
 */
public interface Tracer {
  /** Called when the term of a discourse has been located, before it is
   * parsed. */
  void onBlock(TermBlock block);

  /** Called with the simplified expression of a discourse. */
  void onResult(String discourseId, Drt.Exp exp);

  /** Called when the term of a discourse cannot be parsed. The discourse
   * will have no expression. */
  void onException(String discourseId, BoxerParseException e);
}

// End Tracer.java
