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
package net.hydromatic.boxer;

import java.io.IOException;

/**
 * Runs the C&amp;C parser and Boxer.
 *
 * <p>Implementations find and launch the programs; this library only
 * prepares their input and reads their output.
 */
public interface BoxerClient {
  /**
   * Passes input to the C&amp;C parser, passes its result to Boxer, and
   * returns what Boxer writes. Boxer must be asked for DRS semantics in
   * Prolog format, not flattened, with box output off.
   *
   * @param input Discourses formatted by
   *     {@link net.hydromatic.boxer.batch.Submission#format}
   * @return Output of Boxer
   * @throws IOException if either program cannot be run or fails
   */
  String call(String input) throws IOException;
}

// End BoxerClient.java
