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

import static java.util.Objects.requireNonNull;

/** The DRS term of one discourse, as found in the output of Boxer. */
public class TermBlock {
  /** Identifier of the discourse, without quotes. */
  public final String discourseId;
  /** Identifier that Boxer gave the DRS, used in its {@code sem} header. */
  public final String drsId;
  /** Text of the term, without the trailing {@code ").")}. */
  public final String term;
  /** 1-based line of the output that holds the term. */
  public final int line;

  public TermBlock(String discourseId, String drsId, String term, int line) {
    this.discourseId = requireNonNull(discourseId);
    this.drsId = requireNonNull(drsId);
    this.term = requireNonNull(term);
    this.line = line;
  }

  @Override public String toString() {
    return "TermBlock{discourseId=" + discourseId
        + ", drsId=" + drsId
        + ", line=" + line
        + "}";
  }
}

// End TermBlock.java
