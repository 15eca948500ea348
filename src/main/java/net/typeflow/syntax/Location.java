// Copyright 2025 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.typeflow.syntax;

import com.google.auto.value.AutoValue;

/**
 * A Location denotes a position within a source file: a file name and a 1-based line and column.
 * A column of zero means the column is unknown.
 */
@AutoValue
public abstract class Location implements Comparable<Location> {

  /** A location for built-in entities that have no source. */
  public static final Location BUILTIN = create("<builtin>", 0, 0);

  public abstract String file();

  public abstract int line();

  public abstract int column();

  public static Location create(String file, int line, int column) {
    return new AutoValue_Location(file, line, column);
  }

  @Override
  public final String toString() {
    StringBuilder buf = new StringBuilder(file());
    if (line() != 0) {
      buf.append(':').append(line());
      if (column() != 0) {
        buf.append(':').append(column());
      }
    }
    return buf.toString();
  }

  @Override
  public int compareTo(Location that) {
    int cmp = file().compareTo(that.file());
    if (cmp != 0) {
      return cmp;
    }
    cmp = Integer.compare(line(), that.line());
    if (cmp != 0) {
      return cmp;
    }
    return Integer.compare(column(), that.column());
  }
}
