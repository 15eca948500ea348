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

import com.google.common.base.Preconditions;
import java.util.Arrays;

/**
 * FileLocations maps char offsets within a file to {@link Location}s.
 *
 * <p>The line-start table is computed once, eagerly, when the file is scanned.
 */
final class FileLocations {

  private final int[] linestart; // maps line number (line >= 1) to char offset
  private final String file;
  private final int size; // size of file in chars

  private FileLocations(int[] linestart, String file, int size) {
    this.linestart = linestart;
    this.file = file;
    this.size = size;
  }

  static FileLocations create(char[] buffer, String file) {
    return new FileLocations(computeLinestart(buffer), file, buffer.length);
  }

  private static int[] computeLinestart(char[] buffer) {
    // Compute the size.
    int n = 1;
    for (char c : buffer) {
      if (c == '\n') {
        n++;
      }
    }

    // Populate the table.
    int[] linestart = new int[n + 1]; // linestart[0] is unused
    int line = 1;
    linestart[line++] = 0;
    for (int i = 0; i < buffer.length; i++) {
      if (buffer[i] == '\n') {
        linestart[line++] = i + 1;
      }
    }
    return linestart;
  }

  String file() {
    return file;
  }

  int size() {
    return size;
  }

  // Returns the line number (1-based) containing the specified offset.
  private int getLineAt(int offset) {
    Preconditions.checkArgument(
        offset >= 0 && offset <= size, "offset %s out of range [0, %s]", offset, size);
    int i = Arrays.binarySearch(linestart, 1, linestart.length, offset);
    if (i < 0) {
      i = -i - 2; // insertion point minus one
    }
    return i;
  }

  Location getLocation(int offset) {
    int line = getLineAt(offset);
    int column = offset - linestart[line] + 1;
    return Location.create(file, line, column);
  }
}
