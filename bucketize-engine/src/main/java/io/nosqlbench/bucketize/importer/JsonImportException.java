package io.nosqlbench.bucketize.importer;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.nosqlbench.bucketize.api.BucketizeException;

/// A line of an import file could not be turned into a row.
public class JsonImportException extends BucketizeException {
    private final long lineNumber;

    public JsonImportException(String message, long lineNumber) {
        super(message);
        this.lineNumber = lineNumber;
    }

    public JsonImportException(String message, long lineNumber, Throwable cause) {
        super(message, cause);
        this.lineNumber = lineNumber;
    }

    /// @return the zero-based physical line number
    public long getLineNumber() {
        return lineNumber;
    }
}
