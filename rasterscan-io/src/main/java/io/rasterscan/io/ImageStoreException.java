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


package io.rasterscan.io;

/// Raised when a raw pixel file cannot be opened, read or written.
///
/// Wraps the underlying {@link java.io.IOException} so callers deep in the
/// pipeline do not have to declare it.
public class ImageStoreException extends RuntimeException {

    /// @param message what failed, including the path
    /// @param cause the I/O failure
    public ImageStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    /// @param message what failed, including the path
    public ImageStoreException(String message) {
        super(message);
    }
}
