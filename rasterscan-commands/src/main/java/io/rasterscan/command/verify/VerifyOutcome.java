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


package io.rasterscan.command.verify;

/// The result of comparing one case with the sequential baseline.
///
/// @param testCase the case that was run
/// @param md5Ok true if the encoded output image has the baseline's MD5
/// @param countersOk true if every palette counter equals the baseline's
/// @param timeMs wall-clock time of the run in milliseconds
public record VerifyOutcome(VerifyCase testCase, boolean md5Ok, boolean countersOk, long timeMs) {

    /// @return true if both the image and the counters match
    public boolean passed() {
        return md5Ok && countersOk;
    }

    /// @return one CSV row matching {@link CMD_verify#CSV_HEADER}
    public String toCsvRow() {
        return String.join(",",
            testCase.strategy().name().toLowerCase(),
            String.valueOf(testCase.threads()),
            testCase.schedule().name().toLowerCase(),
            String.valueOf(testCase.chunk()),
            String.valueOf(md5Ok),
            String.valueOf(countersOk),
            String.valueOf(timeMs));
    }
}
