/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.reasoning.domain.notebook;

/**
 * One captured output record of a code cell.
 */
public record CellOutput(OutputType type, String data) {

    public static CellOutput stdout(String data) {
        return new CellOutput(OutputType.STDOUT, data);
    }

    public static CellOutput stderr(String data) {
        return new CellOutput(OutputType.STDERR, data);
    }

    public static CellOutput result(String data) {
        return new CellOutput(OutputType.RESULT, data);
    }

    public static CellOutput error(String data) {
        return new CellOutput(OutputType.ERROR, data);
    }
}
