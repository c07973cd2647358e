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

package me.golemcore.reasoning.domain.exception;

/**
 * Stable machine-readable codes for failures raised by the reasoning core.
 */
public enum ErrorCode {

    /**
     * A node, edge, cell, execution or artifact ceiling has been reached.
     */
    CAPACITY_EXCEEDED,

    /**
     * A referenced node, edge, session, notebook or cell does not exist.
     */
    REFERENCE_NOT_FOUND,

    /**
     * Input is out of range or malformed.
     */
    VALIDATION_FAILED,

    /**
     * Sandboxed code threw or ran past its deadline.
     */
    EXECUTION_FAILED,

    /**
     * Disk I/O or parse failure while loading or saving state.
     */
    PERSISTENCE_FAILED
}
