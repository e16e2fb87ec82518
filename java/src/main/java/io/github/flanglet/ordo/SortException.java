/*
Copyright 2011-2025 Frederic Langlet
Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
you may obtain a copy of the License at

                http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package io.github.flanglet.ordo;

/**
 * This class represents the precondition violations and resource failures
 * reported by the sorting engine. An error code identifies the condition.
 */
public class SortException extends RuntimeException {

    private static final long serialVersionUID = -4402719628360192507L;

    /**
     * Error code for undefined errors.
     */
    public static final int UNDEFINED = 0;

    /**
     * Error code for arguments outside of their valid range (rank, bounds).
     */
    public static final int INVALID_ARGUMENT = 1;

    /**
     * Error code for a temporary buffer that could not be obtained.
     */
    public static final int RESOURCE_EXHAUSTED = 2;

    private final int code;

    /**
     * Constructs a {@code SortException} with the specified detail message and
     * error code.
     *
     * @param message
     *            the detail message
     * @param code
     *            the error code
     */
    public SortException(String message, int code) {
        super(message);
        this.code = code;
    }

    /**
     * Constructs a {@code SortException} with the specified detail message,
     * cause, and error code.
     *
     * @param message
     *            the detail message
     * @param cause
     *            the underlying failure
     * @param code
     *            the error code
     */
    public SortException(String message, Throwable cause, int code) {
        super(message, cause);
        this.code = code;
    }

    /**
     * Returns the error code associated with this exception.
     *
     * @return the error code
     */
    public int getErrorCode() {
        return this.code;
    }
}
