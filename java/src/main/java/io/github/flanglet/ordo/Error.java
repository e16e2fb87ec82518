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
 * This final class defines the exit codes of the command line applications.
 */
public final class Error {

    /**
     * The output is a folder
     */
    public static final int ERR_OUTPUT_IS_DIR = 6;

    /**
     * Failure to overwrite a file
     */
    public static final int ERR_OVERWRITE_FILE = 7;

    /**
     * Failure to open a file
     */
    public static final int ERR_OPEN_FILE = 10;

    /**
     * Failure to read a file
     */
    public static final int ERR_READ_FILE = 11;

    /**
     * Failure to write a file
     */
    public static final int ERR_WRITE_FILE = 12;

    /**
     * Invalid parameter
     */
    public static final int ERR_INVALID_PARAM = 18;

    /**
     * Not enough memory for the temporary buffer
     */
    public static final int ERR_RESOURCE_EXHAUSTED = 20;

    /**
     *  Unknown error
     */
    public static final int ERR_UNKNOWN = 127;

    private Error() {
    }
}
