/*
 * Copyright 2025 AxonOps
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
 */

package com.axonops.assetscan.tools.corpus;

/**
 * Thrown when a corpus root cannot be walked or a report cannot be written.
 *
 * @since 1.0.0
 */
public final class CorpusException extends RuntimeException {
    private final String path;

    public CorpusException(String message, String path) {
        super("AssetScan: " + message + ": " + path);
        this.path = path;
    }

    public CorpusException(String message, String path, Throwable cause) {
        super("AssetScan: " + message + ": " + path, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
