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

package com.axonops.assetscan.api;

/**
 * Thrown when a zero-length pattern is registered.
 *
 * <p>Empty patterns are rejected at {@link AutomatonBuilder#register(String)}, never silently
 * dropped: an empty pattern would trivially occur in every document.
 *
 * @since 1.0.0
 */
public final class EmptyPatternException extends AssetScanException {

    private final int position;

    public EmptyPatternException(int position) {
        super("AssetScan: Empty pattern rejected (registration #" + position + ")");
        this.position = position;
    }

    /**
     * Zero-based index of the rejected registration call on its builder.
     */
    public int getPosition() {
        return position;
    }
}
