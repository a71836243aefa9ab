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

package com.axonops.assetscan.tools.assets;

import com.axonops.assetscan.api.UsageReport;
import com.axonops.assetscan.tools.report.ReportWriter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of {@link UnusedAssetFinder#find}.
 *
 * @param assetNames file name of every asset file, duplicates included
 * @param sourceNames file name of every source file searched
 * @param usage used and unused asset names plus the sources each used asset appeared in
 */
public record UnusedAssets(List<String> assetNames, List<String> sourceNames, UsageReport usage) {

    public static final String ALL_IMAGES_FILE = "all_images.json";
    public static final String ALL_FILES_FILE = "all_files.json";
    public static final String UNUSED_IMAGES_FILE = "unused_images.json";
    public static final String IMAGE_USAGE_FILE = "image_usage.json";

    public UnusedAssets {
        assetNames = List.copyOf(assetNames);
        sourceNames = List.copyOf(sourceNames);
        Objects.requireNonNull(usage, "usage cannot be null");
    }

    public List<String> unusedAssets() {
        return new ArrayList<>(usage.unusedPatterns());
    }

    public List<String> usedAssets() {
        return new ArrayList<>(usage.usedPatterns());
    }

    /** Used asset name to the paths of the sources referencing it. */
    public Map<String, List<String>> assetUsage() {
        return usage.occurrences();
    }

    /**
     * Writes the four report files.
     */
    public void writeTo(ReportWriter writer) {
        writer.writeJson(ALL_IMAGES_FILE, assetNames);
        writer.writeJson(ALL_FILES_FILE, sourceNames);
        writer.writeJson(UNUSED_IMAGES_FILE, unusedAssets());
        writer.writeJson(IMAGE_USAGE_FILE, assetUsage());
    }
}
