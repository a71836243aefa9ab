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

package com.axonops.assetscan.tools.cli;

import com.axonops.assetscan.api.AssetScanException;
import com.axonops.assetscan.api.Document;
import com.axonops.assetscan.config.ScanConfig;
import com.axonops.assetscan.dropwizard.ScanMetricsConfig;
import com.axonops.assetscan.metrics.DropwizardMetricsAdapter;
import com.axonops.assetscan.tools.assets.UnusedAssetFinder;
import com.axonops.assetscan.tools.assets.UnusedAssets;
import com.axonops.assetscan.tools.corpus.CorpusException;
import com.axonops.assetscan.tools.corpus.CorpusWalker;
import com.axonops.assetscan.tools.corpus.DocumentLoader;
import com.axonops.assetscan.tools.css.CssPropertyAnalyzer;
import com.axonops.assetscan.tools.css.CssVariableAnalyzer;
import com.axonops.assetscan.tools.css.SassVariableAnalyzer;
import com.axonops.assetscan.tools.report.ReportWriter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Command line front end.
 *
 * <pre>
 * assetscan unused-assets  -i &lt;asset dirs...&gt; -f &lt;source dirs...&gt; [-o dir] [-x excludes...] [-p n] [--metrics] [--jmx]
 * assetscan css-variables  -d &lt;style dirs...&gt; -f &lt;declaration files...&gt; [-o dir] [-x excludes...]
 * assetscan sass-variables -f &lt;style files...&gt; [-o dir]
 * assetscan css-properties -d &lt;style dirs...&gt; [-o dir] [-x excludes...]
 * </pre>
 *
 * <p>Reports are written to the output directory (default: working directory). Exit status is 0
 * on success, 1 when a directory or file cannot be processed and 2 on a usage error.
 */
public final class AssetScanCli {
    private static final Logger logger = LoggerFactory.getLogger(AssetScanCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = String.join("\n",
        "Usage: assetscan <command> [options]",
        "",
        "Commands:",
        "  unused-assets   -i <asset dirs...> -f <source dirs...>   asset files referenced by no html/ts/js/scss/css file",
        "  css-variables   -d <style dirs...> -f <declaration files...>   undeclared and unused CSS custom properties",
        "  sass-variables  -f <style files...>   unique, duplicate and conflicting SASS and CSS variables",
        "  css-properties  -d <style dirs...>   frequency of property values and class bodies",
        "",
        "Options:",
        "  -o, --output <dir>        report directory (default: .)",
        "  -x, --exclude <names...>  parent directory names to skip (default: bourbon custom neat)",
        "  -p, --parallelism <n>     scan worker threads (default: available processors)",
        "  --metrics                 log scan metrics at the end",
        "  --jmx                     expose scan metrics via JMX while running",
        "",
        "List values stop at the next argument starting with '-'. To pass such a value, put the",
        "option last and separate its values with --, e.g. -i -- -legacy images");

    private AssetScanCli() {
        // Entry point only
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String... args) {
        if (args.length == 0) {
            System.err.println(USAGE);
            return EXIT_USAGE;
        }
        String command = args[0];
        CliOptions options = CliOptions.parse(Arrays.copyOfRange(args, 1, args.length));
        if (options.help || "-h".equals(command) || "--help".equals(command)) {
            System.out.println(USAGE);
            return EXIT_OK;
        }
        if (!options.errors.isEmpty()) {
            return usageError(String.join("; ", options.errors));
        }

        long startNanos = System.nanoTime();
        try {
            int status = switch (command) {
                case "unused-assets" -> unusedAssets(options);
                case "css-variables" -> cssVariables(options);
                case "sass-variables" -> sassVariables(options);
                case "css-properties" -> cssProperties(options);
                default -> usageError("Unknown command: " + command);
            };
            if (status == EXIT_OK) {
                logger.info("AssetScan: {} completed in {} ms", command,
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
            }
            return status;
        } catch (CorpusException | AssetScanException e) {
            logger.error("{}", e.getMessage(), e);
            return EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            return usageError(e.getMessage());
        }
    }

    private static int unusedAssets(CliOptions options) {
        if (options.images.isEmpty() || options.files.isEmpty()) {
            return usageError("unused-assets requires -i <asset dirs...> and -f <source dirs...>");
        }

        MetricRegistry registry = new MetricRegistry();
        ScanConfig config = scanConfig(options, registry);
        try {
            UnusedAssetFinder finder = new UnusedAssetFinder(new CorpusWalker(options.excludes), new DocumentLoader(), config);
            UnusedAssets result = finder.find(options.images, options.files);
            result.writeTo(new ReportWriter(options.output));
        } finally {
            if (options.metrics) {
                reportMetrics(registry);
            }
            if (options.jmx) {
                ScanMetricsConfig.shutdown();
            }
        }
        return EXIT_OK;
    }

    private static int cssVariables(CliOptions options) {
        if (options.directories.isEmpty() || options.files.isEmpty()) {
            return usageError("css-variables requires -d <style dirs...> and -f <declaration files...>");
        }

        DocumentLoader loader = new DocumentLoader();
        List<Document> declarationFiles = loader.load(options.files);
        List<Document> styleFiles = loader.load(new CorpusWalker(options.excludes).collect(options.directories, List.of("*.scss")));
        logger.info("AssetScan: Found {} scss files", styleFiles.size());

        CssVariableAnalyzer.Report report = new CssVariableAnalyzer().analyze(declarationFiles, styleFiles);
        logger.info("AssetScan: Found {} declared, {} undeclared, {} unused variables",
            report.declared().size(), report.undeclared().size(), report.unused().size());

        ReportWriter writer = new ReportWriter(options.output);
        writer.writeJson(CssVariableAnalyzer.DECLARED_FILE, report.declared());
        writer.writeJson(CssVariableAnalyzer.UNDECLARED_FILE, report.undeclared());
        writer.writeJson(CssVariableAnalyzer.UNUSED_FILE, report.unused());
        return EXIT_OK;
    }

    private static int sassVariables(CliOptions options) {
        if (options.files.isEmpty()) {
            return usageError("sass-variables requires -f <style files...>");
        }

        SassVariableAnalyzer analyzer = new SassVariableAnalyzer();
        for (Document document : new DocumentLoader().load(options.files)) {
            analyzer.accept(document.id(), document.content().toString());
        }
        logger.info("AssetScan: Found {} SASS variables, {} CSS variables",
            analyzer.sassVariables().size(), analyzer.cssVariables().size());

        ReportWriter writer = new ReportWriter(options.output);
        writer.writeText(SassVariableAnalyzer.SASS_FILE, analyzer.renderSass());
        writer.writeText(SassVariableAnalyzer.CSS_FILE, analyzer.renderCss());
        return EXIT_OK;
    }

    private static int cssProperties(CliOptions options) {
        if (options.directories.isEmpty()) {
            return usageError("css-properties requires -d <style dirs...>");
        }

        List<Document> styleFiles = new DocumentLoader().load(
            new CorpusWalker(options.excludes).collect(options.directories, List.of("*.scss", "*.css")));
        logger.info("AssetScan: Found {} scss and css files", styleFiles.size());

        CssPropertyAnalyzer analyzer = new CssPropertyAnalyzer();
        List<CssPropertyAnalyzer.ClassBodyCount> classBodies = analyzer.classBodyCounts(styleFiles);
        List<CssPropertyAnalyzer.PropertyCount> properties = analyzer.propertyCounts(styleFiles);
        logger.info("AssetScan: Found {} distinct class bodies, {} distinct properties",
            classBodies.size(), properties.size());

        ReportWriter writer = new ReportWriter(options.output);
        writer.writeJson(CssPropertyAnalyzer.CLASS_PROPERTIES_FILE, CssPropertyAnalyzer.classBodyRows(classBodies));
        writer.writeJson(CssPropertyAnalyzer.PROPERTIES_FILE, CssPropertyAnalyzer.propertyRows(properties));
        return EXIT_OK;
    }

    private static ScanConfig scanConfig(CliOptions options, MetricRegistry registry) {
        ScanConfig.Builder builder = options.metrics || options.jmx
            ? ScanMetricsConfig.builderWithMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, options.jmx)
            : ScanConfig.builder();
        if (options.parallelism != null) {
            builder.parallelism(options.parallelism);
        }
        return builder.build();
    }

    private static void reportMetrics(MetricRegistry registry) {
        Slf4jReporter.forRegistry(registry)
            .outputTo(LoggerFactory.getLogger("com.axonops.assetscan.metrics"))
            .convertRatesTo(TimeUnit.SECONDS)
            .convertDurationsTo(TimeUnit.MILLISECONDS)
            .build()
            .report();
    }

    private static int usageError(String message) {
        System.err.println("assetscan: " + message);
        System.err.println(USAGE);
        return EXIT_USAGE;
    }
}
