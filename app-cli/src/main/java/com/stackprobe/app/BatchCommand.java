package com.stackprobe.app;

import com.stackprobe.app.logging.LogSetup;
import com.stackprobe.core.api.IPageFetcher;
import com.stackprobe.core.model.AnalyzerConfig;
import com.stackprobe.core.model.BatchSummary;
import com.stackprobe.core.model.SiteRecord;
import com.stackprobe.core.service.Aggregator;
import com.stackprobe.core.service.BatchAnalysisService;
import com.stackprobe.core.service.SiteAnalysisService;
import com.stackprobe.core.service.SiteRecordBuilder;
import com.stackprobe.core.service.export.ExportCoordinator;
import com.stackprobe.core.service.export.ReportNaming;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * stackprobe batch &lt;urls-file&gt;:
 * tech_stack_batch_&lt;id&gt;/ 아래에 사이트별 JSON + summary.json + summary_report.txt 생성
 */
@Command(name = "batch", mixinStandardHelpOptions = true, description = "Analyze every URL listed in a file")
public class BatchCommand implements Callable<Integer> {

    @ParentCommand
    private StackProbeCli parent;

    @Spec
    private CommandSpec spec;

    @Mixin
    private CommonOptions common;

    @Parameters(index = "0", description = "File with one URL per line ('#' comments and blank lines are skipped)")
    private Path urlsFile;

    @Option(names = {"-j", "--jobs"}, description = "Parallel jobs, 1..10 (overrides parallelJobs)")
    private Integer jobs;

    @Override
    public Integer call() throws Exception {
        AnalyzerConfig cfg = common.resolveConfig();
        if (jobs != null) cfg.setParallelJobs(jobs);
        cfg.validate();

        List<String> urls = UrlListReader.read(urlsFile);
        PrintWriter out = spec.commandLine().getOut();

        Aggregator aggregator = new Aggregator(parent.clock());
        String batchId = aggregator.newBatchId();
        Path batchDir = ReportNaming.batchDir(cfg.getOutputDir(), batchId);
        Files.createDirectories(batchDir);
        LogSetup.configure(cfg.getOutputDir());

        out.println("Batch ID: " + batchId);
        out.println("Input:    " + urlsFile);
        out.println("Output:   " + batchDir);
        out.println("Processing " + urls.size() + " URLs...");
        out.flush();

        List<SiteRecord> records;
        try (IPageFetcher fetcher = parent.newFetcher(cfg);
             SiteAnalysisService site = new SiteAnalysisService(cfg, fetcher, new SiteRecordBuilder(), parent.clock())) {
            BatchAnalysisService batch = new BatchAnalysisService(cfg, site);
            records = batch.analyzeAll(batchId, urls, (done, total, url, degraded) -> {
                synchronized (out) {
                    out.println("[" + done + "/" + total + "] " + url + (degraded ? "  (failed)" : "  (ok)"));
                    out.flush();
                }
            });
        }

        ExportCoordinator export = new ExportCoordinator(aggregator);
        export.writeSites(batchDir, records);
        BatchSummary summary = export.writeSummary(batchDir, batchId, records);

        out.println("Batch complete: " + summary.getTotalSites() + " sites -> " + batchDir);
        out.flush();
        return ExitCodes.OK;
    }
}
