package com.stackprobe.app;

import com.stackprobe.app.logging.LogSetup;
import com.stackprobe.core.model.BatchSummary;
import com.stackprobe.core.service.Aggregator;
import com.stackprobe.core.service.export.ExportCoordinator;
import com.stackprobe.core.service.export.ReportNaming;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/** stackprobe summarize &lt;batch-dir&gt;: 사이트 JSON에서 summary.json / summary_report.txt 재생성 */
@Command(name = "summarize", mixinStandardHelpOptions = true,
        description = "Rebuild summary.json and summary_report.txt from a batch directory")
public class SummarizeCommand implements Callable<Integer> {

    @ParentCommand
    private StackProbeCli parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Batch directory containing per-site JSON files")
    private Path batchDir;

    @Override
    public Integer call() throws Exception {
        if (!Files.isDirectory(batchDir)) throw new IOException("Directory not found: " + batchDir);
        Path root = batchDir.toAbsolutePath().getParent();
        LogSetup.configure(root != null ? root : batchDir);

        BatchSummary summary = new ExportCoordinator(new Aggregator(parent.clock())).resummarize(batchDir);

        PrintWriter out = spec.commandLine().getOut();
        out.println("Summarized " + summary.getTotalSites() + " sites (batch " + summary.getBatchId() + ")");
        out.println("  " + batchDir.resolve(ReportNaming.SUMMARY_JSON));
        out.println("  " + batchDir.resolve(ReportNaming.SUMMARY_REPORT));
        out.flush();
        return ExitCodes.OK;
    }
}
