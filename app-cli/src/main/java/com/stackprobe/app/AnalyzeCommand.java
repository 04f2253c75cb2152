package com.stackprobe.app;

import com.stackprobe.app.logging.LogSetup;
import com.stackprobe.core.api.IPageFetcher;
import com.stackprobe.core.model.AnalyzerConfig;
import com.stackprobe.core.model.Category;
import com.stackprobe.core.model.SiteRecord;
import com.stackprobe.core.service.SiteAnalysisService;
import com.stackprobe.core.service.SiteRecordBuilder;
import com.stackprobe.core.service.export.SiteRecordJsonWriter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.Callable;

/** stackprobe analyze &lt;url&gt;: 사이트 1건 분석 후 &lt;url-slug&gt;.json 저장 */
@Command(name = "analyze", mixinStandardHelpOptions = true, description = "Analyze a single website")
public class AnalyzeCommand implements Callable<Integer> {

    @ParentCommand
    private StackProbeCli parent;

    @Spec
    private CommandSpec spec;

    @Mixin
    private CommonOptions common;

    @Parameters(index = "0", description = "Target URL (https:// is assumed when no scheme is given)")
    private String url;

    @Override
    public Integer call() throws Exception {
        AnalyzerConfig cfg = common.resolveConfig();
        LogSetup.configure(cfg.getOutputDir());
        PrintWriter out = spec.commandLine().getOut();

        SiteRecord rec;
        try (IPageFetcher fetcher = parent.newFetcher(cfg);
             SiteAnalysisService svc = new SiteAnalysisService(cfg, fetcher, new SiteRecordBuilder(), parent.clock())) {
            rec = svc.analyze(url);
        }
        Path file = new SiteRecordJsonWriter().write(cfg.getOutputDir(), rec);

        out.println("Analyzed: " + rec.getUrl() + (rec.isDegraded() ? " (fetch failed)" : ""));
        for (Category c : Category.values()) {
            Set<String> techs = rec.getTechnologies().get(c);
            if (!techs.isEmpty()) out.println("  " + c.key() + ": " + String.join(", ", techs));
        }
        if (!rec.getMissing().getSecurity().isEmpty())
            out.println("  missing security headers: " + String.join(", ", rec.getMissing().getSecurity()));
        out.println("Saved: " + file);
        out.flush();
        return ExitCodes.OK;
    }
}
