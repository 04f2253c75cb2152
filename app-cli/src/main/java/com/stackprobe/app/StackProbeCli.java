package com.stackprobe.app;

import com.stackprobe.core.api.IPageFetcher;
import com.stackprobe.core.http.HttpPageFetcher;
import com.stackprobe.core.model.AnalyzerConfig;
import com.stackprobe.core.model.EmptyBatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.time.Clock;
import java.util.Objects;
import java.util.function.Function;

/**
 * StackProbe CLI 진입점.
 *
 * <pre>
 * stackprobe analyze example.com -o out
 * stackprobe batch urls.txt -j 5
 * stackprobe summarize tech_stack_batch_20240101_120000
 * </pre>
 */
@Command(
        name = "stackprobe",
        mixinStandardHelpOptions = true,
        version = "StackProbe 0.1.0",
        description = "Fingerprints website technology stacks and aggregates batch statistics",
        subcommands = {
                AnalyzeCommand.class,
                BatchCommand.class,
                SummarizeCommand.class,
                CommandLine.HelpCommand.class
        }
)
public class StackProbeCli implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(StackProbeCli.class);

    private final Function<AnalyzerConfig, IPageFetcher> fetcherFactory;
    private final Clock clock;

    public StackProbeCli() {
        this(HttpPageFetcher::new, Clock.systemDefaultZone());
    }

    /** 테스트용: fetch 협력자/시계 주입 */
    public StackProbeCli(Function<AnalyzerConfig, IPageFetcher> fetcherFactory, Clock clock) {
        this.fetcherFactory = Objects.requireNonNull(fetcherFactory, "fetcherFactory");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    IPageFetcher newFetcher(AnalyzerConfig cfg) { return fetcherFactory.apply(cfg); }
    Clock clock() { return clock; }

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    /** 예외 → 종료 코드 매핑이 설정된 CommandLine */
    public static CommandLine commandLine(StackProbeCli root) {
        CommandLine cl = new CommandLine(root);
        cl.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof EmptyBatchException) {
                commandLine.getErr().println("Error: " + ex.getMessage());
                return ExitCodes.EMPTY_BATCH;
            }
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Error: " + ex.getMessage());
                return ExitCodes.USAGE;
            }
            LOG.error("Command failed", ex);
            commandLine.getErr().println("Error: " + ex.getMessage());
            return ExitCodes.FAILURE;
        });
        return cl;
    }

    public static void main(String[] args) {
        int code = commandLine(new StackProbeCli()).execute(args);
        System.exit(code);
    }
}
