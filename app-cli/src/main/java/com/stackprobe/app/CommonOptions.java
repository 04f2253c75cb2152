package com.stackprobe.app;

import com.stackprobe.core.model.AnalyzerConfig;
import com.stackprobe.core.util.YamlConfigLoader;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;

/** analyze/batch 공통 옵션(-c 설정 파일, -o 출력 루트) */
public class CommonOptions {

    @Option(names = {"-c", "--config"},
            description = "YAML config file (default: ./stackprobe.yml if present)")
    Path configFile;

    @Option(names = {"-o", "--output-dir"},
            description = "Output root directory (overrides output.dir)")
    Path outputDir;

    @Option(names = {"--no-probe"},
            description = "Skip robots.txt/sitemap.xml/... existence probes")
    boolean noProbe;

    /** 설정 파일 → CLI 옵션 덮어쓰기 순으로 AnalyzerConfig 구성 */
    AnalyzerConfig resolveConfig() throws IOException {
        AnalyzerConfig cfg = (configFile != null)
                ? YamlConfigLoader.load(configFile)
                : YamlConfigLoader.loadOrDefaults(Path.of(YamlConfigLoader.DEFAULT_FILE));
        if (outputDir != null) cfg.setOutputDir(outputDir);
        if (noProbe) cfg.setProbeFiles(false);
        return cfg;
    }
}
