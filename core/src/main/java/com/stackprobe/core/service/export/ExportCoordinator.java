package com.stackprobe.core.service.export;

import com.stackprobe.core.model.BatchSummary;
import com.stackprobe.core.model.SiteRecord;
import com.stackprobe.core.service.Aggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 배치 디렉터리 단위 출력 조정:
 *  - 사이트별 JSON 저장
 *  - 집계 후 summary.json + summary_report.txt 저장
 *  - 기존 디렉터리에서 재집계(summarize)
 */
public final class ExportCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(ExportCoordinator.class);

    private final SiteRecordJsonWriter siteWriter;
    private final SiteRecordJsonReader siteReader;
    private final List<ReportExporter> summaryExporters;
    private final Aggregator aggregator;

    public ExportCoordinator(Aggregator aggregator) {
        this(aggregator, new SiteRecordJsonWriter(), new SiteRecordJsonReader(),
                List.of(new BatchSummaryJsonWriter(), new SummaryTextReporter()));
    }

    public ExportCoordinator(Aggregator aggregator,
                             SiteRecordJsonWriter siteWriter,
                             SiteRecordJsonReader siteReader,
                             List<ReportExporter> summaryExporters) {
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.siteWriter = Objects.requireNonNull(siteWriter, "siteWriter");
        this.siteReader = Objects.requireNonNull(siteReader, "siteReader");
        this.summaryExporters = List.copyOf(summaryExporters);
    }

    /** 사이트 JSON들을 저장하고 경로 목록(입력 순서)을 돌려준다 */
    public List<Path> writeSites(Path batchDir, List<SiteRecord> records) throws IOException {
        Files.createDirectories(batchDir);
        List<Path> out = new ArrayList<>(records.size());
        for (SiteRecord r : records) out.add(siteWriter.write(batchDir, r));
        return out;
    }

    /** 집계 + 요약 파일 출력. 레코드가 없으면 EmptyBatchException */
    public BatchSummary writeSummary(Path batchDir, String batchId, List<SiteRecord> records) throws IOException {
        BatchSummary summary = aggregator.summarize(batchId, records);
        for (ReportExporter ex : summaryExporters) {
            Path p = ex.export(batchDir, summary);
            LOG.info("Summary written: {}", p);
        }
        return summary;
    }

    /**
     * 디렉터리의 사이트 JSON을 다시 읽어 요약을 재생성.
     * 배치 ID는 디렉터리명(tech_stack_batch_&lt;id&gt;)에서, 없으면 시계 기준으로 만든다.
     */
    public BatchSummary resummarize(Path batchDir) throws IOException {
        List<SiteRecord> records = siteReader.readBatchDir(batchDir);
        String batchId = ReportNaming.batchIdOf(batchDir).orElseGet(aggregator::newBatchId);
        LOG.info("Re-summarizing {} site records in {}", records.size(), batchDir);
        return writeSummary(batchDir, batchId, records);
    }
}
